package com.purchasingpower.kgengine.model.graph;

import com.purchasingpower.kgengine.core.ActivityNode;
import com.purchasingpower.kgengine.core.ConceptNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A Concept with its similar Concepts and the Activities it was learned from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConceptDetails {
    private ConceptNode concept;
    private List<RelatedConcept> related;
    private List<ActivityNode> activities;

    public record RelatedConcept(String name, String relationshipType, double similarity) {
    }
}
