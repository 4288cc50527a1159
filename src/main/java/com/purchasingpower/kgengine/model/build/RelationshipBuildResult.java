package com.purchasingpower.kgengine.model.build;

import com.purchasingpower.kgengine.core.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one relationship pass. Only newly created edges count in {@code relationshipsCreated}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipBuildResult {
    private RelationshipType relationshipType;
    private int embeddingsScanned;
    private long pairsCompared;
    private int qualifyingPairs;
    private int relationshipsCreated;
    private int alreadyExisting;
    private int failures;
    private long durationMs;

    public static RelationshipBuildResult empty(RelationshipType type, int embeddingsScanned) {
        return RelationshipBuildResult.builder()
            .relationshipType(type)
            .embeddingsScanned(embeddingsScanned)
            .build();
    }
}
