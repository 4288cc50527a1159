package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RelationshipRequest {
    String fromId;
    NodeLabel fromLabel;
    String toId;
    NodeLabel toLabel;
    RelationshipType type;

    @Builder.Default
    Map<String, Object> properties = Map.of();

    public String describe() {
        return fromId + " -[" + type + "]-> " + toId;
    }
}
