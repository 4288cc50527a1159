package com.purchasingpower.kgengine.knowledge;

import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.GraphStoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for the knowledge graph.
 *
 * <p>Writes are additive: nodes and edges are created, never updated or deleted.
 * Failures surface as {@link GraphStoreException}.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    /**
     * Create a node unless one with the same id already exists.
     *
     * @param properties must contain {@code id}
     * @return the stored node (the existing one when the id was taken)
     */
    GraphNode createNode(NodeLabel label, Map<String, Object> properties);

    /**
     * Create an edge unless one of the same type already links the endpoints.
     *
     * @throws GraphStoreException if either endpoint does not exist
     */
    EdgeWriteOutcome createRelationship(RelationshipRequest request);

    /**
     * Run a named query. Row shapes are listed on {@link GraphQueryKind}.
     */
    List<Map<String, Object>> query(GraphQuery query);

    /**
     * Neighbours of a node in either direction.
     *
     * @param neighbourLabel   label of the neighbours, or null for any
     * @param relationshipType edge type, or null for any
     */
    List<RelatedNode> getRelatedNodes(String nodeId, NodeLabel neighbourLabel,
                                      RelationshipType relationshipType, int limit);

    Optional<GraphNode> getNodeById(String nodeId, NodeLabel label);

    GraphStats getGraphStats();
}
