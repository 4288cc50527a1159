package com.purchasingpower.kgengine.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.kgengine.core.GraphNode;
import com.purchasingpower.kgengine.core.GraphRelationship;
import com.purchasingpower.kgengine.core.NodeLabel;
import com.purchasingpower.kgengine.core.RelationshipType;
import com.purchasingpower.kgengine.exception.GraphStoreException;
import com.purchasingpower.kgengine.knowledge.EdgeWriteOutcome;
import com.purchasingpower.kgengine.knowledge.GraphQuery;
import com.purchasingpower.kgengine.knowledge.GraphQueryKind;
import com.purchasingpower.kgengine.knowledge.GraphRows;
import com.purchasingpower.kgengine.knowledge.GraphStats;
import com.purchasingpower.kgengine.knowledge.GraphStore;
import com.purchasingpower.kgengine.knowledge.RelatedNode;
import com.purchasingpower.kgengine.knowledge.RelationshipRequest;
import com.purchasingpower.kgengine.model.CallContext;
import com.purchasingpower.kgengine.model.ServiceType;
import com.purchasingpower.kgengine.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Neo4j implementation of GraphStore.
 *
 * <p>Nodes and edges are written with {@code MERGE ... ON CREATE SET}, so repeated writes
 * are no-ops; the update counters tell a new edge from an existing one.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.graph", name = "store", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final Map<GraphQueryKind, String> NAMED_QUERIES = new EnumMap<>(GraphQueryKind.class);

    static {
        NAMED_QUERIES.put(GraphQueryKind.CONCEPTS_FOR_ACTIVITY, """
            MATCH (a:Activity {id: $activityId})-[:LEARNED_FROM]-(c:Concept)
            RETURN DISTINCT c.id AS conceptId
            """);
        NAMED_QUERIES.put(GraphQueryKind.ALL_CONCEPTS, """
            MATCH (c:Concept)
            RETURN c.id AS id, c.name AS name
            ORDER BY c.id
            """);
        NAMED_QUERIES.put(GraphQueryKind.ACTIVITIES_FOR_CONCEPT, """
            MATCH (c:Concept {id: $conceptId})-[:LEARNED_FROM]-(a:Activity)
            RETURN DISTINCT a
            ORDER BY a.timestamp, a.id
            """);
        NAMED_QUERIES.put(GraphQueryKind.ALL_RELATIONSHIPS, """
            MATCH (a)-[r]->(b)
            RETURN a, r, b
            LIMIT $limit
            """);
        NAMED_QUERIES.put(GraphQueryKind.TOPICS_WITH_CONCEPTS, """
            MATCH (t:Topic)
            OPTIONAL MATCH (t)-[:CONTAINS]->(c:Concept)
            RETURN t.id AS topicId, coalesce(t.name, t.id) AS topicName, collect(c.name) AS concepts
            ORDER BY t.id
            """);
        // Variable-length bounds cannot be parameters; depth is validated by GraphQuery.NodeSubgraph
        NAMED_QUERIES.put(GraphQueryKind.NODE_SUBGRAPH, """
            MATCH path = (start {id: $nodeId})-[*1..%d]-(connected)
            UNWIND relationships(path) AS rel
            WITH DISTINCT rel
            LIMIT $limit
            RETURN startNode(rel) AS a, rel AS r, endNode(rel) AS b
            """);
    }

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    private Driver driver;

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX activity_id IF NOT EXISTS FOR (a:Activity) ON (a.id)");
            session.run("CREATE INDEX concept_id IF NOT EXISTS FOR (c:Concept) ON (c.id)");
            session.run("CREATE INDEX concept_name IF NOT EXISTS FOR (c:Concept) ON (c.name)");
            session.run("CREATE INDEX topic_id IF NOT EXISTS FOR (t:Topic) ON (t.id)");
            log.info("✅ Neo4j property indexes created");
        } catch (Exception e) {
            // The store still works without indexes, only slower
            log.warn("⚠️  Failed to create indexes: {}", e.getMessage());
        }
    }

    @Override
    public GraphNode createNode(NodeLabel label, Map<String, Object> properties) {
        Object id = properties.get("id");
        Preconditions.checkArgument(id != null, "Node properties must contain an id");

        String cypher = String.format("""
            MERGE (n:%s {id: $id})
            ON CREATE SET n += $properties
            RETURN n
            """, label.getLabel());

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "CreateNode", log);
        callCtx.logRequest(label.getLabel() + " " + id, "properties", ExternalCallLogger.formatMap(properties));
        try (Session session = driver.session()) {
            GraphNode node = session.executeWrite(tx -> {
                Result result = tx.run(cypher, createParams("id", id, "properties", withoutNulls(properties)));
                return toGraphNode(result.single().get("n").asNode());
            });
            callCtx.logResponse(node.id());
            return node;
        } catch (Exception e) {
            callCtx.logError("Failed to create node " + id, e);
            throw new GraphStoreException("Failed to create " + label.getLabel() + " node " + id, e);
        }
    }

    @Override
    public EdgeWriteOutcome createRelationship(RelationshipRequest request) {
        String cypher = String.format("""
            MATCH (from:%s {id: $fromId})
            MATCH (to:%s {id: $toId})
            MERGE (from)-[r:%s]-%s(to)
            ON CREATE SET r += $properties
            RETURN type(r) AS type
            """, request.getFromLabel().getLabel(), request.getToLabel().getLabel(), request.getType().name(),
            request.getType().isSymmetric() ? "" : ">");

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "CreateRelationship", log);
        callCtx.logRequest(request.describe());

        EdgeWriteOutcome outcome;
        try (Session session = driver.session()) {
            outcome = session.executeWrite(tx -> {
                Result result = tx.run(cypher, createParams(
                    "fromId", request.getFromId(),
                    "toId", request.getToId(),
                    "properties", withoutNulls(request.getProperties())
                ));
                if (result.list().isEmpty()) {
                    return null;
                }
                int created = result.consume().counters().relationshipsCreated();
                return created > 0 ? EdgeWriteOutcome.CREATED : EdgeWriteOutcome.ALREADY_EXISTS;
            });
        } catch (Exception e) {
            callCtx.logError("Failed to create relationship " + request.describe(), e);
            throw new GraphStoreException("Failed to create relationship " + request.describe(), e);
        }

        if (outcome == null) {
            callCtx.logError("Endpoint not found", null);
            throw new GraphStoreException("Cannot create relationship " + request.describe()
                + ": source or target node does not exist");
        }
        callCtx.logResponse(outcome.name());
        return outcome;
    }

    @Override
    public List<Map<String, Object>> query(GraphQuery query) {
        GraphQueryKind kind = query.kind();
        String cypher = NAMED_QUERIES.get(kind);
        if (query instanceof GraphQuery.NodeSubgraph subgraph) {
            cypher = String.format(cypher, subgraph.depth());
        }
        String statement = cypher;

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, kind.name(), log);
        callCtx.logRequest(null, "parameters", ExternalCallLogger.formatMap(query.parameters()));
        try (Session session = driver.session()) {
            List<Map<String, Object>> rows = session.executeRead(tx -> {
                Result result = tx.run(statement, query.parameters());
                List<Map<String, Object>> converted = new ArrayList<>();
                while (result.hasNext()) {
                    converted.add(toRow(kind, result.next()));
                }
                return converted;
            });
            callCtx.logResponse(rows.size() + " rows");
            return rows;
        } catch (Exception e) {
            callCtx.logError("Query " + kind + " failed", e);
            throw new GraphStoreException("Graph query " + kind + " failed", e);
        }
    }

    @Override
    public List<RelatedNode> getRelatedNodes(String nodeId, NodeLabel neighbourLabel,
                                             RelationshipType relationshipType, int limit) {
        String neighbour = neighbourLabel != null ? "m:" + neighbourLabel.getLabel() : "m";
        String cypher = String.format("""
            MATCH (n {id: $nodeId})-[r]-(%s)
            WHERE $type IS NULL OR type(r) = $type
            RETURN m, type(r) AS relType, properties(r) AS relProps
            LIMIT $limit
            """, neighbour);

        Map<String, Object> params = new HashMap<>();
        params.put("nodeId", nodeId);
        params.put("type", relationshipType != null ? relationshipType.name() : null);
        params.put("limit", limit);

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "RelatedNodes", log);
        callCtx.logRequest(nodeId, "parameters", ExternalCallLogger.formatMap(params));
        try (Session session = driver.session()) {
            List<RelatedNode> related = session.executeRead(tx -> {
                Result result = tx.run(cypher, params);
                List<RelatedNode> rows = new ArrayList<>();
                while (result.hasNext()) {
                    Record record = result.next();
                    rows.add(new RelatedNode(
                        toGraphNode(record.get("m").asNode()),
                        record.get("relType").asString(),
                        record.get("relProps").asMap()));
                }
                return rows;
            });
            callCtx.logResponse(related.size() + " neighbours");
            return related;
        } catch (Exception e) {
            callCtx.logError("Failed to load neighbours of " + nodeId, e);
            throw new GraphStoreException("Failed to load neighbours of " + nodeId, e);
        }
    }

    @Override
    public Optional<GraphNode> getNodeById(String nodeId, NodeLabel label) {
        String cypher = String.format("MATCH (n:%s {id: $id}) RETURN n LIMIT 1", label.getLabel());

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "GetNode", log);
        callCtx.logRequest(label.getLabel() + " " + nodeId);
        try (Session session = driver.session()) {
            Optional<GraphNode> node = session.executeRead(tx -> {
                Result result = tx.run(cypher, Collections.singletonMap("id", nodeId));
                if (result.hasNext()) {
                    return Optional.of(toGraphNode(result.next().get("n").asNode()));
                }
                return Optional.<GraphNode>empty();
            });
            callCtx.logResponse(node.isPresent() ? "found" : "not found");
            return node;
        } catch (Exception e) {
            callCtx.logError("Failed to load node " + nodeId, e);
            throw new GraphStoreException("Failed to load node " + nodeId, e);
        }
    }

    @Override
    public GraphStats getGraphStats() {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "GraphStats", log);
        callCtx.logRequest(null);
        try (Session session = driver.session()) {
            GraphStats stats = session.executeRead(tx -> {
                Map<String, Long> nodes = new LinkedHashMap<>();
                Result nodeResult = tx.run("""
                    MATCH (n)
                    RETURN labels(n)[0] AS label, count(*) AS count
                    ORDER BY label
                    """);
                while (nodeResult.hasNext()) {
                    Record record = nodeResult.next();
                    nodes.put(record.get("label").asString("unlabelled"), record.get("count").asLong());
                }

                Map<String, Long> relationships = new LinkedHashMap<>();
                Result relResult = tx.run("""
                    MATCH ()-[r]->()
                    RETURN type(r) AS type, count(*) AS count
                    ORDER BY type
                    """);
                while (relResult.hasNext()) {
                    Record record = relResult.next();
                    relationships.put(record.get("type").asString(), record.get("count").asLong());
                }
                return new GraphStats(nodes, relationships);
            });
            callCtx.logResponse(stats.totalNodes() + " nodes, " + stats.totalRelationships() + " relationships");
            return stats;
        } catch (Exception e) {
            callCtx.logError("Failed to read graph stats", e);
            throw new GraphStoreException("Failed to read graph statistics", e);
        }
    }

    private Map<String, Object> toRow(GraphQueryKind kind, Record record) {
        Map<String, Object> row = new HashMap<>();
        switch (kind) {
            case CONCEPTS_FOR_ACTIVITY -> row.put(GraphRows.CONCEPT_ID, record.get("conceptId").asString());
            case ALL_CONCEPTS -> {
                row.put(GraphRows.ID, record.get("id").asString());
                row.put(GraphRows.NAME, record.get("name").asString(null));
            }
            case ACTIVITIES_FOR_CONCEPT -> row.put(GraphRows.ACTIVITY, toGraphNode(record.get("a").asNode()));
            case ALL_RELATIONSHIPS, NODE_SUBGRAPH -> {
                Relationship rel = record.get("r").asRelationship();
                row.put(GraphRows.RELATIONSHIP, new GraphRelationship(
                    toGraphNode(record.get("a").asNode()),
                    toGraphNode(record.get("b").asNode()),
                    rel.type(),
                    rel.asMap()));
            }
            case TOPICS_WITH_CONCEPTS -> {
                row.put(GraphRows.TOPIC_ID, record.get("topicId").asString());
                row.put(GraphRows.TOPIC_NAME, record.get("topicName").asString());
                row.put(GraphRows.CONCEPTS, record.get("concepts").asList(v -> v.asString()));
            }
            default -> throw new IllegalStateException("Unhandled query kind: " + kind);
        }
        return row;
    }

    private GraphNode toGraphNode(Node node) {
        Iterator<String> labels = node.labels().iterator();
        String label = labels.hasNext() ? labels.next() : null;
        return new GraphNode(node.get("id").asString(null), label, node.asMap());
    }

    /**
     * Neo4j rejects null property values.
     */
    private Map<String, Object> withoutNulls(Map<String, Object> properties) {
        Map<String, Object> cleaned = new HashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                cleaned.put(key, value);
            }
        });
        return cleaned;
    }

    private Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            String key = (String) keyValues[i];
            Object value = keyValues[i + 1];
            params.put(key, value != null ? value : "");
        }
        return params;
    }
}
