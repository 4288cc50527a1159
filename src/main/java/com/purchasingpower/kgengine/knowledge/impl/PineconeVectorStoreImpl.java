package com.purchasingpower.kgengine.knowledge.impl;

import com.google.common.base.Preconditions;
import com.google.protobuf.Value;
import com.purchasingpower.kgengine.configuration.AppProperties;
import com.purchasingpower.kgengine.core.EmbeddingRecord;
import com.purchasingpower.kgengine.exception.EmbeddingRetrievalException;
import com.purchasingpower.kgengine.knowledge.VectorStore;
import com.purchasingpower.kgengine.model.CallContext;
import com.purchasingpower.kgengine.model.ServiceType;
import com.purchasingpower.kgengine.util.ExternalCallLogger;
import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pinecone-backed VectorStore.
 *
 * <p>Vector ids of the namespace are listed page by page, then fetched with their metadata.
 * Metadata keys written by the ingestion pipeline: {@code activity_id}, {@code title},
 * {@code source_type}.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class PineconeVectorStoreImpl implements VectorStore {

    static final String META_ACTIVITY_ID = "activity_id";
    static final String META_TITLE = "title";
    static final String META_SOURCE_TYPE = "source_type";

    /** Pinecone caps list pages at 100 ids. */
    private static final int LIST_PAGE_SIZE = 100;

    private final Pinecone client;
    private final String indexName;
    private final String namespace;

    public PineconeVectorStoreImpl(AppProperties props) {
        this.client = new Pinecone.Builder(props.getPinecone().getApiKey()).build();
        this.indexName = props.getPinecone().getIndexName();
        this.namespace = props.getPinecone().getNamespace();
    }

    @Override
    public List<EmbeddingRecord> getAllEmbeddings(int limit) {
        Preconditions.checkArgument(limit >= 1, "limit must be >= 1, got %s", limit);

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "FetchAllEmbeddings", log);
        callCtx.logRequest("Listing embeddings", "Index", indexName, "Namespace", namespace, "Limit", limit);
        try {
            var index = client.getIndexConnection(indexName);

            List<String> ids = new ArrayList<>();
            String paginationToken = null;
            do {
                int pageSize = Math.min(LIST_PAGE_SIZE, limit - ids.size());
                var page = paginationToken == null
                    ? index.list(namespace, pageSize)
                    : index.list(namespace, pageSize, paginationToken);
                page.getVectorsList().forEach(item -> ids.add(item.getId()));
                paginationToken = page.hasPagination() && !page.getPagination().getNext().isEmpty()
                    ? page.getPagination().getNext()
                    : null;
            } while (paginationToken != null && ids.size() < limit);

            if (ids.isEmpty()) {
                callCtx.logResponse("No embeddings in namespace");
                return List.of();
            }

            List<EmbeddingRecord> records = new ArrayList<>();
            for (int from = 0; from < ids.size(); from += LIST_PAGE_SIZE) {
                List<String> batch = ids.subList(from, Math.min(ids.size(), from + LIST_PAGE_SIZE));
                var response = index.fetch(batch, namespace);
                for (String id : batch) {
                    var vector = response.getVectorsMap().get(id);
                    if (vector != null) {
                        records.add(toRecord(id, vector.getValuesList(), vector.getMetadata().getFieldsMap()));
                    }
                }
            }

            callCtx.logResponse("Embeddings fetched", "Listed", ids.size(), "Fetched", records.size());
            return records;
        } catch (Exception e) {
            callCtx.logError("Failed to retrieve embeddings", e);
            throw new EmbeddingRetrievalException("Failed to retrieve embeddings from Pinecone index " + indexName, e);
        }
    }

    @Override
    public Optional<EmbeddingRecord> getEmbeddingById(String id) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.PINECONE, "FetchEmbedding", log);
        callCtx.logRequest("Fetching embedding", "Vector ID", id);
        try {
            var response = client.getIndexConnection(indexName).fetch(List.of(id), namespace);
            if (response == null || !response.getVectorsMap().containsKey(id)) {
                callCtx.logResponse("Embedding not found");
                return Optional.empty();
            }
            var vector = response.getVectorsMap().get(id);
            callCtx.logResponse("Embedding found");
            return Optional.of(toRecord(id, vector.getValuesList(), vector.getMetadata().getFieldsMap()));
        } catch (Exception e) {
            callCtx.logError("Failed to fetch embedding " + id, e);
            throw new EmbeddingRetrievalException("Failed to fetch embedding " + id, e);
        }
    }

    static EmbeddingRecord toRecord(String id, List<Float> values, Map<String, Value> metadata) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }

        Map<String, String> attributes = new HashMap<>();
        metadata.forEach((key, value) -> {
            String text = asText(value);
            if (text != null) {
                attributes.put(key, text);
            }
        });

        return EmbeddingRecord.builder()
            .id(id)
            .vector(vector)
            .ownerActivityId(attributes.get(META_ACTIVITY_ID))
            .title(attributes.get(META_TITLE))
            .sourceType(attributes.get(META_SOURCE_TYPE))
            .attributes(Map.copyOf(attributes))
            .build();
    }

    private static String asText(Value value) {
        switch (value.getKindCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case NUMBER_VALUE:
                double number = value.getNumberValue();
                // activity ids arrive as numbers when the ingestion side used integer keys
                return number == Math.rint(number) ? Long.toString((long) number) : Double.toString(number);
            case BOOL_VALUE:
                return Boolean.toString(value.getBoolValue());
            default:
                return null;
        }
    }
}
