package com.openforge.taskcore.index;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link TemplateVectorSearch} backed by the Milvus template index.
 *
 * Milvus reports COSINE hits as similarity scores; they are turned back into
 * distances here so the resolver sees the same {@code 1 - distance} contract
 * regardless of backend. Search failures propagate to the caller.
 */
@Slf4j
@Service
public class MilvusTemplateVectorSearch implements TemplateVectorSearch {

    private static final int MAX_TOP_K = 50;

    @Nullable
    private final MilvusClientV2            milvusClient;
    private final TemplateCollectionManager collectionManager;

    public MilvusTemplateVectorSearch(@Nullable MilvusClientV2 milvusClient,
                                      TemplateCollectionManager collectionManager) {
        this.milvusClient      = milvusClient;
        this.collectionManager = collectionManager;
    }

    @Override
    public boolean isAvailable() {
        if (milvusClient == null) return false;
        try {
            return collectionManager.ensureCollection();
        } catch (RuntimeException e) {
            log.warn("[Milvus] Template index not reachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<NeighborHit> nearestNeighbors(VectorField field, List<Float> queryVector, int k) {
        if (milvusClient == null) {
            throw new IllegalStateException("Milvus is not connected");
        }
        SearchResp resp = milvusClient.search(SearchReq.builder()
                .collectionName(collectionManager.collectionName())
                .data(List.of(new FloatVec(queryVector)))
                .annsField(field.fieldName())
                .topK(Math.min(k, MAX_TOP_K))
                .filter(TemplateCollectionManager.FIELD_ENABLED + " == true")
                .outputFields(List.of(TemplateCollectionManager.FIELD_TEMPLATE_ID))
                .build());
        if (resp == null || resp.getSearchResults() == null) return List.of();

        List<NeighborHit> hits = new ArrayList<>();
        for (List<SearchResp.SearchResult> row : resp.getSearchResults()) {
            for (SearchResp.SearchResult hit : row) {
                String templateId = templateIdOf(hit);
                if (templateId == null) continue;
                Float score = hit.getScore();
                hits.add(new NeighborHit(templateId, score == null ? null : 1.0 - score));
            }
        }
        log.debug("[Milvus] {} search returned {} hits", field, hits.size());
        return hits;
    }

    private static String templateIdOf(SearchResp.SearchResult hit) {
        Object id = hit.getEntity() != null
                ? hit.getEntity().get(TemplateCollectionManager.FIELD_TEMPLATE_ID)
                : null;
        if (id == null) id = hit.getId();
        return id == null || id.toString().isBlank() ? null : id.toString();
    }
}
