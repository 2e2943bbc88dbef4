package com.openforge.taskcore.index;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.response.SearchResp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MilvusTemplateVectorSearchTest {

    private static final List<Float> QUERY = List.of(0.5f, 0.5f);

    private MilvusClientV2 milvusClient;
    private TemplateCollectionManager collectionManager;
    private MilvusTemplateVectorSearch search;

    @BeforeEach
    void setUp() {
        milvusClient = mock(MilvusClientV2.class);
        collectionManager = mock(TemplateCollectionManager.class);
        when(collectionManager.collectionName()).thenReturn("task_templates_index");
        when(collectionManager.ensureCollection()).thenReturn(true);
        search = new MilvusTemplateVectorSearch(milvusClient, collectionManager);
    }

    private static SearchResp.SearchResult hit(String templateId, Float score) {
        SearchResp.SearchResult result = mock(SearchResp.SearchResult.class);
        when(result.getEntity()).thenReturn(Map.of(TemplateCollectionManager.FIELD_TEMPLATE_ID, templateId));
        when(result.getScore()).thenReturn(score);
        return result;
    }

    private void givenResults(List<SearchResp.SearchResult> hits) {
        SearchResp resp = mock(SearchResp.class);
        when(resp.getSearchResults()).thenReturn(List.of(hits));
        when(milvusClient.search(any(SearchReq.class))).thenReturn(resp);
    }

    @Test
    @DisplayName("Cosine scores come back as distances, closest first")
    void convertsScoresToDistances() {
        givenResults(List.of(hit("tpl-a", 0.92f), hit("tpl-b", 0.60f)));

        List<NeighborHit> hits = search.nearestNeighbors(VectorField.NAME, QUERY, 5);

        assertEquals(2, hits.size());
        assertEquals("tpl-a", hits.get(0).templateId());
        assertEquals(0.08, hits.get(0).distance(), 1e-6);
        assertEquals(0.92, hits.get(0).similarity(), 1e-6);
        assertEquals(0.40, hits.get(1).distance(), 1e-6);
    }

    @Test
    void missingScoreBecomesMissingDistance() {
        givenResults(List.of(hit("tpl-a", null)));

        NeighborHit only = search.nearestNeighbors(VectorField.FULL_TEXT, QUERY, 5).get(0);

        assertFalse(only.hasDistance());
        assertEquals(0.0, only.similarity());
    }

    @Test
    void searchesTheRequestedFieldOverEnabledTemplates() {
        givenResults(List.of());

        search.nearestNeighbors(VectorField.FULL_TEXT, QUERY, 5);

        ArgumentCaptor<SearchReq> request = ArgumentCaptor.forClass(SearchReq.class);
        verify(milvusClient).search(request.capture());
        assertEquals("embedding", request.getValue().getAnnsField());
        assertEquals("enabled == true", request.getValue().getFilter());
        assertEquals("task_templates_index", request.getValue().getCollectionName());
    }

    @Test
    void searchFailuresPropagate() {
        when(milvusClient.search(any(SearchReq.class))).thenThrow(new RuntimeException("milvus down"));

        assertThrows(RuntimeException.class, () -> search.nearestNeighbors(VectorField.NAME, QUERY, 5));
    }

    @Test
    void unavailableWithoutClient() {
        MilvusTemplateVectorSearch disconnected = new MilvusTemplateVectorSearch(null, collectionManager);

        assertFalse(disconnected.isAvailable());
        assertThrows(IllegalStateException.class,
                () -> disconnected.nearestNeighbors(VectorField.NAME, QUERY, 5));
        assertTrue(search.isAvailable());
    }
}
