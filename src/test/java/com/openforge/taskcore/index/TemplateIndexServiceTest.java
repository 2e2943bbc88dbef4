package com.openforge.taskcore.index;

import com.google.gson.JsonObject;
import com.openforge.taskcore.domain.ParameterSchema;
import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.embedding.EmbeddingClient;
import com.openforge.taskcore.embedding.EmbeddingMode;
import com.openforge.taskcore.embedding.EmbeddingService;
import com.openforge.taskcore.repository.TaskTemplateRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.InsertReq;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TemplateIndexServiceTest {

    private MilvusClientV2 milvusClient;
    private EmbeddingService embeddingService;
    private TemplateCollectionManager collectionManager;
    private TaskTemplateRepository repository;
    private TemplateIndexService indexService;

    @BeforeEach
    void setUp() {
        milvusClient = mock(MilvusClientV2.class);
        embeddingService = mock(EmbeddingService.class);
        collectionManager = mock(TemplateCollectionManager.class);
        repository = mock(TaskTemplateRepository.class);
        when(collectionManager.collectionName()).thenReturn("task_templates_index");
        when(collectionManager.ensureCollection()).thenReturn(true);
        indexService = new TemplateIndexService(milvusClient, embeddingService, collectionManager, repository);
    }

    private static TaskTemplate invoiceTemplate() {
        Map<String, ParameterSchema.PropertySpec> props = new LinkedHashMap<>();
        props.put("customerId", new ParameterSchema.PropertySpec("string", null, null));
        props.put("invoiceIds", new ParameterSchema.PropertySpec("array",
                new ParameterSchema.PropertySpec("string", null, null), null));
        return TaskTemplate.builder()
                .templateId("tpl-inv").name("Customer invoices")
                .description("Lists open invoices for one customer")
                .parameterSchema(new ParameterSchema(props, List.of("customerId")))
                .build();
    }

    @Test
    void fullTextCombinesNameDescriptionAndParameters() {
        assertEquals("""
                Customer invoices
                Lists open invoices for one customer
                Parameters:
                - customerId (string)
                - invoiceIds (array of string)""", TemplateIndexService.fullText(invoiceTemplate()));
    }

    @Test
    void fullTextOfBareTemplateIsItsName() {
        TaskTemplate bare = TaskTemplate.builder().templateId("t").name("Deal digest").build();

        assertEquals("Deal digest", TemplateIndexService.fullText(bare));
    }

    @Test
    void indexReplacesRowWithBothVectors() {
        when(embeddingService.embed(eq("Customer invoices"), eq(EmbeddingMode.DOCUMENT))).thenReturn(List.of(1f, 0f));
        when(embeddingService.embed(startsWith("Customer invoices\n"), eq(EmbeddingMode.DOCUMENT))).thenReturn(List.of(0f, 1f));

        assertTrue(indexService.index(invoiceTemplate()));

        InOrder order = inOrder(milvusClient);
        ArgumentCaptor<DeleteReq> delete = ArgumentCaptor.forClass(DeleteReq.class);
        ArgumentCaptor<InsertReq> insert = ArgumentCaptor.forClass(InsertReq.class);
        order.verify(milvusClient).delete(delete.capture());
        order.verify(milvusClient).insert(insert.capture());

        assertEquals("template_id == \"tpl-inv\"", delete.getValue().getFilter());
        JsonObject row = insert.getValue().getData().get(0);
        assertEquals("tpl-inv", row.get("template_id").getAsString());
        assertTrue(row.get("enabled").getAsBoolean());
        assertEquals(1f, row.getAsJsonArray("name_embedding").get(0).getAsFloat());
        assertEquals(1f, row.getAsJsonArray("embedding").get(1).getAsFloat());
    }

    @Test
    void embeddingFailureSkipsTemplate() {
        when(embeddingService.embed(anyString(), any()))
                .thenThrow(new EmbeddingClient.EmbeddingException("quota"));

        assertFalse(indexService.index(invoiceTemplate()));
        verify(milvusClient, never()).insert(any(InsertReq.class));
    }

    @Test
    void reindexAllCountsSuccesses() {
        TaskTemplate ok = invoiceTemplate();
        TaskTemplate broken = TaskTemplate.builder().templateId("tpl-bad").name("Broken").build();
        when(repository.findAll()).thenReturn(List.of(ok, broken));
        when(embeddingService.embed(anyString(), any())).thenReturn(List.of(0.5f, 0.5f));
        when(embeddingService.embed(eq("Broken"), any())).thenThrow(new EmbeddingClient.EmbeddingException("bad"));

        assertEquals(1, indexService.reindexAll());
    }

    @Test
    void reindexIsSkippedWithoutCollection() {
        when(collectionManager.ensureCollection()).thenReturn(false);

        assertEquals(0, indexService.reindexAll());
        verifyNoInteractions(embeddingService);
    }
}
