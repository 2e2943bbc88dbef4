package com.openforge.taskcore.index;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.openforge.taskcore.domain.ParameterSchema;
import com.openforge.taskcore.domain.TaskTemplate;
import com.openforge.taskcore.embedding.EmbeddingMode;
import com.openforge.taskcore.embedding.EmbeddingService;
import com.openforge.taskcore.repository.TaskTemplateRepository;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.InsertReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Writes template vectors into the Milvus template index.
 *
 * Each template gets one row holding two vectors, both embedded in document mode:
 *   name_embedding — the bare template name
 *   embedding      — name + description + parameter summary
 *
 * The template rows themselves are never modified here.
 */
@Slf4j
@Service
public class TemplateIndexService {

    private static final int MAX_TEMPLATE_TEXT_LEN = 3500;
    private static final int MAX_NAME_LEN          = 250;

    @Nullable
    private final MilvusClientV2            milvusClient;
    private final EmbeddingService          embeddingService;
    private final TemplateCollectionManager collectionManager;
    private final TaskTemplateRepository    templateRepository;

    public TemplateIndexService(@Nullable MilvusClientV2 milvusClient,
                                EmbeddingService embeddingService,
                                TemplateCollectionManager collectionManager,
                                TaskTemplateRepository templateRepository) {
        this.milvusClient       = milvusClient;
        this.embeddingService   = embeddingService;
        this.collectionManager  = collectionManager;
        this.templateRepository = templateRepository;
    }

    /**
     * Re-embeds every stored template.
     *
     * @return number of templates written to the index
     */
    public int reindexAll() {
        if (!collectionManager.ensureCollection()) {
            log.info("[TemplateIndex] Milvus unavailable, skipping reindex.");
            return 0;
        }
        int indexed = 0;
        for (TaskTemplate template : templateRepository.findAll()) {
            if (index(template)) indexed++;
        }
        log.info("[TemplateIndex] Reindexed {} templates.", indexed);
        return indexed;
    }

    /**
     * Replaces the index row for one template. Failures are logged and reported as false.
     */
    public boolean index(TaskTemplate template) {
        if (milvusClient == null || !collectionManager.ensureCollection()) return false;
        String templateId = template.getTemplateId();
        try {
            List<Float> nameVector = embeddingService.embed(template.getName(), EmbeddingMode.DOCUMENT);
            List<Float> fullVector = embeddingService.embed(fullText(template), EmbeddingMode.DOCUMENT);

            milvusClient.delete(DeleteReq.builder()
                    .collectionName(collectionManager.collectionName())
                    .filter("%s == \"%s\"".formatted(TemplateCollectionManager.FIELD_TEMPLATE_ID,
                            templateId.replace("\"", "\\\"")))
                    .build());

            JsonObject row = new JsonObject();
            row.addProperty(TemplateCollectionManager.FIELD_TEMPLATE_ID, templateId);
            row.addProperty(TemplateCollectionManager.FIELD_NAME, truncate(template.getName(), MAX_NAME_LEN));
            row.addProperty(TemplateCollectionManager.FIELD_ENABLED, template.isEnabled());
            row.add(VectorField.NAME.fieldName(), toJsonArray(nameVector));
            row.add(VectorField.FULL_TEXT.fieldName(), toJsonArray(fullVector));

            milvusClient.insert(InsertReq.builder()
                    .collectionName(collectionManager.collectionName())
                    .data(List.of(row))
                    .build());
            log.debug("[TemplateIndex] Indexed template {}", templateId);
            return true;
        } catch (Exception e) {
            log.warn("[TemplateIndex] Failed to index template {}: {}", templateId, e.getMessage());
            return false;
        }
    }

    /** Text behind the full-text vector: name, description, then one line per parameter. */
    static String fullText(TaskTemplate template) {
        StringBuilder sb = new StringBuilder(template.getName());
        if (template.getDescription() != null && !template.getDescription().isBlank()) {
            sb.append('\n').append(template.getDescription());
        }
        ParameterSchema schema = template.getParameterSchema();
        if (schema != null && schema.hasProperties()) {
            sb.append("\nParameters:");
            for (Map.Entry<String, ParameterSchema.PropertySpec> e : schema.properties().entrySet()) {
                sb.append("\n- ").append(e.getKey());
                if (e.getValue() != null) sb.append(" (").append(e.getValue().describeType()).append(')');
            }
        }
        return truncate(sb.toString(), MAX_TEMPLATE_TEXT_LEN);
    }

    private static JsonArray toJsonArray(List<Float> vector) {
        JsonArray arr = new JsonArray();
        for (Float f : vector) arr.add(f);
        return arr;
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
