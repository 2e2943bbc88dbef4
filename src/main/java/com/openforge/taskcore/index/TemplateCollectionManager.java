package com.openforge.taskcore.index;

import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates the template index collection on first use.
 *
 * Collection schema  (task_templates_index):
 * ┌──────────────────┬─────────────────┬─────────────────────────────────────┐
 * │ Field            │ Type            │ Notes                               │
 * ├──────────────────┼─────────────────┼─────────────────────────────────────┤
 * │ template_id      │ VARCHAR(128) PK │ TaskTemplate.templateId             │
 * │ name             │ VARCHAR(256)    │ for log readability only            │
 * │ enabled          │ BOOL            │ search filter                       │
 * │ name_embedding   │ FLOAT_VECTOR    │ name-only text                      │
 * │ embedding        │ FLOAT_VECTOR    │ name + description + schema summary │
 * └──────────────────┴─────────────────┴─────────────────────────────────────┘
 *
 * Both vector fields use HNSW with the COSINE metric, so a hit's score is the
 * cosine similarity and {@code distance = 1 - score}.
 */
@Slf4j
@Service
public class TemplateCollectionManager {

    public static final String FIELD_TEMPLATE_ID = "template_id";
    public static final String FIELD_NAME        = "name";
    public static final String FIELD_ENABLED     = "enabled";

    @Nullable
    private final MilvusClientV2   milvusClient;
    private final MilvusProperties props;

    private volatile boolean ready;

    public TemplateCollectionManager(@Nullable MilvusClientV2 milvusClient, MilvusProperties props) {
        this.milvusClient = milvusClient;
        this.props        = props;
    }

    public String collectionName() {
        return props.collectionName();
    }

    /**
     * @return true if the collection exists (or was just created); false when Milvus is disabled
     */
    public boolean ensureCollection() {
        if (milvusClient == null) return false;
        if (ready) return true;

        String name = props.collectionName();
        if (milvusClient.hasCollection(HasCollectionReq.builder().collectionName(name).build())) {
            log.info("[Milvus] Collection '{}' confirmed existing.", name);
            ready = true;
            return true;
        }

        log.info("[Milvus] Creating template index collection '{}' (dim={})…", name, props.vectorDimensions());
        createCollection(name, props.vectorDimensions());
        ready = true;
        return true;
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private void createCollection(String name, int dimension) {
        CreateCollectionReq.CollectionSchema schema =
                CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder().fieldName(FIELD_TEMPLATE_ID)
                .dataType(DataType.VarChar).maxLength(128).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_NAME)
                .dataType(DataType.VarChar).maxLength(256).build());
        schema.addField(AddFieldReq.builder().fieldName(FIELD_ENABLED)
                .dataType(DataType.Bool).build());
        for (VectorField field : VectorField.values()) {
            schema.addField(AddFieldReq.builder().fieldName(field.fieldName())
                    .dataType(DataType.FloatVector).dimension(dimension).build());
        }

        List<IndexParam> indexes = new ArrayList<>();
        for (VectorField field : VectorField.values()) {
            indexes.add(IndexParam.builder()
                    .fieldName(field.fieldName())
                    .indexType(IndexParam.IndexType.HNSW)
                    .metricType(IndexParam.MetricType.COSINE)
                    .extraParams(Map.of("M", 16, "efConstruction", 256))
                    .build());
        }

        milvusClient.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(indexes)
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
