package com.openforge.taskcore.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A reusable task definition matched (or generated) per user request.
 *
 * Created by the generation flow and mutated by modification / repair flows,
 * all of which live outside this service. Here the row is read-only except for
 * {@code repairAttempts}, which is only ever bumped through
 * {@link com.openforge.taskcore.repository.TaskTemplateRepository#incrementRepairAttempts}.
 *
 * The full-text and name-only embeddings are kept in the Milvus template index,
 * keyed by {@code templateId}.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "task_templates",
    uniqueConstraints = @UniqueConstraint(name = "uq_template_id", columnNames = "template_id")
)
public class TaskTemplate extends BaseEntity {

    /** Immutable business key; also the primary key of the vector index row. */
    @Column(name = "template_id", nullable = false, updatable = false, length = 128)
    private String templateId;

    @Column(name = "name", nullable = false, length = 256)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /** definition.parameterSchema; null when the stored definition is missing or corrupted. */
    @Convert(converter = ParameterSchemaConverter.class)
    @Column(name = "parameter_schema", columnDefinition = "TEXT")
    private ParameterSchema parameterSchema;

    @Convert(converter = TemplateTriggersConverter.class)
    @Column(name = "triggers", columnDefinition = "TEXT")
    private TemplateTriggers triggers;

    @Builder.Default
    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(name = "repair_attempts", nullable = false)
    private int repairAttempts = 0;

    @Builder.Default
    @Column(name = "testing", nullable = false)
    private boolean testing = false;
}
