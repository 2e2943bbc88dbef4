package com.openforge.taskcore.index;

/**
 * The two vectors every template carries in the index.
 */
public enum VectorField {

    /** Name-only embedding; dominates for short, exact-name queries. */
    NAME("name_embedding"),

    /** Embedding of name, description and parameter summary. */
    FULL_TEXT("embedding");

    private final String fieldName;

    VectorField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
