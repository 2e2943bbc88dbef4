package com.openforge.taskcore.domain;

import jakarta.persistence.Converter;

@Converter
public class ParameterSchemaConverter extends JsonColumnConverter<ParameterSchema> {

    public ParameterSchemaConverter() {
        super(ParameterSchema.class);
    }
}
