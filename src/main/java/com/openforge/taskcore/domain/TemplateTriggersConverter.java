package com.openforge.taskcore.domain;

import jakarta.persistence.Converter;

@Converter
public class TemplateTriggersConverter extends JsonColumnConverter<TemplateTriggers> {

    public TemplateTriggersConverter() {
        super(TemplateTriggers.class);
    }
}
