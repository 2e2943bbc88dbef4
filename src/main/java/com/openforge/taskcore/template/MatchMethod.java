package com.openforge.taskcore.template;

public enum MatchMethod {
    NAME_EMBEDDING,
    FULL_EMBEDDING,
    TRIGGER_PATTERN
}
