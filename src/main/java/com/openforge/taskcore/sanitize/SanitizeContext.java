package com.openforge.taskcore.sanitize;

/** Where sanitized text will be used; decides the length cap. */
public enum SanitizeContext {

    TASK_DESCRIPTION(5000),
    GENERAL(1000);

    private final int maxLength;

    SanitizeContext(int maxLength) {
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }
}
