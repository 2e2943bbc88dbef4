package com.openforge.taskcore.pii;

/**
 * What a placeholder stands for. Never persisted; {@link #toString()} masks the value
 * so an accidental log statement cannot leak it.
 */
public record PiiToken(PiiType type, String originalValue) {

    @Override
    public String toString() {
        return "PiiToken[type=" + type + ", originalValue=***]";
    }
}
