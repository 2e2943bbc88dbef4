package com.openforge.taskcore.sanitize;

/**
 * Neutralizes user text before it is embedded in a prompt.
 * Implementations must be idempotent: sanitizing already-sanitized text changes nothing.
 */
public interface PromptSanitizer {

    String sanitize(String text, SanitizeContext context);
}
