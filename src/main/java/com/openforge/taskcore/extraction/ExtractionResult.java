package com.openforge.taskcore.extraction;

import java.util.Map;

public record ExtractionResult(Map<String, Object> parameters, ExtractionStatus status) {}
