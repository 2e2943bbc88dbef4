package com.openforge.taskcore.extraction;

public enum ExtractionStatus {

    /** Model output parsed as-is. */
    CLEAN,

    /** Model output needed the deterministic repair pass. */
    REPAIRED,

    /** Nothing usable came back; only base parameters and defaults. */
    DEFAULTED
}
