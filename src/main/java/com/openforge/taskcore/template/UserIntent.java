package com.openforge.taskcore.template;

/** What the caller declared about template reuse. */
public enum UserIntent {

    /** Always generate a fresh template, even if a perfect match exists. */
    CREATE_NEW_TASK,

    REUSE_EXISTING_TEMPLATE
}
