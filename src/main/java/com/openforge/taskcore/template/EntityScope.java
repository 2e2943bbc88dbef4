package com.openforge.taskcore.template;

/** Declared breadth of the request; AUTO leaves it to the wording of the description. */
public enum EntityScope {
    AGGREGATE,
    SPECIFIC_ENTITY,
    AUTO
}
