package com.openforge.taskcore.repair;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionErrorTest {

    @Test
    void capturesNameMessageAndStack() {
        ExecutionError error = ExecutionError.from(new IllegalArgumentException("bad customer id"));

        assertEquals("IllegalArgumentException", error.name());
        assertEquals("bad customer id", error.message());
        assertTrue(error.stack().startsWith("java.lang.IllegalArgumentException: bad customer id"));
    }

    @Test
    void nullThrowableGivesEmptyError() {
        ExecutionError error = ExecutionError.from(null);

        assertEquals("", error.nameOrEmpty());
        assertEquals("", error.messageOrEmpty());
        assertEquals("", error.stackOrEmpty());
    }
}
