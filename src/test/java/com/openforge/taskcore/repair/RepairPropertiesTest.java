package com.openforge.taskcore.repair;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RepairPropertiesTest {

    @Test
    void missingMarkersFallBackToDefaults() {
        RepairProperties props = new RepairProperties(5, null);

        assertEquals(5, props.maxAttempts());
        assertEquals(RepairProperties.DEFAULT_SELF_FRAME_MARKERS, props.selfFrameMarkers());
    }

    @Test
    void configuredMarkersAreKept() {
        RepairProperties props = new RepairProperties(5, List.of("MyRepairer."));

        assertEquals(List.of("MyRepairer."), props.selfFrameMarkers());
        assertSame(RepairProperties.DEFAULT_SELF_FRAME_MARKERS, RepairProperties.defaults().selfFrameMarkers());
    }
}
