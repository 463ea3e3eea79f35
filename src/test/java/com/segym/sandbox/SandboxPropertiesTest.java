package com.segym.sandbox;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class SandboxPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new SandboxProperties();
        assertEquals("docker", props.getProvider());
        assertEquals(300, props.getTimeoutSeconds());
        assertEquals(2048, props.getMemoryLimitMb());
        assertEquals(1, props.getCpuCount());
        assertEquals(4, props.getMaxParallel());
        assertTrue(props.getStepDeadlineSeconds() > props.getTimeoutSeconds());
    }

    @Test
    void testCommandWritesTheReportItReads() {
        var props = new SandboxProperties();
        assertTrue(props.getTestCommand().contains(props.getReportFile()));
    }

    @Test
    void nestedSettersAreVisibleThroughTopLevelGetters() {
        var props = new SandboxProperties();
        props.getSandbox().setProvider("process");
        props.getSandbox().setTimeoutSeconds(30);
        assertEquals("process", props.getProvider());
        assertEquals(30, props.getTimeoutSeconds());
    }
}
