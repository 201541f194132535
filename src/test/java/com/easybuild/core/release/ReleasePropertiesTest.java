package com.easybuild.core.release;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReleasePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new ReleaseProperties();
        assertEquals("patch", props.getIncrementType());
        assertEquals("#Release ", props.getCommitMessagePrefix());
        assertEquals(5, props.getChangelogSize());
        assertEquals(10, props.getNotifyTimeoutSeconds());
    }
}
