package com.delta.feedscout.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedScoutPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        FeedScoutProperties properties = new FeedScoutProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("feed-scout/0.1"));
    }

    @Test
    void probeSettingsAreClamped() {
        FeedScoutProperties properties = new FeedScoutProperties();
        properties.getProbe().setWorkerCount(0);
        properties.getProbe().setPerTaskTimeoutSeconds(-5);
        properties.getProbe().setMaxTitles(0);
        properties.setRequestTimeoutSeconds(0);
        assertEquals(1, properties.getProbe().getWorkerCount());
        assertEquals(Duration.ofSeconds(1), properties.getProbe().perTaskTimeout());
        assertEquals(1, properties.getProbe().getMaxTitles());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void maxBodyBytesIsClampedAtBothEnds() {
        FeedScoutProperties properties = new FeedScoutProperties();
        properties.setMaxBodyBytes(Integer.MAX_VALUE);
        assertEquals(FeedScoutProperties.MAX_BODY_BYTES_CEILING, properties.getMaxBodyBytes());
        properties.setMaxBodyBytes(10);
        assertEquals(1024, properties.getMaxBodyBytes());
    }

    @Test
    void defaultsMatchDocumentedValues() {
        FeedScoutProperties properties = new FeedScoutProperties();
        assertEquals(10, properties.getProbe().getWorkerCount());
        assertEquals(5, properties.getProbe().getMaxTitles());
        assertEquals(10, properties.getAudit().getShortTitleThreshold());
        assertEquals(3, properties.getAudit().getSparseFeedThreshold());
    }
}
