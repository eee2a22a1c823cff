package com.licensewatch.obits;

import com.licensewatch.obits.config.ReconcilerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));

        properties.setUserAgent("  custom-agent/1.0 ");
        assertEquals("custom-agent/1.0", properties.getUserAgent());
    }

    @Test
    void concurrencyAndBatchSettingsAreClamped() {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.setConcurrency(0);
        properties.getBatch().setSize(-3);
        properties.getBatch().setPauseMs(-10);
        properties.getBatch().setMaxRows(-1);
        properties.getFetch().setMaxAttempts(0);

        assertEquals(1, properties.getConcurrency());
        assertEquals(1, properties.getBatch().getSize());
        assertEquals(0L, properties.getBatch().getPauseMs());
        assertEquals(0, properties.getBatch().getMaxRows());
        assertEquals(1, properties.getFetch().getMaxAttempts());
    }

    @Test
    void retryAttemptsAreCapped() {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.getFetch().setMaxAttempts(500);
        assertEquals(10, properties.getFetch().getMaxAttempts());
    }

    @Test
    void jitterMaxNeverFallsBelowMin() {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.getFetch().setJitterMinMs(800);
        properties.getFetch().setJitterMaxMs(100);
        assertEquals(800, properties.getFetch().getJitterMaxMs());
    }

    @Test
    void defaultsMatchSearchWindow() {
        ReconcilerProperties properties = new ReconcilerProperties();
        assertEquals(2, properties.getConcurrency());
        assertEquals(20, properties.getBatch().getSize());
        assertEquals(3, properties.getFetch().getMaxAttempts());
        assertEquals(2023, properties.getEligibility().getMinExpirationYear());
        assertEquals("01-01-2023", properties.getSearch().getStartDate());
        assertEquals("12-01-2025", properties.getSearch().getEndDate());
        assertEquals(50, properties.getSearch().getLimit());
    }
}
