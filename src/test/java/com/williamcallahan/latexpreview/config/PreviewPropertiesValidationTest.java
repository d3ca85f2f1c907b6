package com.williamcallahan.latexpreview.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies preview property validation for limits, cache, math and diagram settings.
 */
class PreviewPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new PreviewProperties()::validateConfiguration);
    }

    @Test
    void rejectsZeroMaxInputLength() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getLimits().setMaxInputLength(0);

        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveListDepth() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getLimits().setMaxListDepth(0);

        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
    }

    @Test
    void rejectsMinimumMathScaleOutsideUnitInterval() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getMath().setMinScale(1.5);

        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);

        previewProperties.getMath().setMinScale(0);
        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveCacheTtl() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getCache().setTtl(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCacheSize() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getCache().setSize(-1);

        assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
    }

    @Test
    void rejectsCompactDistanceAboveLargeDistance() {
        PreviewProperties previewProperties = new PreviewProperties();
        previewProperties.getDiagram().setCompactNodeDistance(10);

        IllegalArgumentException failure =
                assertThrows(IllegalArgumentException.class, previewProperties::validateConfiguration);
        assertTrue(failure.getMessage().contains("compact-node-distance"));
    }
}
