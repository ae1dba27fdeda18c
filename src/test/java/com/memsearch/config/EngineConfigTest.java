package com.memsearch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(5, config.getMaxResultCount());
        assertEquals(1e-6, config.getRelevanceEpsilon());
        assertEquals(Constants.DEFAULT_PARALLELISM, config.getParallelism());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();

        config.setMaxResultCount(10);
        config.setRelevanceEpsilon(0.01);
        config.setParallelism(2);

        assertEquals(10, config.getMaxResultCount());
        assertEquals(0.01, config.getRelevanceEpsilon());
        assertEquals(2, config.getParallelism());
    }

    @Test
    void testRejectsInvalidValues() {
        EngineConfig config = new EngineConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setMaxResultCount(-1));
        assertThrows(IllegalArgumentException.class, () -> config.setRelevanceEpsilon(-0.5));
        assertThrows(IllegalArgumentException.class, () -> config.setRelevanceEpsilon(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> config.setParallelism(0));
    }
}
