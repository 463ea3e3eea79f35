package com.segym.core.evolution;

import com.segym.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EvolutionPropertiesTest {

    @Test
    void defaultsProduceValidSettings() {
        var settings = new EvolutionProperties().toSettings();
        assertEquals(1, settings.eliteSize());
        assertEquals(SelectionDirection.MINIMIZE, settings.direction());
        assertEquals(Duration.ofSeconds(600), settings.sampleDeadline());
    }

    @Test
    void invalidRatesAreRejectedNotClamped() {
        var props = new EvolutionProperties();
        props.setMutationRate(1.2);
        assertThrows(ConfigurationException.class, props::toSettings);
    }
}
