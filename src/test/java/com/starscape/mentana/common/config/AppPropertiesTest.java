package com.starscape.mentana.common.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AppPropertiesTest {

    @Test
    void componentsAreRequiredUnlessListedAsOptional() {
        AppProperties.Health health = new AppProperties().getHealth();

        assertTrue(health.isRequired("file-storage"));

        health.setOptionalComponents(List.of(" File-Storage "));

        assertFalse(health.isRequired("file-storage"));
        assertTrue(health.isRequired("user-repository"));
    }

    @Test
    void optionalMatchingIgnoresTheDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            AppProperties.Health health = new AppProperties().getHealth();
            health.setOptionalComponents(List.of("FILE-STORAGE"));

            assertFalse(health.isRequired("file-storage"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
