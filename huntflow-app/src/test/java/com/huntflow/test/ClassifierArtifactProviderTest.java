package com.huntflow.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.domain.filter.adapter.gateway.IClassifierArtifact;
import com.huntflow.domain.filter.model.valobj.ChunkFeatures;
import com.huntflow.infrastructure.classifier.ClassifierArtifactProviderImpl;
import com.huntflow.types.exception.FatalConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ClassifierArtifactProviderTest {

    private final DefaultResourceLoader resourceLoader = new DefaultResourceLoader();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void shouldLoadBundledArtifactOnce() {
        ClassifierArtifactProviderImpl provider = provider("classpath:classifier/content-filter-v1.json");

        IClassifierArtifact artifact = provider.current().orElseThrow();

        assertEquals("content-filter-v1", artifact.version());
        assertSame(artifact, provider.current().orElseThrow());
    }

    @Test
    public void shouldScoreTechnicalChunkAboveMarketingChunk() {
        IClassifierArtifact artifact = provider("classpath:classifier/content-filter-v1.json").current().orElseThrow();

        double technical = artifact.predict(new ChunkFeatures(Map.of("powershell", 2, "hklm", 1, "sysmon", 1), 4, 3, 0));
        double marketing = artifact.predict(new ChunkFeatures(Map.of("webinar", 1, "subscribe", 2), 3, 0, 2));

        assertTrue(technical > 0.5);
        assertTrue(marketing < 0.5);
        assertTrue(technical > marketing);
    }

    @Test
    public void shouldDegradeWhenArtifactMissing() {
        Optional<IClassifierArtifact> artifact = provider("classpath:classifier/does-not-exist.json").current();

        assertTrue(artifact.isEmpty());
        assertTrue(provider("").current().isEmpty());
    }

    @Test
    public void shouldFailFastOnCorruptArtifact() {
        assertThrows(FatalConfigurationException.class,
                () -> provider("classpath:classifier/broken.json").current());
        assertThrows(FatalConfigurationException.class,
                () -> provider("classpath:classifier/non-numeric.json").current());
    }

    private ClassifierArtifactProviderImpl provider(String location) {
        return new ClassifierArtifactProviderImpl(resourceLoader, objectMapper, location);
    }
}
