package com.di.loannova.ingestion;

import com.di.loannova.common.Dataset;
import com.di.loannova.config.PipelineProperties;
import com.di.loannova.observability.ObservabilityContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceAdapterRegistry Tests")
class SourceAdapterRegistryTest {

    private static SourceAdapterRegistry registry(List<SourceAdapter> adapters) {
        SourceAdapterRegistry registry = new SourceAdapterRegistry(adapters);
        registry.initialize();
        return registry;
    }

    private static SourceAdapter stub(String type) {
        return new SourceAdapter() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public RawExtract fetch(PipelineProperties.Source source, ObservabilityContext ctx) {
                throw new UnsupportedOperationException();
            }

            @Override
            public Dataset parse(RawExtract extract, PipelineProperties.Source source, ObservabilityContext ctx) {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Test
    @DisplayName("Should resolve adapters case-insensitively")
    void testGetAdapter_CaseInsensitive() {
        TabularParser parser = new TabularParser();
        SourceAdapterRegistry registry = registry(List.of(
                new FileSourceAdapter(parser), new BiExportSourceAdapter(parser, Clock.systemUTC())));

        assertInstanceOf(FileSourceAdapter.class, registry.getAdapter(" FILE "));
        assertInstanceOf(BiExportSourceAdapter.class, registry.getAdapter("bi-export"));
        assertEquals(Set.of("file", "bi-export"), registry.getRegisteredTypes());
        assertTrue(registry.hasAdapter("File"));
        assertFalse(registry.hasAdapter("http"));
    }

    @Test
    @DisplayName("Should throw for unknown, null or blank types")
    void testGetAdapter_Unknown() {
        SourceAdapterRegistry registry = registry(List.of(stub("file")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.getAdapter("ftp"));
        assertTrue(e.getMessage().contains("Available types"));
        assertThrows(IllegalArgumentException.class, () -> registry.getAdapter(null));
        assertThrows(IllegalArgumentException.class, () -> registry.getAdapter(""));
    }

    @Test
    @DisplayName("Should fail on duplicate adapter types")
    void testInitialize_Duplicates() {
        assertThrows(IllegalStateException.class, () -> registry(List.of(stub("file"), stub("FILE"))));
    }

    @Test
    @DisplayName("Should fail on a blank adapter type")
    void testInitialize_BlankType() {
        assertThrows(IllegalStateException.class, () -> registry(List.of(stub(" "))));
    }

    @Test
    @DisplayName("Should start empty when no adapters are registered")
    void testInitialize_Empty() {
        assertTrue(registry(List.of()).getRegisteredTypes().isEmpty());
    }
}
