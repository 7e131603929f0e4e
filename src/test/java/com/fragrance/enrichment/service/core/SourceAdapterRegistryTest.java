package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SourceAdapterRegistryTest {

    private static SourceAdapter adapterFor(final SourceId source) {
        SourceAdapter adapter = mock(SourceAdapter.class);
        when(adapter.source()).thenReturn(source);
        return adapter;
    }

    @Test
    @DisplayName("Should index adapters by source")
    void testLookup() {
        SourceAdapter chemical = adapterFor(SourceId.CHEMICAL);
        SourceAdapterRegistry registry = new SourceAdapterRegistry(List.of(chemical));

        assertSame(chemical, registry.find(SourceId.CHEMICAL).orElseThrow());
        assertEquals(1, registry.all().size());
        assertTrue(registry.supportedSources().contains(SourceId.CHEMICAL));
    }

    @Test
    @DisplayName("Should refuse two adapters for the same source")
    void testDuplicate() {
        SourceId source = SourceId.CHEMICAL;

        assertThrows(IllegalStateException.class,
                () -> new SourceAdapterRegistry(List.of(adapterFor(source), adapterFor(source))));
    }
}
