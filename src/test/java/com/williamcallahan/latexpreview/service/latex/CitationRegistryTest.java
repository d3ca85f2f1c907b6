package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies id assignment order and key canonicalization.
 */
class CitationRegistryTest {

    @Test
    void explicitNumberAdvancesTheSequentialCursor() {
        CitationRegistry registry = CitationRegistry.sequential();

        assertEquals(5, registry.register("ref_5").getAsInt());
        assertEquals(6, registry.register("smith").getAsInt());
    }

    @Test
    void explicitNumberAlreadyTakenIsSharedNotRenumbered() {
        CitationRegistry registry = CitationRegistry.sequential();
        registry.register("smith");
        registry.register("jones");

        assertEquals(2, registry.register(CitationRegistry.normalizeKey("ref2")).getAsInt());
        assertEquals(2, registry.idOf("jones").getAsInt());
        assertEquals(3, registry.register("lee").getAsInt());
        assertEquals(List.of("smith", "jones", "ref_2", "lee"), registry.discoveryOrder());
    }

    @Test
    void bibliographyBackedRegistryIgnoresUnknownKeys() {
        CitationRegistry registry = CitationRegistry.fromBibliography(List.of("b", "a", "b"));

        assertEquals(1, registry.idOf("b").getAsInt());
        assertEquals(2, registry.register("a").getAsInt());
        assertTrue(registry.register("c").isEmpty());
    }
}
