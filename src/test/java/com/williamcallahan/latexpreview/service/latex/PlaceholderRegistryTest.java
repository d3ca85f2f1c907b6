package com.williamcallahan.latexpreview.service.latex;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies token shape, per-category counters and multi-pass resolution.
 */
class PlaceholderRegistryTest {

    @Test
    void countersAreIndependentPerCategoryButTokensNeverCollide() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String math = registry.register(PlaceholderCategory.MATH, "<m/>");
        String table = registry.register(PlaceholderCategory.TABLE, "<t/>");

        assertEquals("LATEXPREVIEWMATH_0_", math);
        assertEquals("LATEXPREVIEWTABLE_0_", table);
        assertNotEquals(math, table);
        assertEquals(2, registry.size());
    }

    @Test
    void blockTokensArePaddedWithBlankLinesAndRemembered() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        String padded = registry.registerBlock(PlaceholderCategory.BLOCK, "<div/>");
        String inline = registry.register(PlaceholderCategory.BLOCK, "<span/>");

        assertEquals("\n\nLATEXPREVIEWBLOCK_0_\n\n", padded);
        assertTrue(registry.isBlock(padded));
        assertFalse(registry.isBlock(inline));
    }

    @Test
    void resolveSubstitutesNestedTokensAcrossPasses() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String inner = registry.register(PlaceholderCategory.MATH, "<b>x</b>");
        String outer = registry.register(PlaceholderCategory.TABLE, "<td>" + inner + "</td>");

        assertEquals("<p><td><b>x</b></td></p>", registry.resolve("<p>" + outer + "</p>", 4));
    }

    @Test
    void tokenFollowedByDigitDoesNotMatchLongerToken() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        for (int i = 0; i < 12; i++) {
            registry.register(PlaceholderCategory.MATH, "m" + i);
        }

        assertEquals("m1" + "2", registry.resolve("LATEXPREVIEWMATH_1_2", 2));
        assertEquals("m11", registry.resolve("LATEXPREVIEWMATH_11_", 2));
    }

    @Test
    void unknownTokenShapedTextIsLeftUntouched() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        assertEquals("LATEXPREVIEWTIKZ_9_", registry.resolve("LATEXPREVIEWTIKZ_9_", 3));
        assertEquals("a", PlaceholderRegistry.resolve("LATEXPREVIEWTIKZ_0_", Map.of("LATEXPREVIEWTIKZ_0_", "a"), 1));
    }

    @Test
    void isTokenIgnoresSurroundingWhitespaceOnly() {
        assertTrue(PlaceholderRegistry.isToken("  LATEXPREVIEWBLOCK_3_\n"));
        assertFalse(PlaceholderRegistry.isToken("see LATEXPREVIEWBLOCK_3_"));
        assertTrue(PlaceholderRegistry.containsToken("see LATEXPREVIEWBLOCK_3_"));
    }

    @Test
    void literalTokenTextInSourceIsProtectedFromResolution() {
        PlaceholderRegistry registry = new PlaceholderRegistry();
        String protectedText = registry.protectLiterals("keep LATEXPREVIEWMATH_0_ here");
        registry.register(PlaceholderCategory.MATH, "<m/>");

        String resolved = registry.resolve(protectedText, 8);

        assertEquals("keep LATEX&#80;REVIEWMATH_0_ here", resolved);
        assertFalse(resolved.contains("<m/>"));
    }

    @Test
    void protectLiteralsLeavesOrdinaryTextAlone() {
        PlaceholderRegistry registry = new PlaceholderRegistry();

        assertEquals("plain text", registry.protectLiterals("plain text"));
        assertEquals(0, registry.size());
    }
}
