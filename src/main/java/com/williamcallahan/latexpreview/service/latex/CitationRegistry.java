package com.williamcallahan.latexpreview.service.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns numeric ids to citation keys for one document.
 *
 * <p>Ids follow discovery order, except that a key naming its own number ({@code ref_5}) receives that
 * number and pushes the sequential cursor past it when the cursor was behind. An explicit number already
 * handed to an earlier key is still honored, so both keys share it; a warning is logged.</p>
 */
public final class CitationRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CitationRegistry.class);

    private static final Pattern NUMBERED_KEY = Pattern.compile("(?i)ref[_\\s]?(\\d{1,6})");
    private static final Pattern EXPLICIT_KEY = Pattern.compile("ref_(\\d{1,6})");

    private final Map<String, Integer> ids = new LinkedHashMap<>();
    private final List<String> discoveryOrder = new ArrayList<>();
    private final boolean frozen;
    private int nextId = 1;

    private CitationRegistry(boolean frozen) {
        this.frozen = frozen;
    }

    /**
     * Creates a registry that assigns ids as keys are discovered.
     */
    public static CitationRegistry sequential() {
        return new CitationRegistry(false);
    }

    /**
     * Creates a registry whose ids come from a manual bibliography, numbered in entry order. Keys absent
     * from the bibliography are never assigned.
     *
     * @param bibliographyKeys entry keys in document order
     */
    public static CitationRegistry fromBibliography(List<String> bibliographyKeys) {
        CitationRegistry registry = new CitationRegistry(true);
        for (String key : bibliographyKeys) {
            String normalized = normalizeKey(key);
            if (!normalized.isEmpty() && !registry.ids.containsKey(normalized)) {
                registry.ids.put(normalized, registry.nextId++);
                registry.discoveryOrder.add(normalized);
            }
        }
        return registry;
    }

    /**
     * Canonicalizes a citation key: escaped underscores are unescaped and numbered reference keys such
     * as {@code ref3}, {@code ref 3} or {@code REF_03} become {@code ref_3}.
     *
     * @param key raw key text
     * @return canonical key, empty when nothing usable remains
     */
    public static String normalizeKey(String key) {
        if (key == null) {
            return "";
        }
        String normalized = key.replace("\\_", "_").strip();
        Matcher numbered = NUMBERED_KEY.matcher(normalized);
        if (numbered.matches()) {
            return "ref_" + Integer.parseInt(numbered.group(1));
        }
        return normalized;
    }

    /**
     * Returns the id for {@code key}, assigning one when the registry is sequential.
     *
     * @param key canonical key
     * @return the id, or empty when the key is unknown to a bibliography-backed registry
     */
    public OptionalInt register(String key) {
        Integer existing = ids.get(key);
        if (existing != null) {
            return OptionalInt.of(existing);
        }
        if (frozen) {
            return OptionalInt.empty();
        }
        int id;
        OptionalInt explicit = explicitNumber(key);
        if (explicit.isPresent()) {
            id = explicit.getAsInt();
            if (ids.containsValue(id)) {
                logger.warn("Citation key {} shares number {} with an earlier key", key, id);
            }
            if (id >= nextId) {
                nextId = id + 1;
            }
        } else {
            id = nextId++;
        }
        ids.put(key, id);
        discoveryOrder.add(key);
        return OptionalInt.of(id);
    }

    private static OptionalInt explicitNumber(String key) {
        Matcher matcher = EXPLICIT_KEY.matcher(key);
        if (matcher.matches()) {
            int number = Integer.parseInt(matcher.group(1));
            if (number > 0) {
                return OptionalInt.of(number);
            }
        }
        return OptionalInt.empty();
    }

    public OptionalInt idOf(String key) {
        Integer id = ids.get(key);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * Returns keys in the order they were first seen.
     */
    public List<String> discoveryOrder() {
        return Collections.unmodifiableList(discoveryOrder);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
