package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearena.game.CatalogException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Archetypes available to fighters, plus the personality-to-archetype mapping.
 * Loaded once from JSON; read-only afterwards and safe to share between threads.
 */
public class ArchetypeCatalog {
    public static final String DEFAULT_RESOURCE = "archetypes.json";

    private final Map<String, Archetype> archetypes;
    private final Map<String, String> personalities;

    /**
     * JSON layout of the catalog file.
     */
    record CatalogFile(
            @JsonProperty("archetypes") List<Archetype> archetypes,
            @JsonProperty("personalities") Map<String, String> personalities
    ) {
    }

    public ArchetypeCatalog(List<Archetype> archetypes, Map<String, String> personalities) {
        if (archetypes == null || archetypes.isEmpty()) {
            throw new IllegalArgumentException("Archetype catalog needs at least one archetype");
        }
        Map<String, Archetype> byKey = new LinkedHashMap<>();
        for (Archetype archetype : archetypes) {
            if (byKey.put(normalize(archetype.key()), archetype) != null) {
                throw new IllegalArgumentException("Duplicate archetype: " + archetype.key());
            }
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        if (personalities != null) {
            personalities.forEach((personality, key) -> {
                if (key == null || !byKey.containsKey(normalize(key))) {
                    throw new IllegalArgumentException(
                            "Personality " + personality + " maps to unknown archetype " + key);
                }
                mapping.put(normalize(personality), normalize(key));
            });
        }
        this.archetypes = Collections.unmodifiableMap(byKey);
        this.personalities = Collections.unmodifiableMap(mapping);
    }

    // Keys and personalities match case-insensitively
    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * The bundled warrior/mage/rogue/healer catalog.
     */
    public static ArchetypeCatalog standard() throws CatalogException {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load from a classpath resource.
     */
    public static ArchetypeCatalog fromResource(String resourcePath) throws CatalogException {
        try (InputStream is = ArchetypeCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CatalogException("Resource not found: " + resourcePath);
            }
            return build(new ObjectMapper().readValue(is, CatalogFile.class));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load from a JSON string.
     */
    public static ArchetypeCatalog fromJson(String json) throws CatalogException {
        try {
            return build(new ObjectMapper().readValue(json, CatalogFile.class));
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static ArchetypeCatalog build(CatalogFile file) throws CatalogException {
        try {
            return new ArchetypeCatalog(file.archetypes(), file.personalities());
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Invalid archetype catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Get an archetype by key.
     * @throws IllegalArgumentException if the key is unknown
     */
    public Archetype get(String key) {
        Archetype archetype = key == null ? null : archetypes.get(normalize(key));
        if (archetype == null) {
            throw new IllegalArgumentException("Unknown archetype: " + key);
        }
        return archetype;
    }

    public boolean has(String key) {
        return key != null && archetypes.containsKey(normalize(key));
    }

    /**
     * The archetype a personality prefers, if the personality is known.
     */
    public Optional<Archetype> forPersonality(String personality) {
        if (personality == null) {
            return Optional.empty();
        }
        String key = personalities.get(normalize(personality));
        return key == null ? Optional.empty() : Optional.of(archetypes.get(key));
    }

    /**
     * Archetype keys in catalog order.
     */
    public List<String> keys() {
        return new ArrayList<>(archetypes.keySet());
    }

    public List<Archetype> all() {
        return List.copyOf(archetypes.values());
    }

    public Map<String, String> getPersonalities() {
        return personalities;
    }
}
