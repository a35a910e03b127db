package org.calista.neuro.ai.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Bounded fact store. When full, a random concept is evicted to make room for a new one.
 */
public final class InMemorySemanticMemory implements SemanticMemory {
    private static final Logger log = LoggerFactory.getLogger(InMemorySemanticMemory.class);

    private final int capacity;
    private final Random rnd;
    private final LinkedHashMap<String, LinkedHashMap<String, String>> facts = new LinkedHashMap<>();

    public InMemorySemanticMemory(int capacity, Random rnd) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.rnd = Objects.requireNonNull(rnd, "rnd");
    }

    @Override
    public void addFact(String concept, Map<String, String> properties) {
        String key = normalize(concept);
        Objects.requireNonNull(properties, "properties");

        LinkedHashMap<String, String> existing = facts.get(key);
        if (existing != null) {
            existing.putAll(properties);
            return;
        }
        if (facts.size() >= capacity) {
            List<String> keys = new ArrayList<>(facts.keySet());
            String evicted = keys.get(rnd.nextInt(keys.size()));
            facts.remove(evicted);
            log.debug("semantic memory full, evicted '{}'", evicted);
        }
        facts.put(key, new LinkedHashMap<>(properties));
    }

    @Override
    public Optional<Map<String, String>> retrieve(String concept) {
        if (concept == null) return Optional.empty();
        LinkedHashMap<String, String> p = facts.get(normalize(concept));
        return (p == null) ? Optional.empty() : Optional.of(Map.copyOf(p));
    }

    @Override
    public Optional<String> inferProperty(String concept, String property) {
        if (concept == null || property == null) return Optional.empty();
        LinkedHashMap<String, String> p = facts.get(normalize(concept));
        if (p == null) return Optional.empty();
        String direct = p.get(property);
        if (direct != null) return Optional.of(direct);

        String parent = p.get(IS_A);
        if (parent == null) return Optional.empty();
        LinkedHashMap<String, String> pp = facts.get(normalize(parent));
        return (pp == null) ? Optional.empty() : Optional.ofNullable(pp.get(property));
    }

    public int size() {
        return facts.size();
    }

    private static String normalize(String concept) {
        Objects.requireNonNull(concept, "concept");
        String k = concept.trim().toLowerCase(Locale.ROOT);
        if (k.isEmpty()) throw new IllegalArgumentException("concept is blank");
        return k;
    }
}
