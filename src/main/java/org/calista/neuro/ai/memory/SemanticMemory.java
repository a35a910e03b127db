package org.calista.neuro.ai.memory;

import java.util.Map;
import java.util.Optional;

/**
 * General knowledge: concept → properties ("food" → {is_a: resource, effect: reduces_hunger}).
 */
public interface SemanticMemory {

    String IS_A = "is_a";

    /** Adds a concept or merges properties into an existing one. */
    void addFact(String concept, Map<String, String> properties);

    Optional<Map<String, String>> retrieve(String concept);

    /**
     * Property of the concept itself, or else of its direct {@code is_a} parent.
     */
    Optional<String> inferProperty(String concept, String property);

    default boolean hasProperty(String concept, String property, String value) {
        return retrieve(concept).map(p -> value.equals(p.get(property))).orElse(false);
    }
}
