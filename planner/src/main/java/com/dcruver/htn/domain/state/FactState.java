package com.dcruver.htn.domain.state;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Planning-time world state: facts keyed by {@code (subject, predicate)}.
 *
 * Immutable. Every write returns a new instance, so a state captured in a
 * solution node is never changed by later planning steps. Insertion order is
 * kept so that iteration (and therefore any planning that depends on it) is
 * deterministic.
 */
@EqualsAndHashCode
public final class FactState {

    private static final FactState EMPTY = new FactState(Map.of());

    private final Map<Key, Object> facts;

    private FactState(Map<Key, Object> facts) {
        this.facts = facts;
    }

    public static FactState empty() {
        return EMPTY;
    }

    public static FactState fromTriples(Collection<Fact> triples) {
        Map<Key, Object> facts = new LinkedHashMap<>();
        for (Fact fact : triples) {
            facts.put(new Key(fact.getSubject(), fact.getPredicate()), fact.getValue());
        }
        return new FactState(Collections.unmodifiableMap(facts));
    }

    /**
     * Goal test used by the planner: does {@code predicate(subject)} currently equal {@code value}?
     * A missing fact never matches, not even a {@code null} value.
     */
    public boolean matches(String predicate, String subject, Object value) {
        Key key = new Key(subject, predicate);
        return facts.containsKey(key) && Objects.equals(facts.get(key), value);
    }

    public Object getFact(String subject, String predicate) {
        return facts.get(new Key(subject, predicate));
    }

    public boolean hasFact(String subject, String predicate) {
        return facts.containsKey(new Key(subject, predicate));
    }

    public FactState withFact(String subject, String predicate, Object value) {
        Map<Key, Object> copy = new LinkedHashMap<>(facts);
        copy.put(new Key(subject, predicate), value);
        return new FactState(Collections.unmodifiableMap(copy));
    }

    public FactState withoutFact(String subject, String predicate) {
        Key key = new Key(subject, predicate);
        if (!facts.containsKey(key)) {
            return this;
        }
        Map<Key, Object> copy = new LinkedHashMap<>(facts);
        copy.remove(key);
        return new FactState(Collections.unmodifiableMap(copy));
    }

    /**
     * Later facts win on conflict.
     */
    public FactState merge(FactState other) {
        Map<Key, Object> copy = new LinkedHashMap<>(facts);
        copy.putAll(other.facts);
        return new FactState(Collections.unmodifiableMap(copy));
    }

    public Set<String> subjects() {
        Set<String> subjects = new LinkedHashSet<>();
        facts.keySet().forEach(key -> subjects.add(key.getSubject()));
        return subjects;
    }

    public Map<String, Object> subjectProperties(String subject) {
        Map<String, Object> properties = new LinkedHashMap<>();
        facts.forEach((key, value) -> {
            if (key.getSubject().equals(subject)) {
                properties.put(key.getPredicate(), value);
            }
        });
        return properties;
    }

    public List<String> subjectsWithFact(String predicate, Object value) {
        List<String> subjects = new ArrayList<>();
        facts.forEach((key, factValue) -> {
            if (key.getPredicate().equals(predicate) && Objects.equals(factValue, value)) {
                subjects.add(key.getSubject());
            }
        });
        return subjects;
    }

    public List<Fact> toTriples() {
        List<Fact> triples = new ArrayList<>(facts.size());
        facts.forEach((key, value) -> triples.add(new Fact(key.getSubject(), key.getPredicate(), value)));
        return triples;
    }

    public int size() {
        return facts.size();
    }

    @Override
    public String toString() {
        return "FactState" + toTriples();
    }

    @Value
    private static class Key {
        String subject;
        String predicate;
    }
}
