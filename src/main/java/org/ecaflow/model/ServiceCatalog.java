package org.ecaflow.model;

import java.util.*;

/**
 * Static knowledge about service calls, shared read-only by the graph
 * builder and the analyzers.
 *
 * The catalog holds:
 * - Effect table: service signature to the entity state it produces
 *   ({@code light.turn_on -> on})
 * - Conflict table: unordered pairs of signatures that drive the same
 *   entity in opposite directions
 * - Qualifiers: services whose signature is refined by one data field
 *   ({@code climate.set_hvac_mode} by {@code hvac_mode})
 *
 * A signature is {@code domain.service} or, when qualified,
 * {@code domain.service:value}. Instances are immutable; use {@link Builder}
 * or {@link #merge(ServiceCatalog)} to derive new catalogs.
 */
public final class ServiceCatalog {

    /** Separator between a base signature and its qualifier value. */
    public static final char QUALIFIER_SEPARATOR = ':';

    /** Catalog with no entries: every action is uncataloged. */
    public static final ServiceCatalog EMPTY = new Builder().build();

    private final Map<String, String> effects;
    private final Set<ConflictPair> conflicts;
    private final Map<String, String> qualifiers;

    /**
     * Pair of signatures considered opposing effects on one entity.
     * Ordering is normalized so {@code (a, b)} and {@code (b, a)} are equal.
     */
    public static final class ConflictPair {
        private final String first;
        private final String second;

        public ConflictPair(String a, String b) {
            if (a.compareTo(b) <= 0) {
                this.first = a;
                this.second = b;
            } else {
                this.first = b;
                this.second = a;
            }
        }

        public boolean matches(String a, String b) {
            return (first.equals(a) && second.equals(b)) || (first.equals(b) && second.equals(a));
        }

        public String getFirst() { return first; }
        public String getSecond() { return second; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ConflictPair that = (ConflictPair) o;
            return first.equals(that.first) && second.equals(that.second);
        }

        @Override
        public int hashCode() {
            return Objects.hash(first, second);
        }

        @Override
        public String toString() {
            return first + " <-> " + second;
        }
    }

    private ServiceCatalog(Builder builder) {
        this.effects = Collections.unmodifiableMap(new LinkedHashMap<>(builder.effects));
        this.conflicts = Collections.unmodifiableSet(new LinkedHashSet<>(builder.conflicts));
        this.qualifiers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.qualifiers));
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * State produced by a signature. A qualified signature without its own
     * entry falls back to the bare {@code domain.service} entry.
     */
    public Optional<String> effectOf(String signature) {
        if (signature == null) {
            return Optional.empty();
        }
        String state = effects.get(signature);
        if (state == null) {
            state = effects.get(baseSignature(signature));
        }
        return Optional.ofNullable(state);
    }

    /**
     * Whether two signatures are listed as opposing, in either direction.
     */
    public boolean conflicts(String signatureA, String signatureB) {
        if (signatureA == null || signatureB == null || signatureA.equals(signatureB)) {
            return false;
        }
        return conflicts.contains(new ConflictPair(signatureA, signatureB));
    }

    /**
     * Data field that refines the signature of {@code service}, if any.
     */
    public Optional<String> qualifierFieldFor(String service) {
        return Optional.ofNullable(qualifiers.get(service));
    }

    public static String baseSignature(String signature) {
        int idx = signature.indexOf(QUALIFIER_SEPARATOR);
        return idx < 0 ? signature : signature.substring(0, idx);
    }

    // ========================================================================
    // Derivation
    // ========================================================================

    /**
     * Catalog with {@code other} layered on top: its effects and qualifiers
     * override ours, conflict pairs accumulate.
     */
    public ServiceCatalog merge(ServiceCatalog other) {
        Builder builder = toBuilder();
        other.effects.forEach(builder::effect);
        other.qualifiers.forEach(builder::qualifier);
        for (ConflictPair pair : other.conflicts) {
            builder.conflict(pair.getFirst(), pair.getSecond());
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        effects.forEach(builder::effect);
        qualifiers.forEach(builder::qualifier);
        for (ConflictPair pair : conflicts) {
            builder.conflict(pair.getFirst(), pair.getSecond());
        }
        return builder;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public Set<ConflictPair> getConflicts() { return conflicts; }

    public int getEffectCount() { return effects.size(); }
    public int getConflictCount() { return conflicts.size(); }

    @Override
    public String toString() {
        return String.format("ServiceCatalog[effects=%d, conflicts=%d, qualifiers=%d]",
            effects.size(), conflicts.size(), qualifiers.size());
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private final Map<String, String> effects = new LinkedHashMap<>();
        private final Set<ConflictPair> conflicts = new LinkedHashSet<>();
        private final Map<String, String> qualifiers = new LinkedHashMap<>();

        public Builder effect(String signature, String resultingState) {
            effects.put(requireSignature(signature), Objects.requireNonNull(resultingState, "resultingState"));
            return this;
        }

        /**
         * Register an opposing pair. Registering {@code (b, a)} after
         * {@code (a, b)} has no further effect.
         */
        public Builder conflict(String signatureA, String signatureB) {
            requireSignature(signatureA);
            requireSignature(signatureB);
            if (signatureA.equals(signatureB)) {
                throw new IllegalArgumentException("A signature cannot conflict with itself: " + signatureA);
            }
            conflicts.add(new ConflictPair(signatureA, signatureB));
            return this;
        }

        public Builder qualifier(String service, String dataField) {
            qualifiers.put(requireSignature(service), Objects.requireNonNull(dataField, "dataField"));
            return this;
        }

        public ServiceCatalog build() {
            return new ServiceCatalog(this);
        }

        private static String requireSignature(String signature) {
            if (signature == null || signature.isBlank()) {
                throw new IllegalArgumentException("Service signature must not be blank");
            }
            return signature;
        }
    }
}
