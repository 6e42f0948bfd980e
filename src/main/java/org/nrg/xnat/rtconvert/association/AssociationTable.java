package org.nrg.xnat.rtconvert.association;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Many-to-one mapping from raw region names to canonical names. Lookups are case-insensitive;
 * names without an entry resolve to themselves.
 */
public final class AssociationTable {

    private static final AssociationTable EMPTY = new AssociationTable(Collections.<String, String>emptyMap());

    private final Map<String, String> entries;

    private AssociationTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static AssociationTable empty() {
        return EMPTY;
    }

    public static AssociationTable fromMap(Map<String, String> rawToCanonical) {
        Builder builder = builder();
        for (Map.Entry<String, String> entry : rawToCanonical.entrySet()) {
            builder.associate(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String resolve(String rawName) {
        if (rawName == null) {
            return null;
        }
        String canonical = entries.get(normalize(rawName));
        return canonical != null ? canonical : rawName;
    }

    public boolean contains(String rawName) {
        return rawName != null && entries.containsKey(normalize(rawName));
    }

    /**
     * Entries keyed by lower-cased raw name.
     */
    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Map a raw name to a canonical name. Re-associating the same raw name replaces the earlier entry.
         */
        public Builder associate(String rawName, String canonicalName) {
            if (rawName == null || rawName.trim().isEmpty()) {
                throw new IllegalArgumentException("Raw region name must not be empty");
            }
            if (canonicalName == null || canonicalName.trim().isEmpty()) {
                throw new IllegalArgumentException("Canonical name for '" + rawName + "' must not be empty");
            }
            entries.put(normalize(rawName), canonicalName);
            return this;
        }

        /**
         * Map several synonyms to one canonical name.
         */
        public Builder synonyms(String canonicalName, String... synonyms) {
            for (String synonym : synonyms) {
                associate(synonym, canonicalName);
            }
            return this;
        }

        public AssociationTable build() {
            return new AssociationTable(entries);
        }
    }
}
