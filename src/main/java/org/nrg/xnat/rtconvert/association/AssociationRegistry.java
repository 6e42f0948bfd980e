package org.nrg.xnat.rtconvert.association;

import org.nrg.xnat.rtconvert.exception.InvalidConversionConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves raw region names against the caller's wanted regions.
 *
 * Resolution is a single, case-insensitive hop through the {@link AssociationTable}; the result is then
 * matched case-insensitively against the wanted names, so a wanted name always associates with itself.
 * The order of the wanted names defines label values (first name is label 1). The paint order decides
 * which region keeps a voxel claimed by several regions: later regions win.
 *
 * Instances are immutable and safe to share between workers.
 */
public final class AssociationRegistry {

    private final AssociationTable table;
    private final List<String> wanted;
    private final Map<String, String> wantedByKey;
    private final List<String> paintOrder;

    public AssociationRegistry(AssociationTable table, List<String> wantedRegions) {
        this(table, wantedRegions, null);
    }

    /**
     * @param table         raw to canonical overrides
     * @param wantedRegions canonical names in label order
     * @param priority      optional paint order; wanted names not listed are painted first, in label order
     */
    public AssociationRegistry(AssociationTable table, List<String> wantedRegions, List<String> priority) {
        this.table = table != null ? table : AssociationTable.empty();

        Map<String, String> byKey = new LinkedHashMap<>();
        for (String name : wantedRegions) {
            if (name == null || name.trim().isEmpty()) {
                throw new InvalidConversionConfigException("Wanted region names must not be empty");
            }
            if (byKey.put(AssociationTable.normalize(name), name) != null) {
                throw new InvalidConversionConfigException("Wanted region '" + name + "' is listed more than once");
            }
        }
        this.wantedByKey = Collections.unmodifiableMap(byKey);
        this.wanted = Collections.unmodifiableList(new ArrayList<>(byKey.values()));
        this.paintOrder = Collections.unmodifiableList(buildPaintOrder(priority));
    }

    private List<String> buildPaintOrder(List<String> priority) {
        if (priority == null || priority.isEmpty()) {
            return new ArrayList<>(wanted);
        }
        Set<String> prioritized = new LinkedHashSet<>();
        for (String name : priority) {
            String resolved = wantedByKey.get(AssociationTable.normalize(name));
            if (resolved == null) {
                throw new InvalidConversionConfigException("Priority region '" + name + "' is not a wanted region");
            }
            prioritized.add(resolved);
        }
        List<String> order = new ArrayList<>();
        for (String name : wanted) {
            if (!prioritized.contains(name)) {
                order.add(name);
            }
        }
        order.addAll(prioritized);
        return order;
    }

    /**
     * Canonical name of a raw region name. Unmapped names resolve to themselves.
     */
    public String resolve(String rawName) {
        return table.resolve(rawName);
    }

    /**
     * Wanted canonical name a raw name contributes to, spelled as the caller listed it.
     */
    public Optional<String> resolveWanted(String rawName) {
        String canonical = resolve(rawName);
        if (canonical == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(wantedByKey.get(AssociationTable.normalize(canonical)));
    }

    public boolean isWanted(String canonicalName) {
        return canonicalName != null && wantedByKey.containsKey(AssociationTable.normalize(canonicalName));
    }

    /**
     * Wanted canonical names in label order.
     */
    public Set<String> wantedRegions() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(wanted));
    }

    public List<String> getLabelOrder() {
        return wanted;
    }

    public List<String> getPaintOrder() {
        return paintOrder;
    }

    /**
     * Label value of a wanted name, or 0 when it is not wanted.
     */
    public int labelOf(String canonicalName) {
        if (canonicalName == null) {
            return 0;
        }
        String resolved = wantedByKey.get(AssociationTable.normalize(canonicalName));
        return resolved == null ? 0 : wanted.indexOf(resolved) + 1;
    }

    public AssociationTable getTable() {
        return table;
    }
}
