package org.iceforge.pivot.drill;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of expanded members. The only transition is {@link #toggle(DrillKey)}, so
 * toggling the same key twice always restores the previous state and the order of
 * independent toggles does not matter.
 */
public final class DrillState {

    private static final DrillState EMPTY = new DrillState(Set.of());

    private final Set<DrillKey> expanded;

    private DrillState(Set<DrillKey> expanded) {
        this.expanded = expanded;
    }

    public static DrillState empty() {
        return EMPTY;
    }

    public DrillState toggle(DrillKey key) {
        Set<DrillKey> next = new LinkedHashSet<>(expanded);
        if (!next.remove(key)) {
            next.add(key);
        }
        return next.isEmpty() ? EMPTY : new DrillState(Collections.unmodifiableSet(next));
    }

    public boolean isExpanded(DrillKey key) {
        return expanded.contains(key);
    }

    public Set<DrillKey> expandedKeys() {
        return expanded;
    }

    public boolean isEmpty() {
        return expanded.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DrillState other)) return false;
        return expanded.equals(other.expanded);
    }

    @Override
    public int hashCode() {
        return expanded.hashCode();
    }

    @Override
    public String toString() {
        return "DrillState" + expanded;
    }
}
