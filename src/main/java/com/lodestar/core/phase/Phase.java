package com.lodestar.core.phase;

/**
 * One member of a {@link PhaseSet}.
 * <p>
 * Two phases are equal when they have the same name and belong to equal sets
 * (same set name, same member names in the same order), so a phase rebuilt
 * after a process restart compares equal to the original.
 */
public final class Phase implements Comparable<Phase> {

    private final PhaseSet set;
    private final String name;
    private final int ordinal;

    Phase(PhaseSet set, String name, int ordinal) {
        this.set = set;
        this.name = name;
        this.ordinal = ordinal;
    }

    public String name() {
        return name;
    }

    public int ordinal() {
        return ordinal;
    }

    public PhaseSet phaseSet() {
        return set;
    }

    @Override
    public int compareTo(Phase other) {
        if (!set.equals(other.set)) {
            throw new IllegalArgumentException(
                    "Cannot compare phases from different sets: " + set.name() + " and " + other.set.name());
        }
        return Integer.compare(ordinal, other.ordinal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Phase other)) return false;
        return ordinal == other.ordinal && name.equals(other.name) && set.equals(other.set);
    }

    @Override
    public int hashCode() {
        return 31 * set.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return set.name() + "." + name;
    }
}
