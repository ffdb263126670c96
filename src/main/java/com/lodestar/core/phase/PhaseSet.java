package com.lodestar.core.phase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Fixed, validated set of phases for one agent definition: the
 * agent's "enum type", created at runtime.
 * <p>
 * Names must be UPPER_SNAKE_CASE, unique and not reserved. All problems are
 * collected and reported together in one {@link InvalidPhaseException}.
 *
 * <pre>{@code
 * PhaseSet phases = PhaseSet.create("START", "PROCESSING", "DONE");
 * Phase start = phases.phase("START");
 * }</pre>
 */
public final class PhaseSet implements Iterable<Phase> {

    public static final String DEFAULT_SET_NAME = "Phase";

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    public static final Set<String> RESERVED = Collections.unmodifiableSet(new TreeSet<>(Set.of(
            "NONE", "ANY", "ALL", "DEFAULT", "UNKNOWN", "TRUE", "FALSE", "NULL")));

    private final String name;
    private final List<String> names;
    private final Map<String, Phase> members;

    private PhaseSet(String name, List<String> names) {
        this.name = name;
        this.names = List.copyOf(names);
        var map = new LinkedHashMap<String, Phase>();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), new Phase(this, names.get(i), i));
        }
        this.members = Collections.unmodifiableMap(map);
    }

    /**
     * Creates a set named {@value #DEFAULT_SET_NAME}, preserving the given order.
     *
     * @throws InvalidPhaseException if any name is invalid, reserved or duplicated
     */
    public static PhaseSet create(String... names) {
        return named(DEFAULT_SET_NAME, names);
    }

    public static PhaseSet named(String setName, String... names) {
        if (setName == null || setName.isBlank()) {
            throw new InvalidPhaseException("Phase set name must not be blank");
        }
        List<String> list = Arrays.asList(names);
        validate(list);
        return new PhaseSet(setName, list);
    }

    public static PhaseSet fromList(List<String> names) {
        return create(names.toArray(String[]::new));
    }

    /**
     * Creates a set from unordered names. Names are sorted first so that the
     * resulting identities and ordinals do not depend on iteration order.
     */
    public static PhaseSet fromSet(Collection<String> names) {
        for (String n : names) {
            if (n == null) {
                throw new InvalidPhaseException(List.of("Phase name must be a string, got null"));
            }
        }
        return create(new TreeSet<>(names).toArray(String[]::new));
    }

    /**
     * Checks names without raising.
     */
    public static boolean isValid(List<String> names) {
        try {
            validate(names);
            return true;
        } catch (InvalidPhaseException e) {
            return false;
        }
    }

    private static void validate(List<String> names) {
        if (names.isEmpty()) {
            throw new InvalidPhaseException(List.of("At least one phase name is required"));
        }
        var seen = new HashSet<String>();
        var problems = new ArrayList<String>();
        for (String n : names) {
            if (n == null) {
                problems.add("Phase name must be a string, got null");
            } else if (!NAME_PATTERN.matcher(n).matches()) {
                problems.add("Invalid phase name: '" + n + "' (must be UPPER_SNAKE_CASE, e.g. 'READY_TO_CONTINUE')");
            } else if (RESERVED.contains(n)) {
                problems.add("Reserved phase name: '" + n + "' (cannot use: " + String.join(", ", RESERVED) + ")");
            } else if (!seen.add(n)) {
                problems.add("Duplicate phase name: '" + n + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidPhaseException(problems);
        }
    }

    public String name() {
        return name;
    }

    public List<String> names() {
        return names;
    }

    public List<Phase> phases() {
        return List.copyOf(members.values());
    }

    public int size() {
        return names.size();
    }

    /**
     * @throws NoSuchElementException if this set has no such phase
     */
    public Phase phase(String phaseName) {
        Phase phase = members.get(phaseName);
        if (phase == null) {
            throw new NoSuchElementException("No phase '" + phaseName + "' in " + name + " " + names);
        }
        return phase;
    }

    public Optional<Phase> find(String phaseName) {
        return Optional.ofNullable(members.get(phaseName));
    }

    public boolean contains(Phase phase) {
        return phase != null && equals(phase.phaseSet()) && members.containsKey(phase.name());
    }

    @Override
    public Iterator<Phase> iterator() {
        return members.values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhaseSet other)) return false;
        return name.equals(other.name) && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + names.hashCode();
    }

    @Override
    public String toString() {
        return name + names;
    }
}
