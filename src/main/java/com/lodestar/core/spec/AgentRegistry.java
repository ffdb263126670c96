package com.lodestar.core.spec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Agent specs known to the application, keyed by name. Every {@link AgentSpec}
 * bean in the context is registered.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentSpec> specs;

    public AgentRegistry(List<AgentSpec> specs) {
        var byName = new TreeMap<String, AgentSpec>();
        for (AgentSpec spec : specs) {
            AgentSpec previous = byName.putIfAbsent(spec.name(), spec);
            if (previous != null) {
                throw new IllegalStateException("Two agent specs are named '" + spec.name() + "'");
            }
        }
        this.specs = Collections.unmodifiableMap(byName);
        log.info("Registered {} agent spec(s): {}", byName.size(), byName.keySet());
    }

    public Optional<AgentSpec> find(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /**
     * @throws IllegalArgumentException if no agent has this name
     */
    public AgentSpec require(String name) {
        AgentSpec spec = specs.get(name);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown agent '" + name + "' (known: " + specs.keySet() + ")");
        }
        return spec;
    }

    public List<String> names() {
        return List.copyOf(specs.keySet());
    }
}
