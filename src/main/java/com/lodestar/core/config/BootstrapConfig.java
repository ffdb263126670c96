package com.lodestar.core.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run bootstrap configuration, read from a YAML file such as:
 *
 * <pre>
 * goal: Extract the persistence layer into its own module
 * repo:
 *   root: /work/checkout
 *   ignore: [target, .git]
 * reviewer: alice        # unknown keys are kept as extras
 * </pre>
 *
 * Its seed facts initialise the durable state of a new session.
 */
public class BootstrapConfig {

    private static final Logger log = LoggerFactory.getLogger(BootstrapConfig.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private String goal;
    private Repo repo;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    /**
     * Reads a bootstrap file. A missing or empty file yields an empty configuration.
     *
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public static BootstrapConfig fromYaml(Path path) {
        if (!Files.exists(path)) {
            log.debug("No bootstrap file at {}; using empty bootstrap config", path);
            return new BootstrapConfig();
        }
        try {
            if (Files.size(path) == 0) {
                return new BootstrapConfig();
            }
            BootstrapConfig config = YAML.readValue(path.toFile(), BootstrapConfig.class);
            return config != null ? config : new BootstrapConfig();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bootstrap config " + path, e);
        }
    }

    /**
     * Session-scoped knowledge facts seeded into a new session:
     * {@code goal}, {@code repo_root} and {@code repo_ignore}, each only when configured.
     */
    public Facts seedFacts() {
        var facts = new ArrayList<Fact>();
        if (goal != null) {
            facts.add(Fact.of("goal", goal, Scope.SESSION, FactKind.KNOWLEDGE));
        }
        if (repo != null && repo.getRoot() != null) {
            facts.add(Fact.of("repo_root", repo.getRoot(), Scope.SESSION, FactKind.KNOWLEDGE));
            if (!repo.getIgnore().isEmpty()) {
                facts.add(Fact.of("repo_ignore", repo.getIgnore(), Scope.SESSION, FactKind.KNOWLEDGE));
            }
        }
        return Facts.of(facts);
    }

    public String getGoal() { return goal; }
    public void setGoal(String goal) { this.goal = goal; }
    public Repo getRepo() { return repo; }
    public void setRepo(Repo repo) { this.repo = repo; }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    public void setExtra(String key, Object value) {
        extras.put(key, value);
    }

    public static class Repo {
        private String root;
        private List<String> ignore = new ArrayList<>();

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public List<String> getIgnore() { return ignore; }
        public void setIgnore(List<String> ignore) { this.ignore = ignore != null ? ignore : new ArrayList<>(); }
    }
}
