package com.lodestar.core.persistence;

import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.persistence.FactCodec.SessionState;
import com.lodestar.core.state.IterationFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link StateStore} keeping one directory per agent under a root directory:
 * <pre>
 * &lt;root&gt;/&lt;agent&gt;/persistent.facts              persistent facts of the agent
 * &lt;root&gt;/&lt;agent&gt;/&lt;session&gt;.json            session facts and last committed iteration
 * &lt;root&gt;/&lt;agent&gt;/&lt;session&gt;.history.jsonl   one history record per line
 * </pre>
 * Files are replaced through a temporary file and an atomic move. A save
 * appends its history line first and replaces the session file last; the
 * session file is the commit point, so history lines past its iteration
 * (left by a failed or interrupted save) are ignored and cut off by the next
 * save. Writers are serialized per key within this process.
 */
public class FileSystemStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemStateStore.class);

    private static final String STATE_SUFFIX = ".json";
    private static final String HISTORY_SUFFIX = ".history.jsonl";
    private static final String PERSISTENT_FILE = "persistent.facts";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path root;
    private final FactCodec codec;
    private final Map<SessionKey, Object> sessionLocks = new ConcurrentHashMap<>();
    private final Map<String, Object> agentLocks = new ConcurrentHashMap<>();

    public FileSystemStateStore(Path root) {
        this(root, new FactCodec());
    }

    public FileSystemStateStore(Path root, FactCodec codec) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.codec = codec;
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean bootstrap(SessionKey key, Facts seed) {
        Facts durable = StateStore.requireDurable(seed);
        synchronized (sessionLock(key)) {
            if (Files.exists(statePath(key))) {
                return false;
            }
            synchronized (agentLock(key.agentId())) {
                Facts seeded = durable.withScope(Scope.PERSISTENT);
                if (!seeded.isEmpty()) {
                    writePersistent(key.agentId(), seeded.merge(loadPersistent(key.agentId())));
                }
            }
            writeState(key, new SessionState(0, StateStore.sessionPart(durable)));
            log.debug("Bootstrapped session {} with {} seed facts", key, durable.size());
            return true;
        }
    }

    @Override
    public boolean exists(SessionKey key) {
        return Files.exists(statePath(key));
    }

    @Override
    public Facts load(SessionKey key) {
        return StateStore.overlay(loadPersistent(key.agentId()), readState(key).facts());
    }

    @Override
    public Facts loadPersistent(String agentId) {
        Path path = persistentPath(agentId);
        if (!Files.exists(path)) {
            return Facts.empty();
        }
        try {
            return codec.readFacts(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read persistent facts of agent '" + agentId + "' from " + path, e);
        }
    }

    @Override
    public void save(SessionKey key, IterationFacts record, Facts durable) {
        StateStore.requireDurable(durable);
        synchronized (sessionLock(key)) {
            List<String> lines = readHistoryFile(key);
            List<IterationFacts> history = committedHistory(key, lines);
            StateStore.requireNextIteration(key, history, record);
            if (history.size() != nonBlank(lines)) {
                log.warn("Discarding {} uncommitted history line(s) of {}", nonBlank(lines) - history.size(), key);
                rewriteHistory(key, history);
            }
            appendHistory(key, record);
            Facts persistent = durable.withScope(Scope.PERSISTENT);
            if (!persistent.isEmpty()) {
                synchronized (agentLock(key.agentId())) {
                    writePersistent(key.agentId(), loadPersistent(key.agentId()).merge(persistent));
                }
            }
            writeState(key, new SessionState(record.iteration(), StateStore.sessionPart(durable)));
        }
        log.debug("Saved iteration {} of {} ({} durable facts)", record.iteration(), key, durable.size());
    }

    @Override
    public List<IterationFacts> history(SessionKey key) {
        return committedHistory(key, readHistoryFile(key));
    }

    @Override
    public List<String> sessions(String agentId) {
        Path dir = root.resolve(StateStore.requireAgentId(agentId));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(STATE_SUFFIX))
                    .map(name -> name.substring(0, name.length() - STATE_SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StateStoreException("Failed to list sessions of agent '" + agentId + "' in " + dir, e);
        }
    }

    @Override
    public void clearScope(SessionKey key, Scope scope) {
        StateStore.requireDurableScope(scope);
        if (scope == Scope.PERSISTENT) {
            synchronized (agentLock(key.agentId())) {
                Path path = persistentPath(key.agentId());
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new StateStoreException("Failed to clear persistent facts of agent '"
                            + key.agentId() + "' at " + path, e);
                }
            }
        } else {
            synchronized (sessionLock(key)) {
                if (!Files.exists(statePath(key))) {
                    return;
                }
                SessionState state = readState(key);
                writeState(key, new SessionState(state.iteration(), state.facts().without(scope)));
            }
        }
        log.debug("Cleared {} facts of {}", scope.wireName(), key);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private SessionState readState(SessionKey key) {
        Path path = statePath(key);
        if (!Files.exists(path)) {
            return new SessionState(0, Facts.empty());
        }
        try {
            return codec.readSessionState(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state of " + key + " from " + path, e);
        }
    }

    private List<String> readHistoryFile(SessionKey key) {
        Path path = historyPath(key);
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read history of " + key + " from " + path, e);
        }
    }

    /** Records up to the iteration the session file was last committed at. */
    private List<IterationFacts> committedHistory(SessionKey key, List<String> lines) {
        int committed = readState(key).iteration();
        return codec.readHistoryLines(lines).stream()
                .filter(record -> record.iteration() <= committed)
                .toList();
    }

    private static long nonBlank(List<String> lines) {
        return lines.stream().filter(line -> !line.isBlank()).count();
    }

    private void appendHistory(SessionKey key, IterationFacts record) {
        Path history = historyPath(key);
        try {
            Files.createDirectories(history.getParent());
            Files.writeString(history, codec.writeIteration(record) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StateStoreException("Failed to append history of " + key + " to " + history, e);
        }
    }

    private void rewriteHistory(SessionKey key, List<IterationFacts> history) {
        var lines = new ArrayList<String>(history.size());
        history.forEach(record -> lines.add(codec.writeIteration(record)));
        String content = lines.isEmpty() ? "" : lines.stream().collect(Collectors.joining("\n", "", "\n"));
        replace(historyPath(key), content, "history of " + key);
    }

    private void writeState(SessionKey key, SessionState state) {
        replace(statePath(key), codec.writeSessionState(state), "state of " + key);
    }

    private void writePersistent(String agentId, Facts facts) {
        replace(persistentPath(agentId), codec.writeFacts(facts), "persistent facts of agent '" + agentId + "'");
    }

    private void replace(Path target, String content, String what) {
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported under {}; replacing {} non-atomically", root, target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to write " + what + " to " + target, e);
        }
    }

    private Object sessionLock(SessionKey key) {
        return sessionLocks.computeIfAbsent(key, k -> new Object());
    }

    private Object agentLock(String agentId) {
        return agentLocks.computeIfAbsent(agentId, k -> new Object());
    }

    private Path statePath(SessionKey key) {
        return root.resolve(key.agentId()).resolve(key.sessionId() + STATE_SUFFIX);
    }

    private Path historyPath(SessionKey key) {
        return root.resolve(key.agentId()).resolve(key.sessionId() + HISTORY_SUFFIX);
    }

    private Path persistentPath(String agentId) {
        return root.resolve(agentId).resolve(PERSISTENT_FILE);
    }
}
