package com.lodestar.core.persistence;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.state.IterationFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemStateStoreTest extends StateStoreContractTest {

    @TempDir
    Path root;

    @Override
    protected StateStore createStore() {
        return new FileSystemStateStore(root);
    }

    @Test
    @DisplayName("lays out one state file and one history file per session")
    void fileLayout() {
        store.save(KEY, record(1, "START", Map.of()), Facts.of(Fact.of("done", true, Scope.SESSION)));

        assertTrue(Files.exists(root.resolve("planner/s1.json")));
        assertTrue(Files.exists(root.resolve("planner/s1.history.jsonl")));
        assertFalse(Files.exists(root.resolve("planner/s1.json.tmp")));
    }

    @Test
    @DisplayName("state survives a new store instance on the same root")
    void survivesRestart() {
        Facts facts = Facts.of(Fact.of("plan", "p", Scope.SESSION));
        store.save(KEY, record(1, "START", Map.of()), facts);

        StateStore reopened = new FileSystemStateStore(root);

        assertEquals(facts, reopened.load(KEY));
        assertEquals(1, reopened.history(KEY).size());
    }

    @Test
    @DisplayName("corrupt state files raise StateStoreException")
    void corruptState() throws Exception {
        Files.createDirectories(root.resolve("planner"));
        Files.writeString(root.resolve("planner/s1.json"), "{not json");

        assertThrows(StateStoreException.class, () -> store.load(KEY));
    }

    @Test
    @DisplayName("a save whose state write fails leaves the committed history untouched")
    void failedStateWriteIsNotCommitted() throws Exception {
        Facts first = Facts.of(Fact.of("step", 1, Scope.SESSION));
        store.save(KEY, record(1, "START", Map.of()), first);
        Path blocked = root.resolve("planner/s1.json.tmp");
        Files.createDirectories(blocked);

        assertThrows(StateStoreException.class, () -> store.save(KEY, record(2, "PLAN", Map.of()),
                Facts.of(Fact.of("step", 2, Scope.SESSION))));

        assertEquals(first, store.load(KEY));
        assertEquals(1, store.history(KEY).size());

        Files.delete(blocked);
        store.save(KEY, record(2, "PLAN", Map.of()), Facts.of(Fact.of("step", 2, Scope.SESSION)));

        assertEquals(2, store.history(KEY).size());
        assertEquals(2, Files.readAllLines(root.resolve("planner/s1.history.jsonl")).size());
    }

    @Test
    @DisplayName("a torn final history line is ignored and replaced by the next save")
    void tornHistoryLine() throws Exception {
        store.save(KEY, record(1, "START", Map.of()), Facts.empty());
        Path history = root.resolve("planner/s1.history.jsonl");
        Files.writeString(history, "{\"iteration\":2,\"pha", StandardOpenOption.APPEND);

        assertEquals(1, store.history(KEY).size());

        store.save(KEY, record(2, "PLAN", Map.of()), Facts.empty());

        assertEquals(List.of(1, 2), store.history(KEY).stream().map(IterationFacts::iteration).toList());
    }

    @Test
    @DisplayName("persistent facts live in one file per agent")
    void persistentFile() {
        store.save(KEY, record(1, "START", Map.of()), Facts.of(
                Fact.of("memo", "m", Scope.PERSISTENT),
                Fact.of("plan", "p", Scope.SESSION)));

        assertTrue(Files.exists(root.resolve("planner/persistent.facts")));
        assertEquals(List.of("s1"), store.sessions("planner"));
        assertEquals(Facts.of(Fact.of("memo", "m", Scope.PERSISTENT)),
                new FileSystemStateStore(root).loadPersistent("planner"));
    }
}
