package com.lodestar.dispatch.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleOutputTest {

    @Test
    @DisplayName("truncate shortens long text with an ellipsis")
    void truncate() {
        assertEquals("abc", ConsoleOutput.truncate("abc", 10));
        assertEquals("abcdefg...", ConsoleOutput.truncate("abcdefghijklmnop", 10));
        assertEquals("-", ConsoleOutput.truncate("", 10));
        assertEquals("-", ConsoleOutput.truncate(null, 10));
    }
}
