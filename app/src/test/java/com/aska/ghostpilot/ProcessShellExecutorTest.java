package com.aska.ghostpilot;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessShellExecutorTest {

    @Test
    void quotesForShell() {
        assertEquals("'hello world'", ProcessShellExecutor.shellQuote("hello world"));
        assertEquals("'it'\\''s'", ProcessShellExecutor.shellQuote("it's"));
        assertEquals("''", ProcessShellExecutor.shellQuote(null));
    }

    @Test
    void refusesWithoutPermission() {
        ProcessShellExecutor shell = ProcessShellExecutor.fromPrefix("sh -c", () -> false);
        ProcessShellExecutor.CommandResult result = shell.execute("echo hi");
        assertFalse(result.success);
        assertEquals("No shell permission", result.error);
        assertFalse(shell.tap(1, 2));
    }

    @Test
    void missingBinaryIsAFailedResult() {
        ProcessShellExecutor shell = new ProcessShellExecutor(
            Arrays.asList("/nonexistent/ghostpilot-shell"), Authorizer.ALWAYS, 5);
        ProcessShellExecutor.CommandResult result = shell.execute("input tap 1 2");
        assertFalse(result.success);
        assertEquals(-1, result.exitCode);
    }

    @Test
    void commandResultSuccessFollowsExitCode() {
        assertTrue(new ProcessShellExecutor.CommandResult(0, "ok", "").success);
        assertFalse(new ProcessShellExecutor.CommandResult(1, "", "err").success);
    }
}
