package com.aska.ghostpilot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 测试用 shell：记录每条命令，截图时写入预设的 PNG
 */
class RecordingShell implements ShellExecutor {

    final List<String> commands = Collections.synchronizedList(new ArrayList<>());
    volatile boolean result = true;
    volatile RuntimeException failure;
    volatile byte[] screenshotBytes;

    @Override
    public boolean tap(int x, int y) {
        return record("tap " + x + " " + y);
    }

    @Override
    public boolean swipe(int x1, int y1, int x2, int y2, int durationMs) {
        return record("swipe " + x1 + " " + y1 + " " + x2 + " " + y2 + " " + durationMs);
    }

    @Override
    public boolean keyEvent(int keyCode) {
        return record("key " + keyCode);
    }

    @Override
    public boolean inputText(String text) {
        return record("text " + text);
    }

    @Override
    public boolean launchApp(String packageName) {
        return record("launch " + packageName);
    }

    @Override
    public boolean screenshot(String outputPath) {
        record("screenshot " + outputPath);
        if (screenshotBytes == null) {
            return false;
        }
        try {
            Files.write(Paths.get(outputPath), screenshotBytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return true;
    }

    private boolean record(String command) {
        commands.add(command);
        if (failure != null) {
            throw failure;
        }
        return result;
    }

    List<String> inputCommands() {
        List<String> out = new ArrayList<>();
        synchronized (commands) {
            for (String c : commands) {
                if (!c.startsWith("screenshot ")) out.add(c);
            }
        }
        return out;
    }
}
