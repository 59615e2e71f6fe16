package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于子进程的 shell 执行器
 *
 * 职责：
 * 1. 通过命令前缀（设备上为 "sh -c"，主机上为 "adb shell"）执行 input/monkey/screencap 命令
 * 2. 执行前检查权限
 * 3. 超时后强制结束进程
 */
public class ProcessShellExecutor implements ShellExecutor {

    private static final String TAG = Config.LOG_TAG + ".Shell";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    // 日志中输出的最大长度
    private static final int MAX_LOG_OUTPUT = 500;

    private final List<String> commandPrefix;
    private final Authorizer authorizer;
    private final long timeoutSeconds;

    /**
     * 命令执行结果
     */
    public static class CommandResult {
        public final int exitCode;
        public final String output;
        public final String error;
        public final boolean success;

        public CommandResult(int exitCode, String output, String error) {
            this.exitCode = exitCode;
            this.output = output;
            this.error = error;
            this.success = exitCode == 0;
        }

        static CommandResult failure(String error) {
            return new CommandResult(-1, "", error);
        }
    }

    public ProcessShellExecutor(List<String> commandPrefix, Authorizer authorizer, long timeoutSeconds) {
        this.commandPrefix = Collections.unmodifiableList(new ArrayList<>(commandPrefix));
        this.authorizer = authorizer != null ? authorizer : Authorizer.ALWAYS;
        this.timeoutSeconds = timeoutSeconds > 0 ? timeoutSeconds : Config.SHELL_TIMEOUT_SECONDS;
    }

    /**
     * 从配置字符串创建，如 "sh -c" 或 "adb -s emulator-5554 shell"
     */
    public static ProcessShellExecutor fromPrefix(String prefix, Authorizer authorizer) {
        String value = prefix == null || prefix.trim().isEmpty() ? "sh -c" : prefix.trim();
        return new ProcessShellExecutor(Arrays.asList(value.split("\\s+")), authorizer, Config.SHELL_TIMEOUT_SECONDS);
    }

    /**
     * 执行一条 shell 命令
     */
    public CommandResult execute(String command) {
        if (Config.DEBUG_MODE) {
            log.debug("Executing command: {}", command);
        }

        if (!authorizer.hasPermission()) {
            log.error("No shell permission, refusing: {}", command);
            return CommandResult.failure("No shell permission");
        }

        List<String> argv = new ArrayList<>(commandPrefix);
        argv.add(command);

        Process process = null;
        try {
            process = new ProcessBuilder(argv).start();

            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Command timed out after {}s: {}", timeoutSeconds, command);
                return CommandResult.failure("Command timed out after " + timeoutSeconds + "s");
            }

            int exitCode = process.exitValue();
            String output = stdout.get(1, TimeUnit.SECONDS).trim();
            String error = stderr.get(1, TimeUnit.SECONDS).trim();

            if (Config.DEBUG_MODE) {
                log.debug("Command exit code: {}, output: {}", exitCode, truncate(output));
            }
            if (!error.isEmpty()) {
                log.warn("Command error: {}", truncate(error));
            }
            return new CommandResult(exitCode, output, error);

        } catch (IOException e) {
            log.error("Failed to start command: {}", command, e);
            return CommandResult.failure(e.getMessage() != null ? e.getMessage() : "Unknown error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandResult.failure("Interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to read command output: {}", command, e);
            return CommandResult.failure("Failed to read command output");
        } finally {
            if (process != null) {
                process.destroyForcibly();
            }
        }
    }

    // ========== 设备操作 ==========

    @Override
    public boolean tap(int x, int y) {
        return execute("input tap " + x + " " + y).success;
    }

    @Override
    public boolean swipe(int x1, int y1, int x2, int y2, int durationMs) {
        return execute("input swipe " + x1 + " " + y1 + " " + x2 + " " + y2 + " " + durationMs).success;
    }

    @Override
    public boolean keyEvent(int keyCode) {
        return execute("input keyevent " + keyCode).success;
    }

    @Override
    public boolean inputText(String text) {
        return execute("input text " + shellQuote(text)).success;
    }

    @Override
    public boolean launchApp(String packageName) {
        return execute("monkey -p " + packageName + " -c android.intent.category.LAUNCHER 1").success;
    }

    @Override
    public boolean screenshot(String outputPath) {
        return execute("screencap -p " + outputPath).success;
    }

    /**
     * 单引号包裹，内部的单引号写成 '\''
     */
    static String shellQuote(String text) {
        return "'" + (text == null ? "" : text.replace("'", "'\\''")) + "'";
    }

    private static CompletableFuture<String> readAsync(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream stream = in) {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                byte[] chunk = new byte[4096];
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    buffer.write(chunk, 0, n);
                }
                return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private static String truncate(String s) {
        return s.length() > MAX_LOG_OUTPUT ? s.substring(0, MAX_LOG_OUTPUT) + "..." : s;
    }
}
