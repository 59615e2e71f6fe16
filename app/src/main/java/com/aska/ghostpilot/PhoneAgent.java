package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 手机自动化任务循环
 *
 * 职责：
 * 1. 逐步执行：截图 → 请求模型 → 解析动作 → 执行动作 → 记录
 * 2. 截图策略：Shower 截图重试两次，其次从视频画面截取，最后本地 screencap
 * 3. Shower 不可用时退回本地 shell
 * 4. 暂停、继续、停止
 *
 * 同一时间只运行一个任务，每一步完成后才开始下一步。
 */
public class PhoneAgent {

    private static final String TAG = Config.LOG_TAG + ".Agent";
    private static final Logger log = LoggerFactory.getLogger(TAG);

    // 暂停时检查状态的间隔
    private static final long PAUSE_POLL_MS = 200L;

    /**
     * 任务状态变化回调
     */
    public interface ExecutionListener {
        void onUpdate(TaskExecution execution);
    }

    private final AgentSettings settings;
    private final ModelClient model;
    private final ShellExecutor shell;
    private final RemoteControlChannel channel;
    private final VideoStreamDecoder videoDecoder;
    private final Authorizer authorizer;
    private final ExecutionListener listener;
    private final ActionParser parser = new ActionParser();
    private final ActionDispatcher dispatcher;
    private final long stepDelayMs;

    private volatile boolean stopRequested = false;
    private volatile boolean paused = false;
    private volatile TaskExecution current;

    private PhoneAgent(Builder builder) {
        this.settings = builder.settings;
        this.model = builder.model;
        this.shell = builder.shell;
        this.channel = builder.channel;
        this.videoDecoder = builder.videoDecoder;
        this.authorizer = builder.authorizer;
        this.listener = builder.listener;
        this.stepDelayMs = builder.stepDelayMs;

        // 二进制视频流交给解码器
        if (channel != null && videoDecoder != null) {
            channel.setVideoListener(videoDecoder);
        }

        ActionDispatcher.Builder dispatch = builder.dispatcherBuilder != null
            ? builder.dispatcherBuilder
            : ActionDispatcher.builder(builder.shell);
        this.dispatcher = dispatch
            .remoteChannel(builder.channel)
            .cancellation(() -> stopRequested)
            .confirmation(message -> {
                publish(current.withStatus(TaskStatus.WAITING_CONFIRMATION));
                boolean ok = builder.confirmation != null && builder.confirmation.confirm(message);
                publish(current.withStatus(TaskStatus.RUNNING));
                return ok;
            })
            .takeover(message -> {
                publish(current.withStatus(TaskStatus.WAITING_TAKEOVER));
                if (builder.takeover != null) {
                    builder.takeover.onTakeover(message);
                }
            })
            .build();
    }

    public static Builder builder(AgentSettings settings, ModelClient model, ShellExecutor shell) {
        return new Builder(settings, model, shell);
    }

    // ========== 任务控制 ==========

    public void pause() {
        log.info("Pause requested");
        paused = true;
    }

    public void resume() {
        log.info("Resume requested");
        paused = false;
    }

    public void stop() {
        log.info("Stop requested");
        stopRequested = true;
    }

    public TaskExecution getCurrentExecution() {
        return current;
    }

    /**
     * 执行一个任务，直到完成、失败、被停止或达到最大步数
     */
    public TaskExecution runTask(String description) {
        stopRequested = false;
        paused = false;
        publish(TaskExecution.start(UUID.randomUUID().toString(), description));
        log.info("Task started: {}", description);

        if (!authorizer.hasPermission()) {
            log.error("No shell permission");
            return publish(current.failed("No shell permission"));
        }

        boolean remote = false;
        if (settings.shower_enabled && channel != null) {
            remote = channel.ensureDisplay(settings.screen_width, settings.screen_height,
                settings.dpi, settings.bitrate_kbps);
            if (!remote) {
                log.warn("Shower unavailable, falling back to local input");
            }
        }

        try {
            return loop(description, remote);
        } catch (RuntimeException e) {
            log.error("Task crashed", e);
            return publish(current.failed("Task error: " + e.getMessage()));
        } finally {
            if (channel != null && settings.shower_enabled) {
                channel.shutdown();
            }
        }
    }

    private TaskExecution loop(String description, boolean remote) {
        List<String> history = new ArrayList<>();
        CoordinateSystem coordinates = settings.coordinateSystem();

        for (int step = 1; step <= settings.max_steps; step++) {
            if (!waitWhilePaused()) {
                return publish(current.cancelled("Task stopped"));
            }
            publish(current.withCurrentStep(step));

            // ========== 截图 ==========
            byte[] screenshot = captureScreenshot(remote);
            if (screenshot == null) {
                return publish(current.failed("Failed to take screenshot"));
            }

            // ========== 请求模型 ==========
            ModelResponse response = model.sendStep(description, screenshot, step, history);
            if (!response.success) {
                log.error("Model error at step {}: {}", step, response.error);
                return publish(current.failed(response.error));
            }
            if (stopRequested) {
                return publish(current.cancelled("Task stopped"));
            }

            // ========== 解析 ==========
            String actionText = response.action != null ? response.action : "";
            ParseResult parsed = parser.parse(actionText);
            if (!parsed.isSuccess()) {
                log.warn("Step {}: cannot parse '{}': {}", step, actionText, parsed.getError());
                publish(current.withStep(new TaskExecution.StepRecord(step, response.thinking, actionText,
                    false, "Parse failed: " + parsed.getError(), System.currentTimeMillis())));
                history.add(actionText);
                sleepBetweenSteps();
                continue;
            }

            // ========== 执行 ==========
            Action action = parsed.getAction();
            DisplayContext context = remote && channel.isConnected()
                ? DisplayContext.remote(channel.getDisplayId(), settings.screen_width, settings.screen_height, coordinates)
                : DisplayContext.local(settings.screen_width, settings.screen_height, coordinates);

            ActionResult result = dispatcher.execute(action, context);
            if (current.status != TaskStatus.RUNNING && !current.status.isTerminal()) {
                publish(current.withStatus(TaskStatus.RUNNING));
            }
            publish(current.withStep(new TaskExecution.StepRecord(step, response.thinking,
                action.toCommandString(), result.success, result.message, System.currentTimeMillis())));
            history.add(action.toCommandString());

            if (result.shouldFinish) {
                return publish(finish(result));
            }

            sleepBetweenSteps();
        }

        log.warn("Reached max steps ({})", settings.max_steps);
        return publish(current.failed("Reached max steps (" + settings.max_steps + ")"));
    }

    private TaskExecution finish(ActionResult result) {
        switch (result.outcome) {
            case SUCCEEDED:
                log.info("Task completed: {}", result.message);
                return current.completed(result.message);
            case CANCELLED:
            case DENIED:
                log.info("Task cancelled: {}", result.message);
                return current.cancelled(result.message);
            case FAILED:
            default:
                return current.failed(result.message);
        }
    }

    // ========== 截图 ==========

    /**
     * Shower 截图重试两次，其次视频画面，最后本地截图
     */
    byte[] captureScreenshot(boolean remote) {
        if (remote && channel != null) {
            for (int attempt = 1; attempt <= Config.SCREENSHOT_ATTEMPTS; attempt++) {
                byte[] data = channel.requestScreenshot(Config.SCREENSHOT_TIMEOUT_MS);
                if (data != null && data.length > 0) {
                    return data;
                }
                log.warn("Remote screenshot attempt {} failed", attempt);
                if (attempt < Config.SCREENSHOT_ATTEMPTS) {
                    pause(Config.SCREENSHOT_RETRY_DELAY_MS);
                }
            }
        }

        if (videoDecoder != null && videoDecoder.isAttached()) {
            byte[] frame = videoDecoder.captureFrame(Config.SCREENSHOT_TIMEOUT_MS);
            if (frame != null) {
                return frame;
            }
        }

        if (remote) {
            log.warn("Falling back to local screenshot");
        }
        return localScreenshot();
    }

    private byte[] localScreenshot() {
        String path = settings.screenshot_path;
        if (!shell.screenshot(path)) {
            log.error("Local screenshot failed: {}", path);
            return null;
        }
        try {
            return Files.readAllBytes(Paths.get(path));
        } catch (IOException e) {
            log.error("Failed to read screenshot: {}", path, e);
            return null;
        }
    }

    // ========== 工具 ==========

    private boolean waitWhilePaused() {
        if (paused && !stopRequested) {
            publish(current.withStatus(TaskStatus.PAUSED));
            while (paused && !stopRequested) {
                if (!pause(PAUSE_POLL_MS)) {
                    return false;
                }
            }
            publish(current.withStatus(TaskStatus.RUNNING));
        }
        return !stopRequested;
    }

    private void sleepBetweenSteps() {
        pause(stepDelayMs);
    }

    private boolean pause(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return false;
        }
    }

    private TaskExecution publish(TaskExecution execution) {
        current = execution;
        if (listener != null) {
            try {
                listener.onUpdate(execution);
            } catch (RuntimeException e) {
                log.warn("Execution listener failed", e);
            }
        }
        return execution;
    }

    // ========== Builder ==========

    public static class Builder {
        private final AgentSettings settings;
        private final ModelClient model;
        private final ShellExecutor shell;
        private RemoteControlChannel channel;
        private VideoStreamDecoder videoDecoder;
        private Authorizer authorizer = Authorizer.ALWAYS;
        private ActionDispatcher.ConfirmationCallback confirmation;
        private ActionDispatcher.TakeoverCallback takeover;
        private ExecutionListener listener;
        private ActionDispatcher.Builder dispatcherBuilder;
        private long stepDelayMs = Config.STEP_DELAY_MS;

        private Builder(AgentSettings settings, ModelClient model, ShellExecutor shell) {
            this.settings = settings != null ? settings : new AgentSettings();
            this.model = model;
            this.shell = shell;
        }

        public Builder remoteChannel(RemoteControlChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder videoDecoder(VideoStreamDecoder videoDecoder) {
            this.videoDecoder = videoDecoder;
            return this;
        }

        public Builder authorizer(Authorizer authorizer) {
            this.authorizer = authorizer != null ? authorizer : Authorizer.ALWAYS;
            return this;
        }

        public Builder confirmation(ActionDispatcher.ConfirmationCallback confirmation) {
            this.confirmation = confirmation;
            return this;
        }

        public Builder takeover(ActionDispatcher.TakeoverCallback takeover) {
            this.takeover = takeover;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * 自定义动作执行器的节奏参数；通道、取消和回调由 agent 设置
         */
        public Builder dispatcher(ActionDispatcher.Builder dispatcherBuilder) {
            this.dispatcherBuilder = dispatcherBuilder;
            return this;
        }

        public Builder stepDelay(long ms) {
            this.stepDelayMs = ms;
            return this;
        }

        public PhoneAgent build() {
            if (model == null || shell == null) {
                throw new IllegalArgumentException("model client and shell executor are required");
            }
            return new PhoneAgent(this);
        }
    }
}
