package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行入口
 *
 * 用法：ghostpilot [-c 配置文件] 任务描述...
 *
 * 敏感操作在终端确认，用户接管时在终端提示；任务结束后把执行记录以 JSON 输出。
 */
public class GhostPilotMain {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Main");

    public static void main(String[] args) {
        Path settingsFile = Paths.get(Config.SETTINGS_FILE);
        StringBuilder task = new StringBuilder();

        for (int i = 0; i < args.length; i++) {
            if (("-c".equals(args[i]) || "--config".equals(args[i])) && i + 1 < args.length) {
                settingsFile = Paths.get(args[++i]);
            } else {
                if (task.length() > 0) task.append(' ');
                task.append(args[i]);
            }
        }

        if (task.length() == 0) {
            System.err.println("Usage: ghostpilot [-c settings.json] <task description>");
            System.exit(2);
            return;
        }

        AgentSettings settings;
        try {
            settings = AgentSettings.load(settingsFile);
        } catch (IOException e) {
            log.error("Failed to load settings", e);
            System.err.println("Failed to load settings: " + e.getMessage());
            System.exit(1);
            return;
        }
        Config.DEBUG_MODE = settings.debug;
        log.info("Starting with {}", settings);

        TaskExecution execution = run(settings, task.toString());
        System.out.println(JsonUtils.toPrettyJson(execution));
        System.exit(execution.status == TaskStatus.COMPLETED ? 0 : 1);
    }

    static TaskExecution run(AgentSettings settings, String task) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ProcessShellExecutor shell = ProcessShellExecutor.fromPrefix(settings.shell_prefix, Authorizer.ALWAYS);
        ModelClient model = new ModelClient(settings);
        RemoteControlChannel channel = settings.shower_enabled
            ? new RemoteControlChannel(settings.showerUrl(), Config.CONNECT_TIMEOUT_MS)
            : null;

        PhoneAgent agent = PhoneAgent.builder(settings, model, shell)
            .remoteChannel(channel)
            .confirmation(message -> ask(stdin, message))
            .takeover(message -> System.out.println("[takeover] " + message))
            .listener(execution -> log.debug("Status: {}", execution))
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(agent::stop, "ghostpilot-stop"));

        try {
            return agent.runTask(task);
        } finally {
            model.release();
            if (channel != null) {
                channel.release();
            }
        }
    }

    private static boolean ask(BufferedReader stdin, String message) {
        System.out.print("[confirm] " + message + " (y/N): ");
        System.out.flush();
        try {
            String line = stdin.readLine();
            return line != null && line.trim().toLowerCase().startsWith("y");
        } catch (IOException e) {
            log.warn("Failed to read confirmation", e);
            return false;
        }
    }
}
