package com.aska.ghostpilot;

/**
 * 本地输入通道
 *
 * 远程虚拟屏不可用时，动作通过该接口注入到设备本身。
 * 所有方法返回是否执行成功，不抛出异常。
 */
public interface ShellExecutor {

    boolean tap(int x, int y);

    boolean swipe(int x1, int y1, int x2, int y2, int durationMs);

    boolean keyEvent(int keyCode);

    boolean inputText(String text);

    boolean launchApp(String packageName);

    /**
     * 截图并保存到指定路径（PNG）
     */
    boolean screenshot(String outputPath);
}
