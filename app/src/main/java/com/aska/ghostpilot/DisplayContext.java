package com.aska.ghostpilot;

/**
 * 动作执行时的屏幕环境
 *
 * remoteAvailable 为 true 时动作优先发往 Shower 虚拟屏，否则走本地 shell。
 */
public final class DisplayContext {

    private final boolean remoteAvailable;
    private final Integer displayId;
    private final int screenWidth;
    private final int screenHeight;
    private final CoordinateSystem coordinateSystem;

    public DisplayContext(boolean remoteAvailable, Integer displayId,
                          int screenWidth, int screenHeight, CoordinateSystem coordinateSystem) {
        this.remoteAvailable = remoteAvailable;
        this.displayId = displayId;
        this.screenWidth = screenWidth > 0 ? screenWidth : Config.DEFAULT_SCREEN_WIDTH;
        this.screenHeight = screenHeight > 0 ? screenHeight : Config.DEFAULT_SCREEN_HEIGHT;
        this.coordinateSystem = coordinateSystem != null ? coordinateSystem : CoordinateSystem.AUTO;
    }

    public static DisplayContext local(int screenWidth, int screenHeight, CoordinateSystem coordinateSystem) {
        return new DisplayContext(false, null, screenWidth, screenHeight, coordinateSystem);
    }

    public static DisplayContext remote(Integer displayId, int screenWidth, int screenHeight,
                                        CoordinateSystem coordinateSystem) {
        return new DisplayContext(true, displayId, screenWidth, screenHeight, coordinateSystem);
    }

    public boolean isRemoteAvailable() {
        return remoteAvailable;
    }

    public Integer getDisplayId() {
        return displayId;
    }

    public int getScreenWidth() {
        return screenWidth;
    }

    public int getScreenHeight() {
        return screenHeight;
    }

    public CoordinateSystem getCoordinateSystem() {
        return coordinateSystem;
    }

    @Override
    public String toString() {
        return "DisplayContext{remote=" + remoteAvailable + ", displayId=" + displayId
            + ", screen=" + screenWidth + "x" + screenHeight + ", coordinates=" + coordinateSystem + "}";
    }
}
