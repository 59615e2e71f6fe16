package com.aska.ghostpilot;

/**
 * 任务状态
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    PAUSED,
    WAITING_CONFIRMATION,
    WAITING_TAKEOVER,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
