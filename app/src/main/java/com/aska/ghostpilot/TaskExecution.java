package com.aska.ghostpilot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 任务执行记录（不可变快照）
 *
 * 每次状态变化都生成新的快照；字段名与输出的 JSON 报告一致。
 */
public final class TaskExecution {

    public final String task_id;
    public final String description;
    public final TaskStatus status;
    public final List<StepRecord> steps;
    public final int current_step;
    public final long start_time;
    public final Long end_time;
    public final String result;
    public final String error_message;

    /**
     * 单步记录
     */
    public static final class StepRecord {
        public final int step_number;
        public final String thinking;
        public final String action;
        public final boolean success;
        public final String message;
        public final long timestamp;

        public StepRecord(int step_number, String thinking, String action,
                          boolean success, String message, long timestamp) {
            this.step_number = step_number;
            this.thinking = thinking;
            this.action = action;
            this.success = success;
            this.message = message;
            this.timestamp = timestamp;
        }
    }

    private TaskExecution(String task_id, String description, TaskStatus status, List<StepRecord> steps,
                          int current_step, long start_time, Long end_time, String result, String error_message) {
        this.task_id = task_id;
        this.description = description;
        this.status = status;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.current_step = current_step;
        this.start_time = start_time;
        this.end_time = end_time;
        this.result = result;
        this.error_message = error_message;
    }

    public static TaskExecution start(String taskId, String description) {
        return new TaskExecution(taskId, description, TaskStatus.RUNNING, Collections.<StepRecord>emptyList(),
            0, System.currentTimeMillis(), null, null, null);
    }

    public TaskExecution withStatus(TaskStatus next) {
        return new TaskExecution(task_id, description, next, steps, current_step,
            start_time, end_time, result, error_message);
    }

    public TaskExecution withCurrentStep(int step) {
        return new TaskExecution(task_id, description, status, steps, step,
            start_time, end_time, result, error_message);
    }

    public TaskExecution withStep(StepRecord record) {
        List<StepRecord> next = new ArrayList<>(steps);
        next.add(record);
        return new TaskExecution(task_id, description, status, next, record.step_number,
            start_time, end_time, result, error_message);
    }

    public TaskExecution completed(String resultMessage) {
        return new TaskExecution(task_id, description, TaskStatus.COMPLETED, steps, current_step,
            start_time, System.currentTimeMillis(), resultMessage, null);
    }

    public TaskExecution failed(String error) {
        return new TaskExecution(task_id, description, TaskStatus.FAILED, steps, current_step,
            start_time, System.currentTimeMillis(), null, error);
    }

    public TaskExecution cancelled(String reason) {
        return new TaskExecution(task_id, description, TaskStatus.CANCELLED, steps, current_step,
            start_time, System.currentTimeMillis(), null, reason);
    }

    @Override
    public String toString() {
        return "TaskExecution{" + task_id + ", " + status + ", steps=" + steps.size()
            + (result != null ? ", result=" + result : "")
            + (error_message != null ? ", error=" + error_message : "") + "}";
    }
}
