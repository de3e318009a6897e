package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.validation.ValidationReport;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编排运行的状态与结果，状态机每一步都在这里记录
 */
@Getter
public class LoadResult {

    private final LoadPlan plan;
    private LoaderState state = LoaderState.IDLE;
    private final List<LoaderState> visited = new ArrayList<>();
    /**
     * 已完成的步骤描述，失败时用于说明失败前做了什么
     */
    private final List<String> progress = new ArrayList<>();
    private Throwable failure;
    private LoadCheckpoint checkpoint;
    private ValidationReport validationReport;
    private String bulkCommand;
    private boolean connected;
    private volatile boolean cancelled;

    public LoadResult(LoadPlan plan) {
        this.plan = plan;
        this.visited.add(LoaderState.IDLE);
    }

    public boolean succeeded() {
        return state == LoaderState.DONE;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public List<String> getProgress() {
        return Collections.unmodifiableList(progress);
    }

    public String failureMessage() {
        if (failure == null) {
            return null;
        }
        return failure.getMessage();
    }

    /**
     * 请求在下一个状态边界终止
     */
    public void cancel() {
        this.cancelled = true;
    }

    void moveTo(LoaderState next) {
        this.state = next;
        this.visited.add(next);
    }

    void fail(Throwable cause) {
        this.failure = cause;
        moveTo(LoaderState.FAILED);
    }

    void addProgress(String line) {
        progress.add(line);
    }

    void setCheckpoint(LoadCheckpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    void setValidationReport(ValidationReport validationReport) {
        this.validationReport = validationReport;
    }

    void setBulkCommand(String bulkCommand) {
        this.bulkCommand = bulkCommand;
    }

    void markConnected() {
        this.connected = true;
    }
}
