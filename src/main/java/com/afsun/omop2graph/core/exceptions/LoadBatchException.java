package com.afsun.omop2graph.core.exceptions;

import lombok.Getter;

/**
 * 单个加载批次写入失败
 */
@Getter
public class LoadBatchException extends MigrationException {

    private final String table;

    private final int batchIndex;

    public LoadBatchException(String table, int batchIndex, Throwable cause) {
        super("LOAD_BATCH_ERROR",
                "批次写入失败: " + table + " #" + batchIndex + ": " + (cause == null ? "" : cause.getMessage()),
                null, cause);
        this.table = table;
        this.batchIndex = batchIndex;
    }
}
