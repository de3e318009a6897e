package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.reader.SourceTable;
import lombok.Value;

/**
 * 最近一次成功提交的批次
 */
@Value
public class LoadCheckpoint {
    SourceTable table;
    int batchIndex;
    long tableRowsCommitted;
    long totalRowsCommitted;

    @Override
    public String toString() {
        return table + " 批次 #" + batchIndex + " (本表 " + tableRowsCommitted + " 行, 累计 " + totalRowsCommitted + " 行)";
    }
}
