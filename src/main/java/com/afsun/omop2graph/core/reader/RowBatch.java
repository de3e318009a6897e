package com.afsun.omop2graph.core.reader;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一个批次的数据行以及本批次中被跳过的行
 */
@Getter
public class RowBatch {

    private final int index;

    private final List<SourceRow> rows;

    private final List<SkippedRow> skipped;

    public RowBatch(int index, List<SourceRow> rows, List<SkippedRow> skipped) {
        this.index = index;
        this.rows = Collections.unmodifiableList(rows);
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public int size() {
        return rows.size();
    }
}
