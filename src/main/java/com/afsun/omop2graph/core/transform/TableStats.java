package com.afsun.omop2graph.core.transform;

import lombok.Data;

@Data
public class TableStats {
    private long rowsRead;
    private long rowsWritten;
    private long rowsSkipped;
}
