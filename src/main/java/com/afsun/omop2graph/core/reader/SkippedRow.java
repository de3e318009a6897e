package com.afsun.omop2graph.core.reader;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 被跳过的不合法行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkippedRow {
    private String source;
    private long recordNumber;
    private String reason;
}
