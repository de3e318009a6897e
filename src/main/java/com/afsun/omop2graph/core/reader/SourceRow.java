package com.afsun.omop2graph.core.reader;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 规范化后的一行数据，值按列定义顺序保存
 */
@Getter
public class SourceRow {

    private final long recordNumber;

    private final Map<String, String> values;

    public SourceRow(long recordNumber, Map<String, String> values) {
        this.recordNumber = recordNumber;
        this.values = Collections.unmodifiableMap(values);
    }

    public String get(String column) {
        String value = values.get(column);
        return value == null ? "" : value;
    }

    public long getLong(String column) {
        return Long.parseLong(get(column));
    }
}
