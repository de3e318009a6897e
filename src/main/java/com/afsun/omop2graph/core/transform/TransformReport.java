package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.SkippedRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 转换结果统计：每张表的读写行数、逐条列出的跳过行，以及按标签、关系类型的期望数量。
 * 校验器以它作为期望值来源。
 *
 * @author afsun
 */
@Data
public class TransformReport {

    /**
     * online 或 offline
     */
    private String mode;

    private Map<String, TableStats> tables = new LinkedHashMap<>();

    private List<SkippedRow> skippedRows = new ArrayList<>();

    private Map<String, Long> expectedNodeCounts = new LinkedHashMap<>();

    private Map<String, Long> expectedRelationshipCounts = new LinkedHashMap<>();

    private long elapsedMillis;

    public TableStats stats(SourceTable table) {
        return tables.computeIfAbsent(table.name(), k -> new TableStats());
    }

    public void recordSkipped(SourceTable table, SkippedRow row) {
        stats(table).setRowsSkipped(stats(table).getRowsSkipped() + 1);
        skippedRows.add(row);
    }

    public void countNode(Collection<String> labels) {
        for (String label : labels) {
            expectedNodeCounts.merge(label, 1L, Long::sum);
        }
    }

    public void countRelationship(String type) {
        expectedRelationshipCounts.merge(type, 1L, Long::sum);
    }

    public long totalSkipped() {
        return skippedRows.size();
    }

    public long totalWritten() {
        return tables.values().stream().mapToLong(TableStats::getRowsWritten).sum();
    }
}
