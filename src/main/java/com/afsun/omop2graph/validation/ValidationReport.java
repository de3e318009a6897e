package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.core.reader.SkippedRow;
import com.afsun.omop2graph.loader.ConceptSample;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 校验报告：列出全部检查项，任一门禁检查失败则整体失败
 */
@Getter
public class ValidationReport {

    private final List<ValidationCheck> checks = new ArrayList<>();

    /**
     * 转换阶段被跳过的行，计数检查的期望值已扣除这些行
     */
    private final List<SkippedRow> skippedRows;

    /**
     * 抽样概念结构，概念不存在时为 null
     */
    private ConceptSample conceptSample;

    public ValidationReport(List<SkippedRow> skippedRows) {
        this.skippedRows = skippedRows == null ? Collections.emptyList() : Collections.unmodifiableList(skippedRows);
    }

    public void add(ValidationCheck check) {
        checks.add(check);
    }

    void setConceptSample(ConceptSample conceptSample) {
        this.conceptSample = conceptSample;
    }

    public boolean passed() {
        return checks.stream().filter(ValidationCheck::isGating).allMatch(ValidationCheck::isPassed);
    }

    public List<ValidationCheck> failures() {
        return checks.stream().filter(c -> c.isGating() && !c.isPassed()).collect(Collectors.toList());
    }

    public List<ValidationCheck> checksOf(ValidationCheck.Kind kind) {
        return checks.stream().filter(c -> c.getKind() == kind).collect(Collectors.toList());
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("校验").append(passed() ? "通过" : "失败")
                .append(": ").append(checks.size()).append(" 项检查, ")
                .append(failures().size()).append(" 项失败, 跳过行 ").append(skippedRows.size()).append('\n');
        for (ValidationCheck check : checks) {
            sb.append("  ").append(check.describe()).append('\n');
        }
        for (SkippedRow row : skippedRows) {
            sb.append("  SKIPPED ").append(row.getSource()).append('#').append(row.getRecordNumber())
                    .append(' ').append(row.getReason()).append('\n');
        }
        return sb.toString();
    }
}
