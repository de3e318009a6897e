package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.loader.ConceptSample;
import lombok.Value;

/**
 * 单项校验结果
 */
@Value
public class ValidationCheck {

    public enum Kind {
        NODE_COUNT,
        RELATIONSHIP_COUNT,
        REFERENTIAL_INTEGRITY,
        AVERAGE_DEGREE,
        SAMPLE_CONCEPT
    }

    Kind kind;
    /**
     * 标签或关系类型
     */
    String subject;
    Number expected;
    Number actual;
    boolean passed;
    /**
     * 是否参与整体通过与否的判定，统计类检查只做展示
     */
    boolean gating;
    /**
     * 展示用的补充说明，可为 null
     */
    String detail;

    public static ValidationCheck count(Kind kind, String subject, long expected, long actual) {
        return new ValidationCheck(kind, subject, expected, actual, expected == actual, true, null);
    }

    public static ValidationCheck integrity(String type, long danglingRows) {
        return new ValidationCheck(Kind.REFERENTIAL_INTEGRITY, type, 0L, danglingRows, danglingRows == 0, true, null);
    }

    public static ValidationCheck averageDegree(double degree) {
        return new ValidationCheck(Kind.AVERAGE_DEGREE, "*", null, degree, true, false, null);
    }

    /**
     * 抽样概念的结构，只做展示；概念不存在时 actual 为 0
     */
    public static ValidationCheck sampleConcept(long conceptId, ConceptSample sample) {
        return new ValidationCheck(Kind.SAMPLE_CONCEPT, "concept_id=" + conceptId, null,
                sample == null ? 0L : 1L, true, false,
                sample == null ? "未找到该概念" : sample.describe());
    }

    public String describe() {
        if (!gating) {
            return detail == null
                    ? String.format("%-22s %-30s %s", kind, subject, actual)
                    : String.format("%-22s %-30s %s", kind, subject, detail);
        }
        return String.format("%-22s %-30s expected=%s actual=%s %s", kind, subject, expected, actual, passed ? "OK" : "FAILED");
    }
}
