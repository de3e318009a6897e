package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.core.transform.TransformReport;
import com.afsun.omop2graph.loader.ConceptSample;
import com.afsun.omop2graph.loader.GraphStore;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 加载后的只读校验
 * <ol>
 *     <li>每个标签的节点数等于转换时的期望数（已扣除跳过的行）</li>
 *     <li>每种关系类型的关系数等于期望数</li>
 *     <li>引用完整性：关系源数据中端点 concept_id 在图中都存在</li>
 *     <li>平均度数，仅供人工查看</li>
 *     <li>抽样概念的标签、同义词和出边，仅供人工查看</li>
 * </ol>
 * 所有检查都会执行，不会在第一个失败处停止。
 *
 * @author afsun
 */
@Slf4j
public class GraphValidator {

    private final GraphStore graphStore;
    private final int batchSize;
    private final long sampleConceptId;

    public GraphValidator(GraphStore graphStore, MigrationSettings settings) {
        this.graphStore = graphStore;
        this.batchSize = settings.getLoadBatchSize();
        this.sampleConceptId = settings.getSampleConceptId();
    }

    public ValidationReport validate(OnlineArtifacts artifacts) {
        return validate(ValidationBaseline.online(artifacts, batchSize));
    }

    public ValidationReport validate(ValidationBaseline baseline) {
        long startTime = System.currentTimeMillis();
        log.info("开始图校验, 基准: {} {}", baseline.getMode(), baseline.getDirectory());
        TransformReport expectations = baseline.getReport();
        ValidationReport report = new ValidationReport(expectations.getSkippedRows());

        expectations.getExpectedNodeCounts().forEach((label, expected) ->
                report.add(ValidationCheck.count(ValidationCheck.Kind.NODE_COUNT, label, expected,
                        graphStore.countNodesWithLabel(label))));

        expectations.getExpectedRelationshipCounts().forEach((type, expected) ->
                report.add(ValidationCheck.count(ValidationCheck.Kind.RELATIONSHIP_COUNT, type, expected,
                        graphStore.countRelationshipsOfType(type))));

        Map<String, Long> dangling = new LinkedHashMap<>();
        expectations.getExpectedRelationshipCounts().keySet().forEach(type -> dangling.put(type, 0L));
        for (RelationshipSource source : baseline.getRelationshipSources()) {
            countDangling(source, dangling);
        }
        dangling.forEach((type, rows) -> report.add(ValidationCheck.integrity(type, rows)));

        long nodes = graphStore.countNodes();
        long relationships = graphStore.countRelationships();
        report.add(ValidationCheck.averageDegree(nodes == 0 ? 0.0 : 2.0 * relationships / nodes));

        ConceptSample sample = graphStore.findConceptSample(sampleConceptId).orElse(null);
        if (sample == null) {
            log.warn("抽样概念 {} 不存在", sampleConceptId);
        } else {
            log.info("抽样概念 {}: {}", sampleConceptId, sample.describe());
        }
        report.setConceptSample(sample);
        report.add(ValidationCheck.sampleConcept(sampleConceptId, sample));

        log.info("图校验完成: {} 项检查, {} 项失败, 耗时 {}ms",
                report.getChecks().size(), report.failures().size(), System.currentTimeMillis() - startTime);
        for (ValidationCheck failure : report.failures()) {
            log.warn("校验失败: {}", failure.describe());
        }
        return report;
    }

    /**
     * 按批次读取关系文件，批量查询端点是否存在
     */
    private void countDangling(RelationshipSource source, Map<String, Long> dangling) {
        String start = source.getStartColumn();
        String end = source.getEndColumn();
        source.getReader().forEachBatch(batch -> {
            Set<Long> ids = new HashSet<>();
            for (SourceRow row : batch.getRows()) {
                ids.add(row.getLong(start));
                ids.add(row.getLong(end));
            }
            if (ids.isEmpty()) {
                return;
            }
            Set<Long> missing = graphStore.findMissingConcepts(ids);
            if (missing.isEmpty()) {
                return;
            }
            for (SourceRow row : batch.getRows()) {
                if (missing.contains(row.getLong(start)) || missing.contains(row.getLong(end))) {
                    dangling.merge(source.typeOf(row), 1L, Long::sum);
                }
            }
        });
    }
}
