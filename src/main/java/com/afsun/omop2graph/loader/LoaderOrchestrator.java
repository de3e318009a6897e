package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.ConfirmationMissingException;
import com.afsun.omop2graph.core.exceptions.ConnectivityException;
import com.afsun.omop2graph.core.exceptions.LoadBatchException;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.ChunkedRowReader;
import com.afsun.omop2graph.core.reader.RowBatch;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.validation.GraphValidator;
import com.afsun.omop2graph.validation.ValidationBaseline;
import com.afsun.omop2graph.validation.ValidationReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 加载编排状态机
 * <pre>
 * IDLE -> CONFIRM_WIPE -> WIPE -> SCHEMA_APPLY -> LOAD -> VALIDATE -> DONE | FAILED
 * </pre>
 * 每次 {@link #step(LoadResult, LoadRequest)} 执行当前状态的动作并流转到下一个状态。
 * 取消只在状态边界生效，批次内部不会中断。
 *
 * @author afsun
 */
@Slf4j
public class LoaderOrchestrator {

    private final GraphStore graphStore;
    private final GraphValidator validator;
    private final BulkImportCommandBuilder commandBuilder;
    private final MigrationSettings settings;

    public LoaderOrchestrator(GraphStore graphStore, GraphValidator validator, MigrationSettings settings) {
        this.graphStore = graphStore;
        this.validator = validator;
        this.commandBuilder = new BulkImportCommandBuilder(settings);
        this.settings = settings;
    }

    public LoadResult run(LoadRequest request) {
        LoadResult result = new LoadResult(request.getPlan());
        log.info("开始执行 {}", request.getPlan());
        while (!result.isTerminal()) {
            step(result, request);
        }
        if (result.succeeded()) {
            log.info("{} 执行完成", request.getPlan());
        } else {
            log.error("{} 执行失败: {}, 断点: {}", request.getPlan(), result.failureMessage(), result.getCheckpoint());
        }
        return result;
    }

    /**
     * 执行当前状态并流转，返回新状态
     */
    public LoaderState step(LoadResult result, LoadRequest request) {
        LoaderState current = result.getState();
        if (current.isTerminal()) {
            return current;
        }
        if (result.isCancelled()) {
            result.fail(new MigrationException("CANCELLED", "在 " + current + " 之前被取消", null));
            return result.getState();
        }
        LoadPlan plan = request.getPlan();
        try {
            switch (current) {
                case IDLE:
                    break;
                case CONFIRM_WIPE:
                    confirmWipe(request);
                    break;
                case WIPE:
                    wipe(result);
                    break;
                case SCHEMA_APPLY:
                    applySchema(result);
                    break;
                case LOAD:
                    if (plan.isOffline()) {
                        buildBulkCommand(result, request);
                    } else {
                        loadOnline(result, request.getOnlineArtifacts());
                    }
                    break;
                case VALIDATE:
                    if (!validate(result, request)) {
                        result.fail(new MigrationException("VALIDATION_FAILED",
                                "图校验未通过: " + result.getValidationReport().failures().size() + " 项失败", null));
                        return result.getState();
                    }
                    break;
                default:
                    throw new IllegalStateException("未知状态: " + current);
            }
        } catch (ConnectivityException | ConfirmationMissingException | LoadBatchException e) {
            log.error("{} 失败: {}", current, e.getMessage());
            result.fail(e);
            return result.getState();
        } catch (MigrationException e) {
            log.error("{} 失败: {}", current, e.getFormattedMessage());
            result.fail(e);
            return result.getState();
        } catch (RuntimeException e) {
            log.error("{} 出现未预期异常", current, e);
            result.fail(e);
            return result.getState();
        }
        if (current != LoaderState.IDLE) {
            result.addProgress(current + " 完成");
        }
        result.moveTo(plan.next(current));
        return result.getState();
    }

    void confirmWipe(LoadRequest request) {
        if (request.isConfirmed()) {
            log.info("已通过参数确认清空图库");
            return;
        }
        if (!request.getPrompt().confirm("将删除图库中的全部节点、关系、约束和索引，是否继续？")) {
            throw new ConfirmationMissingException("未确认清空图库，未做任何修改");
        }
    }

    void wipe(LoadResult result) {
        ensureConnected(result);
        log.info("清空图库...");
        graphStore.dropSchema();
        long deleted = graphStore.deleteAll(settings.getLoadBatchSize());
        log.info("图库已清空, 删除 {} 个节点", deleted);
    }

    void applySchema(LoadResult result) {
        ensureConnected(result);
        for (SchemaElement element : GraphSchema.ELEMENTS) {
            graphStore.applySchema(element);
        }
        log.info("约束和索引已就绪: {}", graphStore.schemaElementNames());
    }

    /**
     * 先加载全部节点表，再加载关系表，关系的端点必须已存在
     */
    void loadOnline(LoadResult result, OnlineArtifacts artifacts) {
        if (artifacts == null) {
            throw new MigrationException("ARTIFACT_MISSING", "缺少在线加载文件", "先执行 transform");
        }
        ensureConnected(result);
        long[] total = {0L};
        for (SourceTable table : SourceTable.nodeTables()) {
            loadTable(result, table, artifacts, total);
        }
        for (SourceTable table : SourceTable.relationshipTables()) {
            loadTable(result, table, artifacts, total);
        }
        log.info("在线加载完成, 共提交 {} 行", total[0]);
    }

    private void loadTable(LoadResult result, SourceTable table, OnlineArtifacts artifacts, long[] total) {
        long startTime = System.currentTimeMillis();
        long[] tableRows = {0L};
        ChunkedRowReader reader = ChunkedRowReader.forOnline(table, artifacts.fileFor(table), settings.getLoadBatchSize());
        try (ChunkedRowReader.BatchCursor cursor = reader.open()) {
            while (cursor.hasNext()) {
                RowBatch batch = cursor.next();
                if (!batch.getSkipped().isEmpty()) {
                    log.warn("{} 批次 #{} 中有 {} 行无法解析，已忽略", table, batch.getIndex(), batch.getSkipped().size());
                }
                if (batch.getRows().isEmpty()) {
                    continue;
                }
                commitWithRetry(table, batch);
                tableRows[0] += batch.size();
                total[0] += batch.size();
                result.setCheckpoint(new LoadCheckpoint(table, batch.getIndex(), tableRows[0], total[0]));
            }
        }
        result.addProgress(table + " 已加载 " + tableRows[0] + " 行");
        log.info("{} 加载完成: {} 行, 耗时 {}ms", table, tableRows[0], System.currentTimeMillis() - startTime);
    }

    /**
     * 每个批次独立提交；失败后有限次重试，仍失败则整体失败
     */
    private void commitWithRetry(SourceTable table, RowBatch batch) {
        int attempt = 0;
        while (true) {
            try {
                commit(table, batch);
                return;
            } catch (ConnectivityException e) {
                throw e;
            } catch (RuntimeException e) {
                attempt++;
                if (attempt > settings.getMaxBatchRetries()) {
                    throw new LoadBatchException(table.name(), batch.getIndex(), e);
                }
                log.warn("{} 批次 #{} 第 {} 次失败, 准备重试: {}", table, batch.getIndex(), attempt, e.getMessage());
                pause();
            }
        }
    }

    private void commit(SourceTable table, RowBatch batch) {
        if (table.isNode()) {
            List<NodeRecord> nodes = new ArrayList<>(batch.size());
            for (SourceRow row : batch.getRows()) {
                nodes.add(OnlineRowMapper.toNode(table, row));
            }
            graphStore.writeNodes(nodes);
        } else {
            List<RelationshipRecord> relationships = new ArrayList<>(batch.size());
            for (SourceRow row : batch.getRows()) {
                relationships.add(OnlineRowMapper.toRelationship(table, row));
            }
            graphStore.writeRelationships(relationships);
        }
    }

    private void pause() {
        if (settings.getRetryBackoffMillis() <= 0) {
            return;
        }
        try {
            Thread.sleep(settings.getRetryBackoffMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException("INTERRUPTED", "重试等待被中断", null, e);
        }
    }

    boolean validate(LoadResult result, LoadRequest request) {
        ValidationBaseline baseline = request.getValidationBaseline();
        if (baseline == null && request.getOnlineArtifacts() != null) {
            baseline = ValidationBaseline.online(request.getOnlineArtifacts(), settings.getLoadBatchSize());
        }
        if (baseline == null) {
            throw new MigrationException("ARTIFACT_MISSING", "缺少转换报告，无法校验", "先执行 transform 或 prepare-bulk");
        }
        ensureConnected(result);
        ValidationReport report = validator.validate(baseline);
        result.setValidationReport(report);
        return report.passed();
    }

    void buildBulkCommand(LoadResult result, LoadRequest request) {
        String command = commandBuilder.build(request.getManifest());
        result.setBulkCommand(command);
        log.info("已生成 neo4j-admin 导入命令:\n{}", command);
    }

    private void ensureConnected(LoadResult result) {
        if (!result.isConnected()) {
            graphStore.verifyConnectivity();
            result.markConnected();
        }
    }
}
