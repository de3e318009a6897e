package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.ChunkedRowReader;
import com.afsun.omop2graph.core.reader.RowBatch;
import com.afsun.omop2graph.core.reader.SkippedRow;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 词表到图的转换引擎
 * <p>
 * 逐批读取抽取出的CSV，为每一行解析标签或关系类型，再交给在线或离线输出端。
 * 单线程，一次只持有一个批次；同一份输入无论批次大小，输出内容与顺序完全一致。
 *
 * @author afsun
 */
@Slf4j
public class GraphTransformationEngine {

    private final LabelResolver resolver;
    private final ArtifactStore artifactStore;
    private final int chunkSize;

    /**
     * 原始取值 -> 去向，避免每行重复构造
     */
    private final Map<String, RowDestination> destinations = new HashMap<>();

    public GraphTransformationEngine(LabelResolver resolver, ArtifactStore artifactStore, MigrationSettings settings) {
        this.resolver = resolver;
        this.artifactStore = artifactStore;
        this.chunkSize = settings.getChunkSize();
    }

    /**
     * 生成在线加载用CSV
     */
    public OnlineArtifacts transformOnline(Path exportDir, Path onlineDir) {
        long startTime = System.currentTimeMillis();
        createDirectories(onlineDir);
        log.info("开始生成在线加载文件: {} -> {}, 批次大小 {}", exportDir, onlineDir, chunkSize);

        TransformReport report = new TransformReport();
        report.setMode("online");
        try (OnlineCsvEmitter emitter = new OnlineCsvEmitter(onlineDir)) {
            transformAll(exportDir, emitter, report);
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "写入在线文件失败: " + onlineDir, null, e);
        }
        report.setElapsedMillis(System.currentTimeMillis() - startTime);
        artifactStore.writeReport(onlineDir, report);

        log.info("在线文件生成完成: 写入 {} 行, 跳过 {} 行, 耗时 {}ms",
                report.totalWritten(), report.totalSkipped(), report.getElapsedMillis());
        return new OnlineArtifacts(onlineDir, report);
    }

    /**
     * 生成 neo4j-admin 批量导入文件和清单
     */
    public ImportManifest prepareBulkImport(Path exportDir, Path importDir) {
        long startTime = System.currentTimeMillis();
        createDirectories(importDir);
        removePreviousPartitions(importDir);
        log.info("开始生成批量导入文件: {} -> {}, 批次大小 {}", exportDir, importDir, chunkSize);

        TransformReport report = new TransformReport();
        report.setMode("offline");
        ImportManifest manifest;
        try (OfflineBulkEmitter emitter = new OfflineBulkEmitter(importDir)) {
            transformAll(exportDir, emitter, report);
            manifest = emitter.manifest(importDir);
            log.info("共 {} 个目标文件", emitter.openHandles());
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "写入批量导入文件失败: " + importDir, null, e);
        }
        report.setElapsedMillis(System.currentTimeMillis() - startTime);
        artifactStore.writeManifest(importDir, manifest);
        artifactStore.writeReport(importDir, report);

        log.info("批量导入文件生成完成: {} 个文件, {} 行, 跳过 {} 行, 耗时 {}ms",
                manifest.getEntries().size(), manifest.totalRows(), report.totalSkipped(), report.getElapsedMillis());
        return manifest;
    }

    /**
     * 解析一行数据的去向
     */
    public RowDestination classify(SourceTable table, SourceRow row) {
        switch (table) {
            case CONCEPT: {
                String domainId = row.get("domain_id");
                String standard = row.get("standard_concept");
                return destinations.computeIfAbsent(table.name() + '\u0000' + domainId + '\u0000' + standard,
                        k -> RowDestination.nodes(table, resolver.resolveLabels(domainId, standard)));
            }
            case DOMAIN:
            case VOCABULARY:
                return destinations.computeIfAbsent(table.name(),
                        k -> RowDestination.nodes(table, Collections.singleton(table.getFixedLabel())));
            case CONCEPT_RELATIONSHIP: {
                String relationshipId = row.get("relationship_id");
                return destinations.computeIfAbsent(table.name() + '\u0000' + relationshipId,
                        k -> RowDestination.relationships(table, resolver.resolveRelationshipType(relationshipId)));
            }
            case CONCEPT_ANCESTOR:
                return destinations.computeIfAbsent(table.name(),
                        k -> RowDestination.relationships(table, LabelResolver.HAS_ANCESTOR));
            default:
                throw new IllegalArgumentException("未知的源表: " + table);
        }
    }

    private void transformAll(Path exportDir, GraphRowEmitter emitter, TransformReport report) throws IOException {
        for (SourceTable table : SourceTable.values()) {
            Path file = table.resolveInputFile(exportDir);
            if (!file.getFileName().toString().equals(table.getFileName())) {
                log.info("{} 使用输入文件 {}", table, file.getFileName());
            }
            transformTable(table, file, emitter, report);
        }
    }

    private void transformTable(SourceTable table, Path file, GraphRowEmitter emitter, TransformReport report) throws IOException {
        ChunkedRowReader reader = ChunkedRowReader.forSource(table, file, chunkSize);
        TableStats stats = report.stats(table);
        // Domain、Vocabulary 量很小，按主键去重；概念表的唯一性由图中的唯一约束保证
        Set<String> seenKeys = table.getFixedLabel() != null ? new HashSet<>() : null;

        emitter.beginTable(table);
        try (ChunkedRowReader.BatchCursor cursor = reader.open()) {
            while (cursor.hasNext()) {
                RowBatch batch = cursor.next();
                stats.setRowsRead(stats.getRowsRead() + batch.size() + batch.getSkipped().size());
                for (SkippedRow skipped : batch.getSkipped()) {
                    report.recordSkipped(table, skipped);
                }
                for (SourceRow row : batch.getRows()) {
                    if (seenKeys != null && !seenKeys.add(row.get(table.getKeyColumn()))) {
                        report.recordSkipped(table, new SkippedRow(table.name(), row.getRecordNumber(),
                                "重复主键 " + table.getKeyColumn() + "=" + row.get(table.getKeyColumn())));
                        continue;
                    }
                    RowDestination destination = classify(table, row);
                    emitter.emit(row, destination);
                    if (table.isNode()) {
                        report.countNode(destination.getLabels());
                    } else {
                        report.countRelationship(destination.getRelationshipType());
                    }
                    stats.setRowsWritten(stats.getRowsWritten() + 1);
                }
            }
        }
        emitter.endTable(table);
        log.info("{} 转换完成: 读取 {} 行, 写入 {} 行, 跳过 {} 行",
                table, stats.getRowsRead(), stats.getRowsWritten(), stats.getRowsSkipped());
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "无法创建目录: " + dir, null, e);
        }
    }

    private static void removePreviousPartitions(Path dir) {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "{nodes_,rels_,ancestor_rels_}*.csv")) {
            for (Path file : stream) {
                Files.delete(file);
                log.debug("删除旧文件: {}", file);
            }
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "无法清理旧的导入文件: " + dir, null, e);
        }
    }
}
