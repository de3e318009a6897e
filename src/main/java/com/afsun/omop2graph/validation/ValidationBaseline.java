package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.ChunkedRowReader;
import com.afsun.omop2graph.core.reader.ColumnSpec;
import com.afsun.omop2graph.core.reader.ColumnType;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.transform.ArtifactStore;
import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.ManifestEntry;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.core.transform.TransformReport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 校验的期望值来源：转换报告加上用于引用完整性检查的关系文件。
 * 在线加载取在线产物；neo4j-admin 导入后取批量导入目录中的报告和清单。
 *
 * @author afsun
 */
@Slf4j
@Getter
public class ValidationBaseline {

    private static final String START_ID_PREFIX = ":START_ID";
    private static final String END_ID_PREFIX = ":END_ID";

    /**
     * online 或 offline
     */
    private final String mode;

    private final Path directory;

    private final TransformReport report;

    private final List<RelationshipSource> relationshipSources;

    private ValidationBaseline(String mode, Path directory, TransformReport report, List<RelationshipSource> relationshipSources) {
        this.mode = mode;
        this.directory = directory;
        this.report = report;
        this.relationshipSources = Collections.unmodifiableList(relationshipSources);
    }

    public static ValidationBaseline online(OnlineArtifacts artifacts, int batchSize) {
        List<RelationshipSource> sources = new ArrayList<>();
        for (SourceTable table : SourceTable.relationshipTables()) {
            sources.add(new RelationshipSource(
                    ChunkedRowReader.forOnline(table, artifacts.fileFor(table), batchSize),
                    table.getStartColumn(), table.getEndColumn(), SourceTable.REL_TYPE_COLUMN.getName(), null));
        }
        return new ValidationBaseline("online", artifacts.getDirectory(), artifacts.getReport(), sources);
    }

    public static ValidationBaseline offline(Path importDir, TransformReport report, ImportManifest manifest, int batchSize) {
        List<RelationshipSource> sources = new ArrayList<>();
        for (ManifestEntry entry : manifest.relationshipEntries()) {
            String start = headerColumn(entry, START_ID_PREFIX);
            String end = headerColumn(entry, END_ID_PREFIX);
            List<ColumnSpec> columns = Arrays.asList(
                    ColumnSpec.key(start, null, ColumnType.LONG),
                    ColumnSpec.key(end, null, ColumnType.LONG));
            ChunkedRowReader reader = new ChunkedRowReader(entry.getRelationshipType(), columns,
                    Paths.get(entry.getFile()), batchSize);
            sources.add(new RelationshipSource(reader, start, end, null, entry.getRelationshipType()));
        }
        return new ValidationBaseline("offline", importDir, report, sources);
    }

    /**
     * 优先使用在线产物；不存在时回退到批量导入目录（prepare-bulk 后经 neo4j-admin 导入的图）
     */
    public static ValidationBaseline locate(ArtifactStore store, Path onlineDir, Path importDir, int batchSize) {
        if (Files.exists(onlineDir.resolve(ArtifactStore.REPORT_FILE))) {
            return online(store.loadOnlineArtifacts(onlineDir), batchSize);
        }
        if (Files.exists(importDir.resolve(ArtifactStore.REPORT_FILE))
                && Files.exists(importDir.resolve(ImportManifest.FILE_NAME))) {
            log.info("未找到在线产物 {}，使用批量导入目录 {} 作为校验基准", onlineDir, importDir);
            return offline(importDir, store.readReport(importDir), store.readManifest(importDir), batchSize);
        }
        throw new MigrationException("ARTIFACT_MISSING",
                "未找到转换报告: " + onlineDir.resolve(ArtifactStore.REPORT_FILE) + " 或 " + importDir.resolve(ArtifactStore.REPORT_FILE),
                "先执行 transform、load-csv 或 prepare-bulk");
    }

    private static String headerColumn(ManifestEntry entry, String prefix) {
        for (String column : entry.getHeader()) {
            if (column.startsWith(prefix)) {
                return column;
            }
        }
        throw new MigrationException("SCHEMA_MISMATCH", "清单条目缺少 " + prefix + " 列: " + entry.getFile(), null);
    }
}
