package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.ColumnSpec;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 离线产物：按标签集合或关系类型分区，每个文件只包含一种节点标签组合或一种关系类型，
 * 表头采用 neo4j-admin import 的格式。
 *
 * @author afsun
 */
public class OfflineBulkEmitter implements GraphRowEmitter {

    private final DestinationWriterPool pool;

    public OfflineBulkEmitter(Path directory) {
        this.pool = new DestinationWriterPool(directory);
    }

    @Override
    public void beginTable(SourceTable table) {
        // 目标文件按需创建
    }

    @Override
    public void emit(SourceRow row, RowDestination destination) throws IOException {
        pool.acquire(destination, OfflineBulkEmitter::header).write(values(destination.getTable(), row));
    }

    @Override
    public void endTable(SourceTable table) {
        // 同一目标可能跨表复用，句柄统一在 close 时释放
    }

    public int openHandles() {
        return pool.openHandles();
    }

    public ImportManifest manifest(Path importDir) {
        ImportManifest manifest = new ImportManifest();
        manifest.setImportDir(importDir.toAbsolutePath().toString());
        List<DestinationWriter> writers = pool.writers();
        // 节点条目在前，关系条目在后，各自保持首次出现顺序
        writers.stream().filter(w -> w.getDestination().getTable().isNode())
                .forEach(w -> manifest.getEntries().add(w.toManifestEntry()));
        writers.stream().filter(w -> !w.getDestination().getTable().isNode())
                .forEach(w -> manifest.getEntries().add(w.toManifestEntry()));
        return manifest;
    }

    @Override
    public void close() throws IOException {
        pool.close();
    }

    static List<String> header(RowDestination destination) {
        SourceTable table = destination.getTable();
        List<String> header = new ArrayList<>();
        if (table.isNode()) {
            header.add(":ID(" + table.getIdSpace() + ")");
        } else {
            header.add(":START_ID(" + table.getIdSpace() + ")");
            header.add(":END_ID(" + table.getIdSpace() + ")");
        }
        header.addAll(propertyColumns(table).stream()
                .map(OfflineBulkEmitter::headerField)
                .collect(Collectors.toList()));
        return header;
    }

    static List<String> values(SourceTable table, SourceRow row) {
        List<String> values = new ArrayList<>();
        if (table.isNode()) {
            values.add(row.get(table.getKeyColumn()));
        } else {
            values.add(row.get(table.getStartColumn()));
            values.add(row.get(table.getEndColumn()));
        }
        for (ColumnSpec column : propertyColumns(table)) {
            values.add(row.get(column.getName()));
        }
        return values;
    }

    private static List<ColumnSpec> propertyColumns(SourceTable table) {
        return table.getColumns().stream()
                .filter(c -> c.getProperty() != null)
                .collect(Collectors.toList());
    }

    private static String headerField(ColumnSpec column) {
        String adminType = column.getType().getAdminType();
        return adminType == null ? column.getProperty() : column.getProperty() + ":" + adminType;
    }
}
