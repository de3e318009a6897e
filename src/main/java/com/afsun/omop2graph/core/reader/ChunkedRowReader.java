package com.afsun.omop2graph.core.reader;

import com.afsun.omop2graph.core.exceptions.MalformedRowException;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * 分块读取器
 * <p>
 * 按固定最大行数把CSV文件切成批次，任意时刻内存中最多只有一个批次。
 * 每次 {@link #open()} 都从文件头重新开始读取。
 *
 * @author afsun
 */
@Slf4j
public class ChunkedRowReader {

    private static final CSVFormat INPUT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final String source;
    private final List<ColumnSpec> columns;
    private final Path file;
    private final int batchSize;

    public ChunkedRowReader(String source, List<ColumnSpec> columns, Path file, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize 必须大于0: " + batchSize);
        }
        this.source = source;
        this.columns = columns;
        this.file = file;
        this.batchSize = batchSize;
    }

    public static ChunkedRowReader forSource(SourceTable table, Path file, int batchSize) {
        return new ChunkedRowReader(table.name(), table.getColumns(), file, batchSize);
    }

    public static ChunkedRowReader forOnline(SourceTable table, Path file, int batchSize) {
        return new ChunkedRowReader(table.name(), table.getOnlineColumns(), file, batchSize);
    }

    public Path getFile() {
        return file;
    }

    /**
     * 打开一个新的游标，调用方负责关闭
     */
    public BatchCursor open() {
        try {
            BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            skipByteOrderMark(reader);
            CSVParser parser = INPUT_FORMAT.parse(reader);
            try {
                checkHeader(parser.getHeaderMap());
            } catch (RuntimeException e) {
                parser.close();
                throw e;
            }
            return new BatchCursor(parser);
        } catch (IOException e) {
            throw new MigrationException("READ_ERROR", "无法读取文件: " + file, "确认抽取步骤已生成该文件", e);
        }
    }

    /**
     * 逐批处理整个文件，无论成功失败都会关闭文件
     */
    public void forEachBatch(Consumer<RowBatch> consumer) {
        try (BatchCursor cursor = open()) {
            while (cursor.hasNext()) {
                consumer.accept(cursor.next());
            }
        }
    }

    private void checkHeader(Map<String, Integer> headerMap) {
        List<String> missing = new ArrayList<>();
        for (ColumnSpec column : columns) {
            if (!column.isOptionalInHeader() && (headerMap == null || !headerMap.containsKey(column.getName()))) {
                missing.add(column.getName());
            }
        }
        if (!missing.isEmpty()) {
            throw new MigrationException("SCHEMA_MISMATCH",
                    source + " 文件 " + file + " 缺少列: " + missing,
                    "检查抽取SQL的输出列");
        }
    }

    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
    }

    SourceRow toRow(CSVRecord record) {
        if (!record.isConsistent()) {
            throw new MalformedRowException("字段数与表头不一致: {}", record.size());
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            String raw = record.isMapped(column.getName()) && record.isSet(column.getName())
                    ? record.get(column.getName()) : "";
            String normalized;
            try {
                normalized = column.getType().normalize(raw);
            } catch (MalformedRowException e) {
                throw new MalformedRowException("列 {} {}", column.getName(), e.getMessage());
            }
            if (column.isRequired() && StringUtils.isBlank(normalized)) {
                throw new MalformedRowException("缺少必填字段 {}", column.getName());
            }
            values.put(column.getName(), normalized);
        }
        return new SourceRow(record.getRecordNumber(), values);
    }

    /**
     * 批次游标
     */
    public class BatchCursor implements Iterator<RowBatch>, Closeable {

        private final CSVParser parser;
        private final Iterator<CSVRecord> records;
        private int nextIndex;
        private boolean closed;

        private BatchCursor(CSVParser parser) {
            this.parser = parser;
            this.records = parser.iterator();
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            try {
                return records.hasNext();
            } catch (UncheckedIOException | IllegalStateException e) {
                throw new MigrationException("READ_ERROR", "读取文件失败: " + file, null, e);
            }
        }

        @Override
        public RowBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<SourceRow> rows = new ArrayList<>(Math.min(batchSize, 1024));
            List<SkippedRow> skipped = new ArrayList<>();
            // 跳过的行也占用批次额度，保证批次边界只取决于源文件
            int consumed = 0;
            while (consumed < batchSize && hasNext()) {
                CSVRecord record = records.next();
                consumed++;
                try {
                    rows.add(toRow(record));
                } catch (MalformedRowException e) {
                    log.debug("跳过不合法行 {}#{}: {}", source, record.getRecordNumber(), e.getMessage());
                    skipped.add(new SkippedRow(source, record.getRecordNumber(), e.getMessage()));
                }
            }
            return new RowBatch(nextIndex++, rows, skipped);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                parser.close();
            } catch (IOException e) {
                throw new UncheckedIOException("关闭文件失败: " + file, e);
            }
        }
    }
}
