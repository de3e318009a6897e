package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.ColumnSpec;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 在线产物：每张源表输出一个CSV，源列之外追加预计算的 labels 或 rel_type 列，
 * 加载时只需按组批量插入，不需要在查询里做条件判断。
 */
public class OnlineCsvEmitter implements GraphRowEmitter {

    private final Path directory;

    private SourceTable currentTable;
    private CSVPrinter printer;

    public OnlineCsvEmitter(Path directory) {
        this.directory = directory;
    }

    @Override
    public void beginTable(SourceTable table) throws IOException {
        closeCurrent();
        List<String> header = table.getOnlineColumns().stream()
                .map(ColumnSpec::getName)
                .collect(Collectors.toList());
        printer = CsvFormats.create(directory.resolve(table.getFileName()), header);
        currentTable = table;
    }

    @Override
    public void emit(SourceRow row, RowDestination destination) throws IOException {
        List<String> values = new ArrayList<>(currentTable.getColumns().size() + 1);
        for (ColumnSpec column : currentTable.getColumns()) {
            values.add(row.get(column.getName()));
        }
        values.add(destination.onlineValue());
        printer.printRecord(values);
    }

    @Override
    public void endTable(SourceTable table) throws IOException {
        closeCurrent();
    }

    @Override
    public void close() throws IOException {
        closeCurrent();
    }

    private void closeCurrent() throws IOException {
        if (printer != null) {
            CSVPrinter p = printer;
            printer = null;
            currentTable = null;
            p.close();
        }
    }
}
