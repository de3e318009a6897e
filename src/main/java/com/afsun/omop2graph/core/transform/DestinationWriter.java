package com.afsun.omop2graph.core.transform;

import lombok.Getter;
import org.apache.commons.csv.CSVPrinter;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 单个目标文件的输出句柄，表头在创建时写入一次
 */
@Getter
public class DestinationWriter implements Closeable {

    private final RowDestination destination;
    private final Path file;
    private final List<String> header;
    private final CSVPrinter printer;
    private long rowCount;
    private boolean closed;

    DestinationWriter(RowDestination destination, Path file, List<String> header) throws IOException {
        this.destination = destination;
        this.file = file;
        this.header = Collections.unmodifiableList(header);
        this.printer = CsvFormats.create(file, header);
    }

    public void write(List<String> values) throws IOException {
        printer.printRecord(values);
        rowCount++;
    }

    public ManifestEntry toManifestEntry() {
        ManifestEntry entry = new ManifestEntry();
        entry.setKind(destination.getKind());
        entry.setDestinationKey(destination.getKey());
        entry.setLabels(destination.getLabels());
        entry.setRelationshipType(destination.getRelationshipType());
        entry.setFile(file.toAbsolutePath().toString());
        entry.setRowCount(rowCount);
        entry.setHeader(header);
        return entry;
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            printer.close();
        }
    }
}
