package com.afsun.omop2graph.core.transform;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 在线和离线产物共用的CSV输出格式：RFC 4180 最小引用，双引号转义，LF 换行
 */
public final class CsvFormats {

    public static final CSVFormat OUTPUT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.MINIMAL)
            .setRecordSeparator('\n')
            .build();

    private CsvFormats() {
    }

    /**
     * 新建（覆盖）文件并写入表头
     */
    public static CSVPrinter create(Path file, List<String> header) throws IOException {
        Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, OUTPUT);
        try {
            printer.printRecord(header);
        } catch (IOException e) {
            printer.close();
            throw e;
        }
        return printer;
    }
}
