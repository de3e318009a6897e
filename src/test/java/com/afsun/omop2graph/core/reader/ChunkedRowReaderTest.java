package com.afsun.omop2graph.core.reader;

import com.afsun.omop2graph.core.exceptions.MigrationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkedRowReaderTest {

    private static final String HEADER = "concept_id,concept_name,domain_id,vocabulary_id,concept_class_id,standard_concept,concept_code,valid_start_date,valid_end_date,invalid_reason\n";

    @TempDir
    Path tempDir;

    private Path concepts(int rows) throws IOException {
        StringBuilder sb = new StringBuilder(HEADER);
        for (int i = 1; i <= rows; i++) {
            sb.append(i).append(",Concept ").append(i).append(",Drug,RxNorm,Ingredient,S,C").append(i)
                    .append(",19700101,2099-12-31,\n");
        }
        Path file = tempDir.resolve("concept.csv");
        Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testBatchBoundaries() throws IOException {
        Path file = concepts(25);
        List<Integer> sizes = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 10).forEachBatch(batch -> {
            sizes.add(batch.size());
            indexes.add(batch.getIndex());
        });
        assertEquals(Arrays.asList(10, 10, 5), sizes);
        assertEquals(Arrays.asList(0, 1, 2), indexes);
    }

    @Test
    void testValuesAreNormalized() throws IOException {
        Path file = concepts(1);
        try (ChunkedRowReader.BatchCursor cursor = ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 100).open()) {
            SourceRow row = cursor.next().getRows().get(0);
            assertEquals("1970-01-01", row.get("valid_start_date"));
            assertEquals("2099-12-31", row.get("valid_end_date"));
            assertEquals(1L, row.getLong("concept_id"));
            assertEquals("", row.get("synonyms"));
            assertFalse(cursor.hasNext());
        }
    }

    @Test
    void testMalformedRowsAreSkippedWithReason() throws IOException {
        Path file = tempDir.resolve("concept.csv");
        Files.write(file, (HEADER
                + "1,Aspirin,Drug,RxNorm,Ingredient,S,1191,19700101,20991231,\n"
                + "abc,Broken,Drug,RxNorm,Ingredient,S,1,19700101,20991231,\n"
                + ",Missing id,Drug,RxNorm,Ingredient,S,1,19700101,20991231,\n"
                + "4,Bad date,Drug,RxNorm,Ingredient,S,1,1970-13-45,20991231,\n")
                .getBytes(StandardCharsets.UTF_8));

        List<SkippedRow> skipped = new ArrayList<>();
        List<SourceRow> rows = new ArrayList<>();
        ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 100).forEachBatch(batch -> {
            rows.addAll(batch.getRows());
            skipped.addAll(batch.getSkipped());
        });
        assertEquals(1, rows.size());
        assertEquals(3, skipped.size());
        assertEquals(2L, skipped.get(0).getRecordNumber());
        assertTrue(skipped.get(0).getReason().contains("concept_id"));
        assertTrue(skipped.get(1).getReason().contains("缺少必填字段"));
        assertTrue(skipped.get(2).getReason().contains("valid_start_date"));
    }

    @Test
    void testMissingColumnIsSchemaMismatch() throws IOException {
        Path file = tempDir.resolve("concept.csv");
        Files.write(file, "concept_id,concept_name\n1,Aspirin\n".getBytes(StandardCharsets.UTF_8));
        MigrationException e = assertThrows(MigrationException.class,
                () -> ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 10).open());
        assertEquals("SCHEMA_MISMATCH", e.getErrorCode());
        assertTrue(e.getMessage().contains("domain_id"));
    }

    @Test
    void testByteOrderMarkIsIgnored() throws IOException {
        Path file = tempDir.resolve("domain.csv");
        Files.write(file, ("\uFEFFdomain_id,domain_name,domain_concept_id\nDrug,Drug,13\n").getBytes(StandardCharsets.UTF_8));
        List<SourceRow> rows = new ArrayList<>();
        ChunkedRowReader.forSource(SourceTable.DOMAIN, file, 10).forEachBatch(batch -> rows.addAll(batch.getRows()));
        assertEquals(1, rows.size());
        assertEquals("Drug", rows.get(0).get("domain_id"));
    }

    @Test
    void testQuotedFieldsWithDelimitersAndNewlines() throws IOException {
        Path file = tempDir.resolve("concept.csv");
        Files.write(file, (HEADER + "1,\"Aspirin, 81 mg \"\"low\"\"\nchewable\",Drug,RxNorm,Clinical Drug,S,1,19700101,20991231,\n")
                .getBytes(StandardCharsets.UTF_8));
        List<SourceRow> rows = new ArrayList<>();
        ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 10).forEachBatch(batch -> rows.addAll(batch.getRows()));
        assertEquals("Aspirin, 81 mg \"low\"\nchewable", rows.get(0).get("concept_name"));
    }

    @Test
    void testEachOpenRestartsFromHeader() throws IOException {
        Path file = concepts(3);
        ChunkedRowReader reader = ChunkedRowReader.forSource(SourceTable.CONCEPT, file, 2);
        int[] first = {0};
        int[] second = {0};
        reader.forEachBatch(batch -> first[0] += batch.size());
        reader.forEachBatch(batch -> second[0] += batch.size());
        assertEquals(3, first[0]);
        assertEquals(3, second[0]);
    }

    @Test
    void testInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> ChunkedRowReader.forSource(SourceTable.CONCEPT, tempDir.resolve("concept.csv"), 0));
    }

    @Test
    void testMissingFileIsReadError() {
        MigrationException e = assertThrows(MigrationException.class,
                () -> ChunkedRowReader.forSource(SourceTable.CONCEPT, tempDir.resolve("none.csv"), 10).open());
        assertEquals("READ_ERROR", e.getErrorCode());
    }
}
