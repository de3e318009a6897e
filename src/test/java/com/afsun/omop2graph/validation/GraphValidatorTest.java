package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.ChunkedRowReader;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import com.afsun.omop2graph.core.transform.ArtifactStore;
import com.afsun.omop2graph.core.transform.GraphTransformationEngine;
import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.OnlineArtifacts;
import com.afsun.omop2graph.loader.ConceptSample;
import com.afsun.omop2graph.loader.InMemoryGraphStore;
import com.afsun.omop2graph.loader.NodeRecord;
import com.afsun.omop2graph.loader.OnlineRowMapper;
import com.afsun.omop2graph.loader.RelationshipRecord;
import com.afsun.omop2graph.loader.VocabularyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    @TempDir
    Path tempDir;

    private InMemoryGraphStore store;
    private MigrationSettings settings;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        settings = MigrationSettings.builder().loadBatchSize(2).build();
    }

    private OnlineArtifacts transform(String relationships) throws IOException {
        Path export = VocabularyFixtures.write(tempDir.resolve("export"), VocabularyFixtures.CONCEPT_CSV, relationships);
        return new GraphTransformationEngine(new LabelResolver(), new ArtifactStore(), settings)
                .transformOnline(export, tempDir.resolve("online"));
    }

    /**
     * 直接把在线文件写入内存图库
     */
    private void load(OnlineArtifacts artifacts) {
        for (SourceTable table : SourceTable.values()) {
            ChunkedRowReader.forOnline(table, artifacts.fileFor(table), 100).forEachBatch(batch -> {
                if (table.isNode()) {
                    List<NodeRecord> nodes = new ArrayList<>();
                    for (SourceRow row : batch.getRows()) {
                        nodes.add(OnlineRowMapper.toNode(table, row));
                    }
                    store.writeNodes(nodes);
                } else {
                    List<RelationshipRecord> relationships = new ArrayList<>();
                    for (SourceRow row : batch.getRows()) {
                        relationships.add(OnlineRowMapper.toRelationship(table, row));
                    }
                    store.writeRelationships(relationships);
                }
            });
        }
    }

    @Test
    void testConsistentGraphPasses() throws IOException {
        OnlineArtifacts artifacts = transform(VocabularyFixtures.RELATIONSHIP_CSV);
        load(artifacts);

        ValidationReport report = new GraphValidator(store, settings).validate(artifacts);

        assertTrue(report.passed(), report.summary());
        assertTrue(report.failures().isEmpty());
        assertEquals(1, report.checksOf(ValidationCheck.Kind.AVERAGE_DEGREE).size());
        assertFalse(report.checksOf(ValidationCheck.Kind.AVERAGE_DEGREE).get(0).isGating());
    }

    @Test
    void testDanglingEndpointIsReportedOnce() throws IOException {
        OnlineArtifacts artifacts = transform(VocabularyFixtures.RELATIONSHIP_CSV
                + "2,12345,Maps to,19700101,20991231,\n");
        load(artifacts);

        ValidationReport report = new GraphValidator(store, settings).validate(artifacts);

        assertFalse(report.passed());
        List<ValidationCheck> integrityFailures = new ArrayList<>();
        for (ValidationCheck check : report.failures()) {
            if (check.getKind() == ValidationCheck.Kind.REFERENTIAL_INTEGRITY) {
                integrityFailures.add(check);
            }
        }
        assertEquals(1, integrityFailures.size());
        assertEquals("MAPS_TO", integrityFailures.get(0).getSubject());
        assertEquals(1L, integrityFailures.get(0).getActual());
        // 计数检查同样失败，所有检查都执行完毕
        assertTrue(report.failures().stream().anyMatch(c -> c.getKind() == ValidationCheck.Kind.RELATIONSHIP_COUNT));
        assertEquals(3, report.checksOf(ValidationCheck.Kind.REFERENTIAL_INTEGRITY).size());
    }

    @Test
    void testMissingNodesFailCountCheck() throws IOException {
        OnlineArtifacts artifacts = transform(VocabularyFixtures.RELATIONSHIP_CSV);

        ValidationReport report = new GraphValidator(store, settings).validate(artifacts);

        assertFalse(report.passed());
        ValidationCheck concepts = report.checksOf(ValidationCheck.Kind.NODE_COUNT).stream()
                .filter(c -> LabelResolver.CONCEPT.equals(c.getSubject()))
                .findFirst().orElseThrow(IllegalStateException::new);
        assertEquals(2L, concepts.getExpected());
        assertEquals(0L, concepts.getActual());
        assertTrue(report.summary().contains("FAILED"));
    }

    @Test
    void testSkippedRowsAppearInSummary() throws IOException {
        Path export = VocabularyFixtures.write(tempDir.resolve("export"),
                VocabularyFixtures.CONCEPT_CSV + "bad,Broken,Drug,RxNorm,Ingredient,S,1,19700101,20991231,\n",
                VocabularyFixtures.RELATIONSHIP_CSV);
        OnlineArtifacts artifacts = new GraphTransformationEngine(new LabelResolver(), new ArtifactStore(), settings)
                .transformOnline(export, tempDir.resolve("online"));
        load(artifacts);

        ValidationReport report = new GraphValidator(store, settings).validate(artifacts);

        assertTrue(report.passed(), report.summary());
        assertEquals(1, report.getSkippedRows().size());
        assertTrue(report.summary().contains("SKIPPED CONCEPT#3"));
    }

    @Test
    void testOfflineBaselineReadsBulkRelationshipFiles() throws IOException {
        String relationships = VocabularyFixtures.RELATIONSHIP_CSV + "2,12345,Maps to,19700101,20991231,\n";
        OnlineArtifacts artifacts = transform(relationships);
        load(artifacts);
        Path importDir = tempDir.resolve("import");
        ArtifactStore artifactStore = new ArtifactStore();
        ImportManifest manifest = new GraphTransformationEngine(new LabelResolver(), artifactStore, settings)
                .prepareBulkImport(tempDir.resolve("export"), importDir);

        ValidationBaseline baseline = ValidationBaseline.offline(importDir, artifactStore.readReport(importDir), manifest, 2);
        ValidationReport report = new GraphValidator(store, settings).validate(baseline);

        assertEquals("offline", baseline.getMode());
        assertEquals(3, baseline.getRelationshipSources().size());
        ValidationCheck mapsTo = report.checksOf(ValidationCheck.Kind.REFERENTIAL_INTEGRITY).stream()
                .filter(c -> "MAPS_TO".equals(c.getSubject()))
                .findFirst().orElseThrow(IllegalStateException::new);
        assertFalse(mapsTo.isPassed());
        assertEquals(1L, mapsTo.getActual());
        assertTrue(report.checksOf(ValidationCheck.Kind.REFERENTIAL_INTEGRITY).stream()
                .filter(c -> !"MAPS_TO".equals(c.getSubject()))
                .allMatch(ValidationCheck::isPassed));
    }

    @Test
    void testLocatePrefersOnlineArtifactsAndFallsBackToImportDir() throws IOException {
        ArtifactStore artifactStore = new ArtifactStore();
        Path online = tempDir.resolve("online");
        Path importDir = tempDir.resolve("import");

        MigrationException missing = assertThrows(MigrationException.class,
                () -> ValidationBaseline.locate(artifactStore, online, importDir, 2));
        assertEquals("ARTIFACT_MISSING", missing.getErrorCode());

        Path export = VocabularyFixtures.write(tempDir.resolve("export"));
        GraphTransformationEngine engine = new GraphTransformationEngine(new LabelResolver(), artifactStore, settings);
        engine.prepareBulkImport(export, importDir);
        assertEquals("offline", ValidationBaseline.locate(artifactStore, online, importDir, 2).getMode());

        engine.transformOnline(export, online);
        assertEquals("online", ValidationBaseline.locate(artifactStore, online, importDir, 2).getMode());
    }

    @Test
    void testSampleConceptDescribesNeighbourhood() throws IOException {
        String concepts = "concept_id,concept_name,domain_id,vocabulary_id,concept_class_id,standard_concept,concept_code,"
                + "valid_start_date,valid_end_date,invalid_reason,synonyms\n"
                + "1,Aspirin,Drug,RxNorm,Ingredient,S,1191,19700101,20991231,,Acetylsalicylic acid|ASA\n"
                + "2,Headache,Condition,SNOMED,Clinical Finding,,25064002,19700101,20991231,,\n";
        Path export = VocabularyFixtures.write(tempDir.resolve("export"), concepts, VocabularyFixtures.RELATIONSHIP_CSV);
        OnlineArtifacts artifacts = new GraphTransformationEngine(new LabelResolver(), new ArtifactStore(), settings)
                .transformOnline(export, tempDir.resolve("online"));
        load(artifacts);
        MigrationSettings sampled = settings.toBuilder().sampleConceptId(1L).build();

        ValidationReport report = new GraphValidator(store, sampled).validate(artifacts);

        assertTrue(report.passed(), report.summary());
        ConceptSample sample = report.getConceptSample();
        assertNotNull(sample);
        assertEquals("Aspirin", sample.getName());
        assertEquals(Arrays.asList("CONCEPT", "DRUG", "STANDARD"), sample.getLabels());
        assertEquals(2, sample.getSynonymCount());
        assertEquals(Arrays.asList("HAS_ANCESTOR", "TREATS"), new ArrayList<>(sample.getOutgoing().keySet()));
        assertEquals(1L, sample.getOutgoing().get("TREATS").getCount());
        assertEquals(Collections.singletonList("Headache"), sample.getOutgoing().get("TREATS").getSampleNames());

        ValidationCheck check = report.checksOf(ValidationCheck.Kind.SAMPLE_CONCEPT).get(0);
        assertFalse(check.isGating());
        assertEquals("concept_id=1", check.getSubject());
        assertTrue(report.summary().contains("TREATS=1[Headache]"), report.summary());
    }

    @Test
    void testMissingSampleConceptDoesNotFailValidation() throws IOException {
        OnlineArtifacts artifacts = transform(VocabularyFixtures.RELATIONSHIP_CSV);
        load(artifacts);

        ValidationReport report = new GraphValidator(store, settings).validate(artifacts);

        assertTrue(report.passed(), report.summary());
        assertNull(report.getConceptSample());
        ValidationCheck check = report.checksOf(ValidationCheck.Kind.SAMPLE_CONCEPT).get(0);
        assertEquals("concept_id=1177480", check.getSubject());
        assertEquals(0L, check.getActual());
        assertTrue(check.describe().contains("未找到该概念"));
    }
}
