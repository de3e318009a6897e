package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.EntityKind;
import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.ManifestEntry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class BulkImportCommandBuilderTest {

    private static ManifestEntry entry(EntityKind kind, String file, String type, String... labels) {
        ManifestEntry entry = new ManifestEntry();
        entry.setKind(kind);
        entry.setFile(file);
        entry.setRelationshipType(type);
        entry.setLabels(Arrays.asList(labels));
        entry.setRowCount(1);
        return entry;
    }

    @Test
    void testCommandListsNodesBeforeRelationships() {
        ImportManifest manifest = new ImportManifest();
        manifest.getEntries().add(entry(EntityKind.RELATIONSHIP, "/data/rels_MAPS_TO.csv", "MAPS_TO"));
        manifest.getEntries().add(entry(EntityKind.NODE, "/data/nodes_CONCEPT__DRUG.csv", null, "CONCEPT", "DRUG"));

        String command = new BulkImportCommandBuilder(MigrationSettings.builder().targetDatabase("omop").build()).build(manifest);

        String[] lines = command.split("\n");
        assertEquals("neo4j-admin database import full \\", lines[0]);
        assertEquals("  --nodes=CONCEPT:DRUG='/data/nodes_CONCEPT__DRUG.csv' \\", lines[1]);
        assertEquals("  --relationships=MAPS_TO='/data/rels_MAPS_TO.csv' \\", lines[2]);
        assertTrue(lines[3].contains("--array-delimiter='|'"));
        assertEquals("  omop", lines[4]);
    }

    @Test
    void testPathsWithQuotesAreEscaped() {
        ImportManifest manifest = new ImportManifest();
        manifest.getEntries().add(entry(EntityKind.NODE, "/data/it's/nodes_DOMAIN.csv", null, "DOMAIN"));

        String command = new BulkImportCommandBuilder(MigrationSettings.defaults()).build(manifest);

        assertTrue(command.contains("--nodes=DOMAIN='/data/it'\\''s/nodes_DOMAIN.csv'"));
    }

    @Test
    void testEmptyManifestIsRejected() {
        MigrationException e = assertThrows(MigrationException.class,
                () -> new BulkImportCommandBuilder(MigrationSettings.defaults()).build(new ImportManifest()));
        assertEquals("MANIFEST_EMPTY", e.getErrorCode());
    }
}
