package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.config.MigrationSettings;
import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.afsun.omop2graph.core.reader.ColumnType;
import com.afsun.omop2graph.core.transform.ImportManifest;
import com.afsun.omop2graph.core.transform.ManifestEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * 根据清单生成 neo4j-admin 导入命令文本。只生成，不执行。
 */
public class BulkImportCommandBuilder {

    private static final String CONTINUATION = " \\";

    private final MigrationSettings settings;

    public BulkImportCommandBuilder(MigrationSettings settings) {
        this.settings = settings;
    }

    public String build(ImportManifest manifest) {
        if (manifest == null || manifest.getEntries().isEmpty()) {
            throw new MigrationException("MANIFEST_EMPTY", "导入清单为空，无法生成导入命令", "先执行 prepare-bulk");
        }
        List<String> lines = new ArrayList<>();
        lines.add(settings.getImportCommand() + CONTINUATION);
        for (ManifestEntry entry : manifest.nodeEntries()) {
            lines.add("  --nodes=" + String.join(":", entry.getLabels()) + "=" + quote(entry.getFile()) + CONTINUATION);
        }
        for (ManifestEntry entry : manifest.relationshipEntries()) {
            lines.add("  --relationships=" + entry.getRelationshipType() + "=" + quote(entry.getFile()) + CONTINUATION);
        }
        lines.add("  --delimiter=',' --array-delimiter='" + ColumnType.ARRAY_DELIMITER + "' --multiline-fields=true" + CONTINUATION);
        lines.add("  " + settings.getTargetDatabase());
        return String.join("\n", lines);
    }

    private static String quote(String path) {
        return "'" + path.replace("'", "'\\''") + "'";
    }
}
