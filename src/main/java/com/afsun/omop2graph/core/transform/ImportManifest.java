package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.EntityKind;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 离线产物清单，编排器据此生成 neo4j-admin 导入命令
 */
@Data
public class ImportManifest {

    public static final String FILE_NAME = "import-manifest.json";

    private String importDir;

    private List<ManifestEntry> entries = new ArrayList<>();

    public List<ManifestEntry> nodeEntries() {
        return entries.stream().filter(e -> e.getKind() == EntityKind.NODE).collect(Collectors.toList());
    }

    public List<ManifestEntry> relationshipEntries() {
        return entries.stream().filter(e -> e.getKind() == EntityKind.RELATIONSHIP).collect(Collectors.toList());
    }

    public long totalRows() {
        return entries.stream().mapToLong(ManifestEntry::getRowCount).sum();
    }
}
