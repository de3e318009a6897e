package com.afsun.omop2graph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Paths;

/**
 * application.yml 中 omop2graph.* 配置项
 *
 * @author afsun
 */
@Data
@ConfigurationProperties(prefix = "omop2graph")
public class MigrationProperties {

    private String exportDir = "export";

    private String onlineDir;

    private String importDir;

    private int chunkSize = 100_000;

    private int loadBatchSize = 10_000;

    private int maxBatchRetries = 3;

    private long retryBackoffMillis = 1_000L;

    private String importCommand = "neo4j-admin database import full";

    private String targetDatabase = "neo4j";

    private long sampleConceptId = 1_177_480L;

    public MigrationSettings toSettings() {
        return MigrationSettings.builder()
                .exportDir(Paths.get(exportDir))
                .onlineDir(onlineDir != null ? Paths.get(onlineDir) : Paths.get(exportDir, "online"))
                .importDir(importDir != null ? Paths.get(importDir) : Paths.get(exportDir, "bulk_import"))
                .chunkSize(chunkSize)
                .loadBatchSize(loadBatchSize)
                .maxBatchRetries(maxBatchRetries)
                .retryBackoffMillis(retryBackoffMillis)
                .importCommand(importCommand)
                .targetDatabase(targetDatabase)
                .sampleConceptId(sampleConceptId)
                .build();
    }
}
