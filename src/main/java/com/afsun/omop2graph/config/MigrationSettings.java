package com.afsun.omop2graph.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 运行期不可变配置，构造时传入引擎和编排器，核心逻辑不直接读取环境变量
 */
@Value
@Builder(toBuilder = true)
public class MigrationSettings {

    /**
     * 抽取出的源CSV目录
     */
    @Builder.Default
    Path exportDir = Paths.get("export");

    /**
     * 在线加载用CSV目录
     */
    @Builder.Default
    Path onlineDir = Paths.get("export", "online");

    /**
     * neo4j-admin 批量导入文件目录
     */
    @Builder.Default
    Path importDir = Paths.get("export", "bulk_import");

    /**
     * 转换时每个批次的最大行数
     */
    @Builder.Default
    int chunkSize = 100_000;

    /**
     * 在线加载时每个事务提交的最大行数
     */
    @Builder.Default
    int loadBatchSize = 10_000;

    /**
     * 单个批次失败后的最大重试次数
     */
    @Builder.Default
    int maxBatchRetries = 3;

    @Builder.Default
    long retryBackoffMillis = 1_000L;

    @Builder.Default
    String importCommand = "neo4j-admin database import full";

    /**
     * 批量导入的目标数据库名
     */
    @Builder.Default
    String targetDatabase = "neo4j";

    /**
     * 校验时抽查的概念，默认 1177480 (Enalapril)
     */
    @Builder.Default
    long sampleConceptId = 1_177_480L;

    public static MigrationSettings defaults() {
        return MigrationSettings.builder().build();
    }
}
