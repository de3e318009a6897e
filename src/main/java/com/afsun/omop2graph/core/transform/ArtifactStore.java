package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.exceptions.MigrationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 转换报告与导入清单的JSON读写
 */
public class ArtifactStore {

    public static final String REPORT_FILE = "transform-report.json";

    private final ObjectMapper objectMapper;

    public ArtifactStore() {
        this(new ObjectMapper());
    }

    public ArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path writeReport(Path directory, TransformReport report) {
        return write(directory.resolve(REPORT_FILE), report);
    }

    public TransformReport readReport(Path directory) {
        return read(directory.resolve(REPORT_FILE), TransformReport.class);
    }

    public Path writeManifest(Path directory, ImportManifest manifest) {
        return write(directory.resolve(ImportManifest.FILE_NAME), manifest);
    }

    public ImportManifest readManifest(Path directory) {
        return read(directory.resolve(ImportManifest.FILE_NAME), ImportManifest.class);
    }

    public OnlineArtifacts loadOnlineArtifacts(Path directory) {
        return new OnlineArtifacts(directory, readReport(directory));
    }

    private Path write(Path file, Object value) {
        try {
            objectMapper.writeValue(file.toFile(), value);
            return file;
        } catch (IOException e) {
            throw new MigrationException("WRITE_ERROR", "写入失败: " + file, null, e);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            throw new MigrationException("ARTIFACT_MISSING", "文件不存在: " + file, "先执行 transform 或 prepare-bulk");
        }
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new MigrationException("READ_ERROR", "读取失败: " + file, null, e);
        }
    }
}
