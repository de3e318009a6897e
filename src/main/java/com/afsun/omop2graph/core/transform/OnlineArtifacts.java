package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.SourceTable;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 在线产物：每张源表一个CSV，加上转换报告
 */
@Getter
public class OnlineArtifacts {

    private final Path directory;

    private final TransformReport report;

    public OnlineArtifacts(Path directory, TransformReport report) {
        this.directory = directory;
        this.report = report;
    }

    public Path fileFor(SourceTable table) {
        return directory.resolve(table.getFileName());
    }
}
