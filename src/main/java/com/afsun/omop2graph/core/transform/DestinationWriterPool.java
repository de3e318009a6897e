package com.afsun.omop2graph.core.transform;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 目标键 -> 输出句柄 的映射。
 * <p>
 * 目标集合由数据决定，事先未知：首次遇到某个目标时创建文件并写表头，之后复用同一句柄。
 * 同时打开的句柄数等于实际出现过的目标数，与总行数无关。
 * 由一次运行独占，{@link #close()} 关闭全部句柄，任何一个关闭失败都不影响其余句柄的关闭。
 *
 * @author afsun
 */
@Slf4j
public class DestinationWriterPool implements Closeable {

    private final Path directory;

    /**
     * 保持首次出现顺序，清单和导入命令因此是确定的
     */
    private final Map<String, DestinationWriter> writers = new LinkedHashMap<>();

    private boolean closed;

    public DestinationWriterPool(Path directory) {
        this.directory = directory;
    }

    public DestinationWriter acquire(RowDestination destination, Function<RowDestination, List<String>> headerFactory) throws IOException {
        if (closed) {
            throw new IllegalStateException("句柄池已关闭");
        }
        DestinationWriter writer = writers.get(destination.getKey());
        if (writer == null) {
            Path file = directory.resolve(destination.fileName());
            writer = new DestinationWriter(destination, file, headerFactory.apply(destination));
            writers.put(destination.getKey(), writer);
            log.debug("新建目标文件 {} -> {}", destination.getKey(), file);
        }
        return writer;
    }

    public int openHandles() {
        return closed ? 0 : writers.size();
    }

    public List<DestinationWriter> writers() {
        return Collections.unmodifiableList(new ArrayList<>(writers.values()));
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        IOException failure = null;
        for (DestinationWriter writer : writers.values()) {
            try {
                writer.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
