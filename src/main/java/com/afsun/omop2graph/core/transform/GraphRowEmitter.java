package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;

import java.io.Closeable;
import java.io.IOException;

/**
 * 转换产物输出端
 */
public interface GraphRowEmitter extends Closeable {

    void beginTable(SourceTable table) throws IOException;

    void emit(SourceRow row, RowDestination destination) throws IOException;

    void endTable(SourceTable table) throws IOException;
}
