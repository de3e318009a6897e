package com.afsun.omop2graph.validation;

import com.afsun.omop2graph.core.reader.ChunkedRowReader;
import com.afsun.omop2graph.core.reader.SourceRow;
import lombok.Value;

/**
 * 引用完整性检查读取的一个关系文件：端点列，以及关系类型取自哪一列或固定值
 */
@Value
public class RelationshipSource {

    ChunkedRowReader reader;
    String startColumn;
    String endColumn;
    /**
     * 在线文件的 rel_type 列，离线文件为 null
     */
    String typeColumn;
    /**
     * 离线文件一个文件只有一种类型
     */
    String fixedType;

    public String typeOf(SourceRow row) {
        return typeColumn != null ? row.get(typeColumn) : fixedType;
    }
}
