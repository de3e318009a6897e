package com.afsun.omop2graph.core.reader;

import lombok.Value;

/**
 * 单个源字段定义
 */
@Value
public class ColumnSpec {
    /**
     * 源文件表头中的列名
     */
    String name;
    /**
     * 对应的图属性名，为 null 表示不作为属性写入（如关系端点、relationship_id）
     */
    String property;
    ColumnType type;
    /**
     * 主键类字段，为空时整行视为不合法
     */
    boolean required;
    /**
     * 表头中可以缺省的列（如 synonyms），缺省时按空值处理
     */
    boolean optionalInHeader;

    public static ColumnSpec key(String name, String property, ColumnType type) {
        return new ColumnSpec(name, property, type, true, false);
    }

    public static ColumnSpec of(String name, String property, ColumnType type) {
        return new ColumnSpec(name, property, type, false, false);
    }

    public static ColumnSpec optional(String name, String property, ColumnType type) {
        return new ColumnSpec(name, property, type, false, true);
    }
}
