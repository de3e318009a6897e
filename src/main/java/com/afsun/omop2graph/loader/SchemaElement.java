package com.afsun.omop2graph.loader;

import lombok.Value;

/**
 * 约束或索引定义
 */
@Value
public class SchemaElement {

    public enum Kind {
        UNIQUE_CONSTRAINT,
        INDEX
    }

    String name;
    Kind kind;
    String label;
    String property;

    public static SchemaElement unique(String name, String label, String property) {
        return new SchemaElement(name, Kind.UNIQUE_CONSTRAINT, label, property);
    }

    public static SchemaElement index(String name, String label, String property) {
        return new SchemaElement(name, Kind.INDEX, label, property);
    }

    /**
     * IF NOT EXISTS 保证重复执行不报错、不重复创建
     */
    public String toCypher() {
        if (kind == Kind.UNIQUE_CONSTRAINT) {
            return "CREATE CONSTRAINT " + name + " IF NOT EXISTS FOR (n:`" + label + "`) REQUIRE n." + property + " IS UNIQUE";
        }
        return "CREATE INDEX " + name + " IF NOT EXISTS FOR (n:`" + label + "`) ON (n." + property + ")";
    }
}
