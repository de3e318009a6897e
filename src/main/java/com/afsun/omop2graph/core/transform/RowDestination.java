package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.EntityKind;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 一行数据的去向：节点按标签集合签名，关系按关系类型
 */
@Getter
@EqualsAndHashCode(of = "key")
public final class RowDestination {

    private final EntityKind kind;
    private final SourceTable table;
    private final List<String> labels;
    private final String relationshipType;
    private final String key;

    private RowDestination(EntityKind kind, SourceTable table, List<String> labels, String relationshipType, String key) {
        this.kind = kind;
        this.table = table;
        this.labels = labels;
        this.relationshipType = relationshipType;
        this.key = key;
    }

    public static RowDestination nodes(SourceTable table, Set<String> labels) {
        return new RowDestination(EntityKind.NODE, table,
                Collections.unmodifiableList(new ArrayList<>(labels)), null,
                "nodes:" + LabelResolver.signature(labels));
    }

    public static RowDestination relationships(SourceTable table, String type) {
        // 不同关系表的列结构不同，类型相同时也分开输出
        return new RowDestination(EntityKind.RELATIONSHIP, table, Collections.emptyList(), type,
                "relationships:" + table.name() + ":" + type);
    }

    /**
     * 在线CSV中的预计算列取值
     */
    public String onlineValue() {
        return kind == EntityKind.NODE ? String.join(LabelResolver.LABEL_DELIMITER, labels) : relationshipType;
    }

    /**
     * 离线分区文件名。清洗后的标签不含连续下划线，用 "__" 连接不会冲突。
     */
    public String fileName() {
        if (kind == EntityKind.NODE) {
            return "nodes_" + String.join("__", labels) + ".csv";
        }
        if (table == SourceTable.CONCEPT_ANCESTOR) {
            return "ancestor_rels_" + relationshipType + ".csv";
        }
        return "rels_" + relationshipType + ".csv";
    }

    @Override
    public String toString() {
        return key;
    }
}
