package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.reader.ColumnSpec;
import com.afsun.omop2graph.core.reader.SourceRow;
import com.afsun.omop2graph.core.reader.SourceTable;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在线CSV行 -> 节点或关系记录。标签和关系类型直接取预计算列，不再判断。
 */
public final class OnlineRowMapper {

    private OnlineRowMapper() {
    }

    public static NodeRecord toNode(SourceTable table, SourceRow row) {
        List<String> labels = Arrays.asList(StringUtils.split(row.get(SourceTable.LABELS_COLUMN.getName()),
                LabelResolver.LABEL_DELIMITER));
        return new NodeRecord(labels, properties(table, row));
    }

    public static RelationshipRecord toRelationship(SourceTable table, SourceRow row) {
        return new RelationshipRecord(row.get(SourceTable.REL_TYPE_COLUMN.getName()),
                row.getLong(table.getStartColumn()),
                row.getLong(table.getEndColumn()),
                properties(table, row));
    }

    /**
     * 空值不写入属性
     */
    static Map<String, Object> properties(SourceTable table, SourceRow row) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ColumnSpec column : table.getColumns()) {
            if (column.getProperty() == null) {
                continue;
            }
            String value = row.get(column.getName());
            if (!value.isEmpty()) {
                properties.put(column.getProperty(), column.getType().toPropertyValue(value));
            }
        }
        return properties;
    }
}
