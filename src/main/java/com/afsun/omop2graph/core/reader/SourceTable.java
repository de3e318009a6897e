package com.afsun.omop2graph.core.reader;

import com.afsun.omop2graph.core.resolver.LabelResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 抽取出的 OMOP 词表文件及其固定列结构。
 * 声明顺序即加载顺序：所有节点表先于关系表。
 *
 * @author afsun
 */
public enum SourceTable {

    DOMAIN("domain.csv", EntityKind.NODE, "Domain", "domain_id", null,
            ColumnSpec.key("domain_id", "domain_id", ColumnType.STRING),
            ColumnSpec.of("domain_name", "domain_name", ColumnType.STRING),
            ColumnSpec.of("domain_concept_id", "domain_concept_id", ColumnType.LONG)),

    VOCABULARY("vocabulary.csv", EntityKind.NODE, "Vocabulary", "vocabulary_id", null,
            ColumnSpec.key("vocabulary_id", "vocabulary_id", ColumnType.STRING),
            ColumnSpec.of("vocabulary_name", "vocabulary_name", ColumnType.STRING),
            ColumnSpec.of("vocabulary_reference", "vocabulary_reference", ColumnType.STRING),
            ColumnSpec.of("vocabulary_version", "vocabulary_version", ColumnType.STRING),
            ColumnSpec.of("vocabulary_concept_id", "vocabulary_concept_id", ColumnType.LONG)),

    CONCEPT("concept.csv", EntityKind.NODE, "Concept", "concept_id", null,
            ColumnSpec.key("concept_id", "concept_id", ColumnType.LONG),
            ColumnSpec.of("concept_name", "name", ColumnType.STRING),
            ColumnSpec.of("domain_id", "domain_id", ColumnType.STRING),
            ColumnSpec.of("vocabulary_id", "vocabulary_id", ColumnType.STRING),
            ColumnSpec.of("concept_class_id", "concept_class_id", ColumnType.STRING),
            ColumnSpec.of("standard_concept", "standard_concept", ColumnType.STRING),
            ColumnSpec.of("concept_code", "concept_code", ColumnType.STRING),
            ColumnSpec.of("valid_start_date", "valid_start_date", ColumnType.DATE),
            ColumnSpec.of("valid_end_date", "valid_end_date", ColumnType.DATE),
            ColumnSpec.of("invalid_reason", "invalid_reason", ColumnType.STRING),
            ColumnSpec.optional("synonyms", "synonyms", ColumnType.STRING_ARRAY)),

    CONCEPT_RELATIONSHIP("concept_relationship.csv", EntityKind.RELATIONSHIP, "Concept", "concept_id_1", "concept_id_2",
            ColumnSpec.key("concept_id_1", null, ColumnType.LONG),
            ColumnSpec.key("concept_id_2", null, ColumnType.LONG),
            ColumnSpec.of("relationship_id", null, ColumnType.STRING),
            ColumnSpec.of("valid_start_date", "valid_start_date", ColumnType.DATE),
            ColumnSpec.of("valid_end_date", "valid_end_date", ColumnType.DATE),
            ColumnSpec.of("invalid_reason", "invalid_reason", ColumnType.STRING)),

    // 方向：后代 -[:HAS_ANCESTOR]-> 祖先
    CONCEPT_ANCESTOR("concept_ancestor.csv", EntityKind.RELATIONSHIP, "Concept", "descendant_concept_id", "ancestor_concept_id",
            ColumnSpec.key("ancestor_concept_id", null, ColumnType.LONG),
            ColumnSpec.key("descendant_concept_id", null, ColumnType.LONG),
            ColumnSpec.of("min_levels_of_separation", "min_levels", ColumnType.INT),
            ColumnSpec.of("max_levels_of_separation", "max_levels", ColumnType.INT));

    /**
     * 在线CSV中预计算的标签列（节点表）
     */
    public static final ColumnSpec LABELS_COLUMN = ColumnSpec.key("labels", null, ColumnType.STRING);

    /**
     * 在线CSV中预计算的关系类型列（关系表）
     */
    public static final ColumnSpec REL_TYPE_COLUMN = ColumnSpec.key("rel_type", null, ColumnType.STRING);

    private final String fileName;
    private final EntityKind kind;
    private final String idSpace;
    /**
     * 节点表为主键列，关系表为起点列
     */
    private final String keyColumn;
    private final String endColumn;
    private final List<ColumnSpec> columns;

    SourceTable(String fileName, EntityKind kind, String idSpace, String keyColumn, String endColumn, ColumnSpec... columns) {
        this.fileName = fileName;
        this.kind = kind;
        this.idSpace = idSpace;
        this.keyColumn = keyColumn;
        this.endColumn = endColumn;
        this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 抽取端可能使用的其他文件名。概念表在带同义词导出时写作 concepts_optimized.csv
     */
    public List<String> getAlternateFileNames() {
        if (this == CONCEPT) {
            return Collections.singletonList("concepts_optimized.csv");
        }
        return Collections.emptyList();
    }

    /**
     * 导出目录中实际存在的输入文件：优先标准文件名，其次备选文件名；都不存在时返回标准路径，由读取方报 READ_ERROR
     */
    public Path resolveInputFile(Path exportDir) {
        Path primary = exportDir.resolve(fileName);
        if (Files.exists(primary)) {
            return primary;
        }
        for (String alternate : getAlternateFileNames()) {
            Path candidate = exportDir.resolve(alternate);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return primary;
    }

    public EntityKind getKind() {
        return kind;
    }

    public boolean isNode() {
        return kind == EntityKind.NODE;
    }

    public String getIdSpace() {
        return idSpace;
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public String getStartColumn() {
        return keyColumn;
    }

    public String getEndColumn() {
        return endColumn;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    public ColumnSpec column(String name) {
        for (ColumnSpec column : columns) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException(name() + " 中不存在列: " + name);
    }

    /**
     * 在线产物的列：源列加上标签列或关系类型列
     */
    public List<ColumnSpec> getOnlineColumns() {
        List<ColumnSpec> result = new ArrayList<>(columns.size() + 1);
        for (ColumnSpec column : columns) {
            // 在线文件总是写出全部列
            result.add(new ColumnSpec(column.getName(), column.getProperty(), column.getType(), column.isRequired(), false));
        }
        result.add(isNode() ? LABELS_COLUMN : REL_TYPE_COLUMN);
        return Collections.unmodifiableList(result);
    }

    /**
     * 元数据表（Domain、Vocabulary）的固定标签；概念表的标签由数据决定
     */
    public String getFixedLabel() {
        switch (this) {
            case DOMAIN:
                return LabelResolver.DOMAIN;
            case VOCABULARY:
                return LabelResolver.VOCABULARY;
            default:
                return null;
        }
    }

    public static List<SourceTable> nodeTables() {
        return Arrays.asList(DOMAIN, VOCABULARY, CONCEPT);
    }

    public static List<SourceTable> relationshipTables() {
        return Arrays.asList(CONCEPT_RELATIONSHIP, CONCEPT_ANCESTOR);
    }
}
