package com.afsun.omop2graph.core.reader;

import com.afsun.omop2graph.core.exceptions.MalformedRowException;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 源字段类型：负责文本规范化、转换为图属性值，以及 neo4j-admin 表头类型
 */
public enum ColumnType {

    LONG("long") {
        @Override
        String normalizeValue(String raw) {
            return Long.toString(Long.parseLong(raw));
        }

        @Override
        public Object toPropertyValue(String normalized) {
            return Long.valueOf(normalized);
        }
    },
    INT("int") {
        @Override
        String normalizeValue(String raw) {
            return Integer.toString(Integer.parseInt(raw));
        }

        @Override
        public Object toPropertyValue(String normalized) {
            return Integer.valueOf(normalized);
        }
    },
    STRING(null) {
        @Override
        public String normalize(String raw) {
            return raw == null ? "" : raw;
        }

        @Override
        String normalizeValue(String raw) {
            return raw;
        }

        @Override
        public Object toPropertyValue(String normalized) {
            return normalized;
        }
    },
    DATE("date") {
        @Override
        String normalizeValue(String raw) {
            return parseDate(raw).format(DateTimeFormatter.ISO_LOCAL_DATE);
        }

        @Override
        public Object toPropertyValue(String normalized) {
            return LocalDate.parse(normalized, DateTimeFormatter.ISO_LOCAL_DATE);
        }
    },
    STRING_ARRAY("string[]") {
        @Override
        public String normalize(String raw) {
            return raw == null ? "" : raw;
        }

        @Override
        String normalizeValue(String raw) {
            return raw;
        }

        @Override
        public Object toPropertyValue(String normalized) {
            if (normalized.isEmpty()) {
                return Collections.emptyList();
            }
            List<String> values = new ArrayList<>(Arrays.asList(StringUtils.splitPreserveAllTokens(normalized, ARRAY_DELIMITER)));
            values.removeIf(String::isEmpty);
            return values;
        }
    };

    /**
     * 数组字段分隔符，与 neo4j-admin --array-delimiter 保持一致
     */
    public static final String ARRAY_DELIMITER = "|";

    private final String adminType;

    ColumnType(String adminType) {
        this.adminType = adminType;
    }

    /**
     * neo4j-admin 表头中的类型后缀，字符串类型没有后缀
     */
    public String getAdminType() {
        return adminType;
    }

    /**
     * 规范化原始文本：数值不带本地化格式，日期统一为 yyyy-MM-dd。空值保持为空串。
     *
     * @throws MalformedRowException 无法解析时
     */
    public String normalize(String raw) {
        String trimmed = StringUtils.trimToEmpty(raw);
        if (trimmed.isEmpty()) {
            return "";
        }
        try {
            return normalizeValue(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MalformedRowException("无法解析为{}: '{}'", name(), trimmed);
        }
    }

    abstract String normalizeValue(String raw);

    /**
     * 规范化后的非空文本转换为驱动可接受的属性值
     */
    public abstract Object toPropertyValue(String normalized);

    static LocalDate parseDate(String raw) {
        if (raw.length() == 8 && StringUtils.isNumeric(raw)) {
            return LocalDate.parse(raw, DateTimeFormatter.BASIC_ISO_DATE);
        }
        return LocalDate.parse(raw, DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
