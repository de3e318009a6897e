package com.afsun.omop2graph.core.resolver;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 标签与关系类型解析器
 * <p>
 * 将 domain_id / standard_concept / relationship_id 等源字段映射为图标签和关系类型。
 * 纯函数，结果按原始输入字符串缓存：百万级行里重复出现的取值只有几十到几百种。
 *
 * @author afsun
 */
public class LabelResolver {

    public static final String CONCEPT = "CONCEPT";
    public static final String STANDARD = "STANDARD";
    public static final String DOMAIN = "DOMAIN";
    public static final String VOCABULARY = "VOCABULARY";
    public static final String HAS_ANCESTOR = "HAS_ANCESTOR";
    public static final String UNKNOWN = "UNKNOWN";

    /**
     * 标签集合在CSV中的分隔符
     */
    public static final String LABEL_DELIMITER = "|";

    private static final String STANDARD_FLAG = "S";

    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern REPEATED_SEPARATORS = Pattern.compile("_{2,}");

    private final Map<String, String> domainLabelCache = new ConcurrentHashMap<>();
    private final Map<String, String> relationshipTypeCache = new ConcurrentHashMap<>();

    /**
     * 概念节点的标签集合：CONCEPT、领域标签，标准概念额外加 STANDARD
     */
    public Set<String> resolveLabels(String domainId, String standardFlag) {
        Set<String> labels = new LinkedHashSet<>(4);
        labels.add(CONCEPT);
        labels.add(resolveDomainLabel(domainId));
        if (STANDARD_FLAG.equals(StringUtils.trim(standardFlag))) {
            labels.add(STANDARD);
        }
        return Collections.unmodifiableSet(labels);
    }

    public String resolveDomainLabel(String domainId) {
        return domainLabelCache.computeIfAbsent(StringUtils.defaultString(domainId), LabelResolver::sanitize);
    }

    public String resolveRelationshipType(String relationshipId) {
        return relationshipTypeCache.computeIfAbsent(StringUtils.defaultString(relationshipId), LabelResolver::sanitize);
    }

    /**
     * 标签集合签名，用作离线分区的目标键
     */
    public static String signature(Set<String> labels) {
        return String.join(LABEL_DELIMITER, labels);
    }

    /**
     * trim -> 非法字符替换为下划线 -> 合并连续下划线 -> 去掉首尾下划线 -> 大写；为空时返回 UNKNOWN
     */
    public static String sanitize(String raw) {
        String s = StringUtils.trimToEmpty(raw);
        s = ILLEGAL_CHARS.matcher(s).replaceAll("_");
        s = REPEATED_SEPARATORS.matcher(s).replaceAll("_");
        s = StringUtils.strip(s, "_");
        if (s.isEmpty()) {
            return UNKNOWN;
        }
        return s.toUpperCase(Locale.ROOT);
    }

    public int cachedDomainLabels() {
        return domainLabelCache.size();
    }

    public int cachedRelationshipTypes() {
        return relationshipTypeCache.size();
    }
}
