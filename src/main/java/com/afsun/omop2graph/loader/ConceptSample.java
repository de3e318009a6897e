package com.afsun.omop2graph.loader;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 抽样概念的结构：标签、同义词数量，以及按类型分组的出边
 */
@Value
public class ConceptSample {

    long conceptId;
    String name;
    List<String> labels;
    int synonymCount;
    /**
     * 关系类型 -> 出边统计，按类型名排序
     */
    Map<String, Neighbours> outgoing;

    @Value
    public static class Neighbours {
        long count;
        /**
         * 最多 {@link GraphStore#SAMPLE_NEIGHBOURS} 个相邻节点名称
         */
        List<String> sampleNames;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('\'').append(name).append("' labels=").append(labels)
                .append(" synonyms=").append(synonymCount);
        outgoing.forEach((type, neighbours) -> sb.append(' ').append(type).append('=')
                .append(neighbours.getCount()).append(neighbours.getSampleNames()));
        return sb.toString();
    }
}
