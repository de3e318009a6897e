package com.afsun.omop2graph.core.transform;

import com.afsun.omop2graph.core.reader.EntityKind;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 清单条目：目标键 -> 文件 -> 行数 -> 表头
 */
@Data
@NoArgsConstructor
public class ManifestEntry {
    private EntityKind kind;
    private String destinationKey;
    /**
     * 节点文件的标签集合
     */
    private List<String> labels = new ArrayList<>();
    /**
     * 关系文件的关系类型
     */
    private String relationshipType;
    private String file;
    private long rowCount;
    private List<String> header = new ArrayList<>();
}
