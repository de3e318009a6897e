package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.exceptions.ConnectivityException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 目标图库的访问接口。
 * 编排器和校验器只依赖这个接口，运行期由 Neo4j 实现，测试中使用内存实现。
 * 无法连接时抛出 {@link ConnectivityException}。
 */
public interface GraphStore {

    /**
     * 抽样概念每种关系类型展示的相邻节点数
     */
    int SAMPLE_NEIGHBOURS = 3;

    void verifyConnectivity();

    long countNodes();

    long countRelationships();

    /**
     * 删除全部约束和索引
     */
    void dropSchema();

    /**
     * 分批删除全部节点及其关系，返回删除的节点数
     */
    long deleteAll(int batchSize);

    /**
     * 幂等创建约束或索引
     */
    void applySchema(SchemaElement element);

    Set<String> schemaElementNames();

    /**
     * 在一个事务中写入一批节点
     */
    void writeNodes(List<NodeRecord> nodes);

    /**
     * 在一个事务中写入一批关系，端点按 CONCEPT.concept_id 匹配
     */
    void writeRelationships(List<RelationshipRecord> relationships);

    long countNodesWithLabel(String label);

    long countRelationshipsOfType(String type);

    /**
     * 返回给定 concept_id 中在图里不存在对应 CONCEPT 节点的那部分
     */
    Set<Long> findMissingConcepts(Collection<Long> conceptIds);

    /**
     * 读取一个概念及其出边概况，不存在时返回空
     */
    Optional<ConceptSample> findConceptSample(long conceptId);
}
