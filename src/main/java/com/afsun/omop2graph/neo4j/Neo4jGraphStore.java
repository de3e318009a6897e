package com.afsun.omop2graph.neo4j;

import com.afsun.omop2graph.core.exceptions.ConnectivityException;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import com.afsun.omop2graph.loader.ConceptSample;
import com.afsun.omop2graph.loader.GraphStore;
import com.afsun.omop2graph.loader.NodeRecord;
import com.afsun.omop2graph.loader.RelationshipRecord;
import com.afsun.omop2graph.loader.SchemaElement;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 Neo4jClient 的图库访问实现
 * <p>
 * 批量写入使用 UNWIND，每次调用在一个事务中提交。
 * 同一批次按标签组合、关系类型分组，标签和类型直接写在查询文本中，查询本身没有分支。
 *
 * @author afsun
 */
@Service
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final String CREATE_NODES =
            "UNWIND $rows AS row\n" +
            "CREATE (n%s)\n" +
            "SET n = row";

    private static final String CREATE_RELATIONSHIPS =
            "UNWIND $rows AS row\n" +
            "MATCH (a:`" + LabelResolver.CONCEPT + "` {concept_id: row.start})\n" +
            "MATCH (b:`" + LabelResolver.CONCEPT + "` {concept_id: row.end})\n" +
            "CREATE (a)-[r:%s]->(b)\n" +
            "SET r = row.properties";

    private static final String DELETE_BATCH =
            "MATCH (n)\n" +
            "WITH n LIMIT $limit\n" +
            "DETACH DELETE n\n" +
            "RETURN count(*) AS deleted";

    private static final String FIND_MISSING_CONCEPTS =
            "UNWIND $ids AS id\n" +
            "OPTIONAL MATCH (c:`" + LabelResolver.CONCEPT + "` {concept_id: id})\n" +
            "WITH id, c WHERE c IS NULL\n" +
            "RETURN id";

    private static final String SAMPLE_CONCEPT =
            "MATCH (c:`" + LabelResolver.CONCEPT + "` {concept_id: $id})\n" +
            "RETURN c.name AS name, labels(c) AS labels, size(coalesce(c.synonyms, [])) AS synonyms";

    private static final String SAMPLE_OUTGOING =
            "MATCH (c:`" + LabelResolver.CONCEPT + "` {concept_id: $id})-[r]->(n)\n" +
            "WITH type(r) AS type, coalesce(n.name, toString(coalesce(n.concept_id, n.domain_id, n.vocabulary_id))) AS name\n" +
            "RETURN type, count(*) AS total, collect(name)[0..$limit] AS names\n" +
            "ORDER BY type";

    private static final String SHOW_CONSTRAINTS = "SHOW CONSTRAINTS YIELD name RETURN name";

    // LOOKUP 索引是系统自带的，约束背后的索引随约束一起删除
    private static final String SHOW_INDEXES =
            "SHOW INDEXES YIELD name, type, owningConstraint\n" +
            "WHERE owningConstraint IS NULL AND type <> 'LOOKUP'\n" +
            "RETURN name";

    private final Neo4jClient neo4jClient;

    private final Driver driver;

    public Neo4jGraphStore(Neo4jClient neo4jClient, Driver driver) {
        this.neo4jClient = neo4jClient;
        this.driver = driver;
    }

    @Override
    public void verifyConnectivity() {
        try {
            driver.verifyConnectivity();
            log.info("Neo4j 连接正常");
        } catch (RuntimeException e) {
            throw new ConnectivityException("无法连接 Neo4j: " + e.getMessage(), e);
        }
    }

    @Override
    public long countNodes() {
        return count("MATCH (n) RETURN count(n) AS c");
    }

    @Override
    public long countRelationships() {
        return count("MATCH ()-[r]->() RETURN count(r) AS c");
    }

    @Override
    public void dropSchema() {
        for (String name : fetchNames(SHOW_CONSTRAINTS)) {
            log.info("删除约束: {}", name);
            execute(() -> neo4jClient.query("DROP CONSTRAINT " + quote(name) + " IF EXISTS").run());
        }
        for (String name : fetchNames(SHOW_INDEXES)) {
            log.info("删除索引: {}", name);
            execute(() -> neo4jClient.query("DROP INDEX " + quote(name) + " IF EXISTS").run());
        }
    }

    @Override
    public long deleteAll(int batchSize) {
        long total = 0;
        while (true) {
            long deleted = execute(() -> neo4jClient.query(DELETE_BATCH)
                    .bind(batchSize).to("limit")
                    .fetchAs(Long.class)
                    .one()
                    .orElse(0L));
            if (deleted == 0) {
                return total;
            }
            total += deleted;
            log.debug("已删除 {} 个节点", total);
        }
    }

    @Override
    public void applySchema(SchemaElement element) {
        execute(() -> neo4jClient.query(element.toCypher()).run());
    }

    @Override
    public Set<String> schemaElementNames() {
        Set<String> names = new LinkedHashSet<>(fetchNames(SHOW_CONSTRAINTS));
        names.addAll(fetchNames(SHOW_INDEXES));
        return names;
    }

    @Override
    @Transactional
    public void writeNodes(List<NodeRecord> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return;
        }
        Map<List<String>, List<Map<String, Object>>> byLabels = new LinkedHashMap<>();
        for (NodeRecord node : nodes) {
            byLabels.computeIfAbsent(node.getLabels(), k -> new ArrayList<>()).add(node.getProperties());
        }
        byLabels.forEach((labels, rows) -> {
            StringBuilder labelText = new StringBuilder();
            for (String label : labels) {
                labelText.append(':').append(quote(label));
            }
            execute(() -> neo4jClient.query(String.format(CREATE_NODES, labelText))
                    .bind(rows).to("rows")
                    .run());
        });
    }

    @Override
    @Transactional
    public void writeRelationships(List<RelationshipRecord> relationships) {
        if (relationships == null || relationships.isEmpty()) {
            return;
        }
        Map<String, List<Map<String, Object>>> byType = new LinkedHashMap<>();
        for (RelationshipRecord relationship : relationships) {
            byType.computeIfAbsent(relationship.getType(), k -> new ArrayList<>()).add(relationshipToMap(relationship));
        }
        byType.forEach((type, rows) -> execute(() -> neo4jClient.query(String.format(CREATE_RELATIONSHIPS, quote(type)))
                .bind(rows).to("rows")
                .run()));
    }

    @Override
    public long countNodesWithLabel(String label) {
        return count("MATCH (n:" + quote(label) + ") RETURN count(n) AS c");
    }

    @Override
    public long countRelationshipsOfType(String type) {
        return count("MATCH ()-[r:" + quote(type) + "]->() RETURN count(r) AS c");
    }

    @Override
    public Set<Long> findMissingConcepts(Collection<Long> conceptIds) {
        if (conceptIds == null || conceptIds.isEmpty()) {
            return new LinkedHashSet<>();
        }
        List<Long> ids = new ArrayList<>(conceptIds);
        return new LinkedHashSet<>(execute(() -> neo4jClient.query(FIND_MISSING_CONCEPTS)
                .bind(ids).to("ids")
                .fetchAs(Long.class)
                .all()));
    }

    @Override
    public Optional<ConceptSample> findConceptSample(long conceptId) {
        Optional<Map<String, Object>> concept = execute(() -> neo4jClient.query(SAMPLE_CONCEPT)
                .bind(conceptId).to("id")
                .fetch()
                .one());
        if (!concept.isPresent()) {
            return Optional.empty();
        }
        Collection<Map<String, Object>> rows = execute(() -> neo4jClient.query(SAMPLE_OUTGOING)
                .bind(conceptId).to("id")
                .bind(SAMPLE_NEIGHBOURS).to("limit")
                .fetch()
                .all());
        Map<String, ConceptSample.Neighbours> outgoing = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            outgoing.put(String.valueOf(row.get("type")),
                    new ConceptSample.Neighbours(((Number) row.get("total")).longValue(), strings(row.get("names"))));
        }
        Map<String, Object> values = concept.get();
        Object synonyms = values.get("synonyms");
        return Optional.of(new ConceptSample(conceptId,
                values.get("name") == null ? null : String.valueOf(values.get("name")),
                strings(values.get("labels")),
                synonyms == null ? 0 : ((Number) synonyms).intValue(),
                outgoing));
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item));
            }
        }
        return result;
    }

    // 辅助方法：关系记录转为查询参数
    private Map<String, Object> relationshipToMap(RelationshipRecord relationship) {
        Map<String, Object> map = new HashMap<>();
        map.put("start", relationship.getStartConceptId());
        map.put("end", relationship.getEndConceptId());
        map.put("properties", relationship.getProperties());
        return map;
    }

    private long count(String cypher) {
        return execute(() -> neo4jClient.query(cypher)
                .fetchAs(Long.class)
                .one()
                .orElse(0L));
    }

    private List<String> fetchNames(String cypher) {
        return new ArrayList<>(execute(() -> neo4jClient.query(cypher)
                .fetchAs(String.class)
                .all()));
    }

    /**
     * 连接类故障统一转换为 ConnectivityException，其余异常原样抛出
     */
    private <T> T execute(Supplier<T> action) {
        try {
            return action.get();
        } catch (ServiceUnavailableException | SessionExpiredException | DataAccessResourceFailureException e) {
            throw new ConnectivityException("Neo4j 连接中断: " + e.getMessage(), e);
        }
    }

    /**
     * 标签、类型、名称用反引号包裹
     */
    static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
