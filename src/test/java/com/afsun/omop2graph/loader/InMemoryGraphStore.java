package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.exceptions.ConnectivityException;
import com.afsun.omop2graph.core.resolver.LabelResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 内存图库，关系写入按 MATCH 语义：端点不存在的关系被静默丢弃。
 * 可注入批次失败和连接失败。
 */
public class InMemoryGraphStore implements GraphStore {

    public final List<NodeRecord> nodes = new ArrayList<>();
    public final List<RelationshipRecord> relationships = new ArrayList<>();
    public final Map<String, SchemaElement> schema = new LinkedHashMap<>();
    /**
     * 按调用顺序记录写入的批次：N:标签 或 R:类型
     */
    public final List<String> writeLog = new ArrayList<>();

    public boolean reachable = true;
    public int connectivityChecks;
    /**
     * 接下来的写入调用中，前若干次抛出异常
     */
    public int failNextWrites;
    /**
     * 节点数达到该值后，后续节点写入全部失败；负数表示不启用
     */
    public int failWhenNodesReach = -1;
    public int writeAttempts;

    private final Map<Long, NodeRecord> concepts = new HashMap<>();

    @Override
    public void verifyConnectivity() {
        connectivityChecks++;
        if (!reachable) {
            throw new ConnectivityException("无法连接 bolt://localhost:7687", null);
        }
    }

    @Override
    public long countNodes() {
        return nodes.size();
    }

    @Override
    public long countRelationships() {
        return relationships.size();
    }

    @Override
    public void dropSchema() {
        schema.clear();
    }

    @Override
    public long deleteAll(int batchSize) {
        long deleted = nodes.size();
        nodes.clear();
        relationships.clear();
        concepts.clear();
        return deleted;
    }

    @Override
    public void applySchema(SchemaElement element) {
        schema.putIfAbsent(element.getName(), element);
    }

    @Override
    public Set<String> schemaElementNames() {
        return new LinkedHashSet<>(schema.keySet());
    }

    @Override
    public void writeNodes(List<NodeRecord> batch) {
        beforeWrite();
        if (failWhenNodesReach >= 0 && nodes.size() >= failWhenNodesReach) {
            throw new IllegalStateException("模拟事务失败");
        }
        for (NodeRecord node : batch) {
            nodes.add(node);
            if (node.getLabels().contains(LabelResolver.CONCEPT)) {
                concepts.put((Long) node.getProperties().get("concept_id"), node);
            }
        }
        if (!batch.isEmpty()) {
            writeLog.add("N:" + String.join("|", batch.get(0).getLabels()));
        }
    }

    @Override
    public void writeRelationships(List<RelationshipRecord> batch) {
        beforeWrite();
        for (RelationshipRecord relationship : batch) {
            if (concepts.containsKey(relationship.getStartConceptId())
                    && concepts.containsKey(relationship.getEndConceptId())) {
                relationships.add(relationship);
            }
        }
        if (!batch.isEmpty()) {
            writeLog.add("R:" + batch.get(0).getType());
        }
    }

    @Override
    public long countNodesWithLabel(String label) {
        return nodes.stream().filter(n -> n.getLabels().contains(label)).count();
    }

    @Override
    public long countRelationshipsOfType(String type) {
        return relationships.stream().filter(r -> r.getType().equals(type)).count();
    }

    @Override
    public Set<Long> findMissingConcepts(Collection<Long> conceptIds) {
        Set<Long> missing = new HashSet<>();
        for (Long id : conceptIds) {
            if (!concepts.containsKey(id)) {
                missing.add(id);
            }
        }
        return missing;
    }

    @Override
    public Optional<ConceptSample> findConceptSample(long conceptId) {
        NodeRecord concept = concepts.get(conceptId);
        if (concept == null) {
            return Optional.empty();
        }
        Object synonyms = concept.getProperties().get("synonyms");
        Map<String, List<String>> names = new TreeMap<>();
        for (RelationshipRecord relationship : relationships) {
            if (relationship.getStartConceptId() == conceptId) {
                NodeRecord neighbour = concepts.get(relationship.getEndConceptId());
                names.computeIfAbsent(relationship.getType(), type -> new ArrayList<>())
                        .add(String.valueOf(neighbour.getProperties().get("name")));
            }
        }
        Map<String, ConceptSample.Neighbours> outgoing = new LinkedHashMap<>();
        names.forEach((type, all) -> outgoing.put(type, new ConceptSample.Neighbours(all.size(),
                new ArrayList<>(all.subList(0, Math.min(SAMPLE_NEIGHBOURS, all.size()))))));
        return Optional.of(new ConceptSample(conceptId, (String) concept.getProperties().get("name"),
                concept.getLabels(), synonyms == null ? 0 : ((List<?>) synonyms).size(), outgoing));
    }

    public boolean hasConcept(long conceptId) {
        return concepts.containsKey(conceptId);
    }

    private void beforeWrite() {
        writeAttempts++;
        if (!reachable) {
            throw new ConnectivityException("连接已断开", null);
        }
        if (failNextWrites > 0) {
            failNextWrites--;
            throw new IllegalStateException("模拟事务失败");
        }
    }
}
