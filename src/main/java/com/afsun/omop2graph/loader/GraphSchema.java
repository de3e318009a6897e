package com.afsun.omop2graph.loader;

import com.afsun.omop2graph.core.resolver.LabelResolver;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 词表图的约束和索引
 */
public final class GraphSchema {

    public static final List<SchemaElement> ELEMENTS = Collections.unmodifiableList(Arrays.asList(
            SchemaElement.unique("constraint_concept_id", LabelResolver.CONCEPT, "concept_id"),
            SchemaElement.unique("constraint_domain_id", LabelResolver.DOMAIN, "domain_id"),
            SchemaElement.unique("constraint_vocabulary_id", LabelResolver.VOCABULARY, "vocabulary_id"),
            SchemaElement.index("index_concept_code", LabelResolver.CONCEPT, "concept_code"),
            SchemaElement.index("index_concept_vocabulary_id", LabelResolver.CONCEPT, "vocabulary_id"),
            SchemaElement.index("index_standard_concept_id", LabelResolver.STANDARD, "concept_id")
    ));

    private GraphSchema() {
    }
}
