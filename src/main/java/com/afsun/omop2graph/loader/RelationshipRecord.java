package com.afsun.omop2graph.loader;

import lombok.Value;

import java.util.Map;

@Value
public class RelationshipRecord {
    String type;
    long startConceptId;
    long endConceptId;
    Map<String, Object> properties;
}
