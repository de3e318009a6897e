package com.afsun.omop2graph.core.reader;

public enum EntityKind {
    NODE,
    RELATIONSHIP
}
