package com.afsun.omop2graph.loader;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class NodeRecord {
    List<String> labels;
    Map<String, Object> properties;
}
