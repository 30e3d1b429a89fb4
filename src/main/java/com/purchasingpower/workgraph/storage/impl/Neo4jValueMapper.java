package com.purchasingpower.workgraph.storage.impl;

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.IsoDuration;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Relationship;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts driver records into plain Java collections that Jackson can serialize.
 *
 * @since 1.0.0
 */
final class Neo4jValueMapper {

    private Neo4jValueMapper() {
    }

    static Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            row.put(key, toJava(record.get(key)));
        }
        return row;
    }

    static Object toJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return convert(value.asObject());
    }

    static Object convert(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Node node) {
            return properties(node.asMap());
        }
        if (raw instanceof Relationship relationship) {
            return relationship(relationship);
        }
        if (raw instanceof Path path) {
            return path(path);
        }
        if (raw instanceof TemporalAccessor || raw instanceof IsoDuration) {
            return raw.toString();
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), convert(v)));
            return converted;
        }
        if (raw instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(convert(item)));
            return converted;
        }
        return raw;
    }

    private static Map<String, Object> properties(Map<String, Object> props) {
        Map<String, Object> converted = new LinkedHashMap<>();
        props.forEach((k, v) -> converted.put(k, convert(v)));
        return converted;
    }

    private static Map<String, Object> relationship(Relationship relationship) {
        Map<String, Object> converted = new LinkedHashMap<>();
        converted.put("type", relationship.type());
        converted.put("properties", properties(relationship.asMap()));
        return converted;
    }

    private static Map<String, Object> path(Path path) {
        List<Object> nodes = new ArrayList<>();
        path.nodes().forEach(node -> nodes.add(properties(node.asMap())));

        List<Object> relationships = new ArrayList<>();
        path.relationships().forEach(rel -> relationships.add(relationship(rel)));

        Map<String, Object> converted = new LinkedHashMap<>();
        converted.put("nodes", nodes);
        converted.put("relationships", relationships);
        converted.put("length", path.length());
        return converted;
    }
}
