package com.neo4jembedder.service;

import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.IsoDuration;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Path;
import org.neo4j.driver.types.Point;
import org.neo4j.driver.types.Relationship;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts driver records into plain maps, lists and scalars.
 * The output holds no reference to driver types, so it can be serialized
 * after the session that produced it has been closed.
 */
@Component
public class GraphValueMapper {

    /**
     * Convert one record into a row keyed by result column, in column order.
     */
    public Map<String, Object> toRow(Record record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String key : record.keys()) {
            row.put(key, toPlain(record.get(key)));
        }
        return row;
    }

    public Object toPlain(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return toPlainObject(value.asObject());
    }

    Object toPlainObject(Object value) {
        if (value instanceof Node) {
            return nodeToMap((Node) value);
        }
        if (value instanceof Relationship) {
            return relationshipToMap((Relationship) value);
        }
        if (value instanceof Path) {
            return pathToMap((Path) value);
        }
        if (value instanceof Point) {
            return pointToMap((Point) value);
        }
        if (value instanceof IsoDuration) {
            return value.toString();
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object element : (List<?>) value) {
                converted.add(toPlainObject(element));
            }
            return converted;
        }
        if (value instanceof Map) {
            return mapToPlain((Map<?, ?>) value);
        }
        return value;
    }

    private Map<String, Object> nodeToMap(Node node) {
        List<String> labels = new ArrayList<>();
        node.labels().forEach(labels::add);

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("identity", node.elementId());
        map.put("labels", labels);
        map.put("properties", mapToPlain(node.asMap()));
        return map;
    }

    private Map<String, Object> relationshipToMap(Relationship relationship) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("identity", relationship.elementId());
        map.put("start", relationship.startNodeElementId());
        map.put("end", relationship.endNodeElementId());
        map.put("type", relationship.type());
        map.put("properties", mapToPlain(relationship.asMap()));
        return map;
    }

    private Map<String, Object> pathToMap(Path path) {
        List<Map<String, Object>> segments = new ArrayList<>();
        for (Path.Segment segment : path) {
            Map<String, Object> converted = new LinkedHashMap<>();
            converted.put("start", nodeToMap(segment.start()));
            converted.put("relationship", relationshipToMap(segment.relationship()));
            converted.put("end", nodeToMap(segment.end()));
            segments.add(converted);
        }

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start", nodeToMap(path.start()));
        map.put("end", nodeToMap(path.end()));
        map.put("segments", segments);
        map.put("length", path.length());
        return map;
    }

    private Map<String, Object> pointToMap(Point point) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("srid", point.srid());
        map.put("x", point.x());
        map.put("y", point.y());
        if (!Double.isNaN(point.z())) {
            map.put("z", point.z());
        }
        return map;
    }

    private Map<String, Object> mapToPlain(Map<?, ?> source) {
        Map<String, Object> converted = new LinkedHashMap<>();
        source.forEach((key, value) -> converted.put(String.valueOf(key), toPlainObject(value)));
        return converted;
    }
}
