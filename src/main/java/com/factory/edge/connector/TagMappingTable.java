package com.factory.edge.connector;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.core.io.Resource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The validated set of tag mappings, keyed by node id.
 *
 * The file is a JSON array:
 *
 * <pre>
 * [
 *   { "nodeId": "ns=2;s=Line1.Press1.Temperature", "assetId": "press-1",
 *     "metricName": "temperature", "scaleFactor": 0.1, "unit": "degC",
 *     "lineId": "line-1", "samplingInterval": "500ms" }
 * ]
 * </pre>
 *
 * Every problem in the file is reported at once.
 */
public final class TagMappingTable {

    private static final TypeReference<List<TagMapping>> LIST_TYPE = new TypeReference<>() {
    };

    private final Map<String, TagMapping> byNodeId;

    private TagMappingTable(Map<String, TagMapping> byNodeId) {
        this.byNodeId = Collections.unmodifiableMap(byNodeId);
    }

    public static TagMappingTable load(Resource resource, ObjectMapper mapper) {
        if (resource == null || !resource.exists()) {
            throw new IllegalArgumentException("Tag map not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            List<TagMapping> mappings = mapper.readValue(in, LIST_TYPE);
            return of(mappings == null ? List.of() : mappings);
        } catch (IOException e) {
            throw new IllegalArgumentException("Tag map " + resource.getDescription() + " is not valid: "
                    + e.getMessage(), e);
        }
    }

    public static TagMappingTable of(List<TagMapping> mappings) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<String, TagMapping> byNodeId = new LinkedHashMap<>();

        for (int i = 0; i < mappings.size(); i++) {
            TagMapping m = mappings.get(i);
            String at = "mapping[" + i + "]";
            if (m == null) {
                problems.add(at + " is null");
                continue;
            }
            if (blank(m.nodeId())) {
                problems.add(at + ": nodeId is required");
            } else if (!seen.add(m.nodeId())) {
                problems.add(at + ": duplicate nodeId " + m.nodeId());
            }
            if (blank(m.assetId())) {
                problems.add(at + ": assetId is required");
            }
            if (blank(m.metricName())) {
                problems.add(at + ": metricName is required");
            }
            if (m.scaleFactor() != null && (m.scaleFactor() == 0.0d || !Double.isFinite(m.scaleFactor()))) {
                problems.add(at + ": scaleFactor must be a finite non-zero number");
            }
            if (!blank(m.nodeId())) {
                byNodeId.putIfAbsent(m.nodeId(), m);
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid tag map: " + String.join("; ", problems));
        }
        return new TagMappingTable(byNodeId);
    }

    public Optional<TagMapping> find(String nodeId) {
        return Optional.ofNullable(byNodeId.get(nodeId));
    }

    public List<TagMapping> all() {
        return List.copyOf(byNodeId.values());
    }

    public int size() {
        return byNodeId.size();
    }

    public boolean isEmpty() {
        return byNodeId.isEmpty();
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
