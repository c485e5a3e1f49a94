package org.dxworks.codegraph.export;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interchange shape shared by every graph kind: nodes with an id, a kind and free-form
 * attributes, typed edges between node ids, and graph-level metadata. Attributes are
 * written inline next to {@code id} and {@code kind}.
 */
@JsonPropertyOrder({"nodes", "edges", "metadata"})
public class GraphDocument {
    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String GRAPH = "graph";
    public static final String TITLE = "title";

    public List<Node> nodes = new ArrayList<>();
    public List<Link> edges = new ArrayList<>();
    public Map<String, Object> metadata = new LinkedHashMap<>();

    public GraphDocument() {
    }

    public GraphDocument(String graph, String title) {
        metadata.put(GRAPH, graph);
        metadata.put(TITLE, title);
    }

    @JsonIgnore
    public String getGraph() {
        Object graph = metadata.get(GRAPH);
        return graph == null ? null : graph.toString();
    }

    @JsonIgnore
    public String getTitle() {
        Object title = metadata.get(TITLE);
        return title == null ? null : title.toString();
    }

    public Node addNode(int id, String kind) {
        Node node = new Node(id, kind);
        nodes.add(node);
        return node;
    }

    public Link addEdge(int from, int to, String kind) {
        Link link = new Link(from, to, kind);
        edges.add(link);
        return link;
    }

    /** Skips null values so absent facts stay absent in the output. */
    public GraphDocument meta(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
        return this;
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    public static GraphDocument fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, GraphDocument.class);
    }

    @JsonPropertyOrder({"id", "kind"})
    public static class Node {
        public int id;
        public String kind;
        private final Map<String, Object> attrs = new LinkedHashMap<>();

        public Node() {
        }

        public Node(int id, String kind) {
            this.id = id;
            this.kind = kind;
        }

        @JsonAnyGetter
        public Map<String, Object> getAttrs() {
            return attrs;
        }

        @JsonAnySetter
        public void setAttr(String key, Object value) {
            attrs.put(key, value);
        }

        public Node attr(String key, Object value) {
            if (value != null) {
                attrs.put(key, value);
            }
            return this;
        }

        public Object get(String key) {
            return attrs.get(key);
        }

        public boolean is(String key) {
            return Boolean.TRUE.equals(attrs.get(key));
        }
    }

    @JsonPropertyOrder({"from", "to", "kind"})
    public static class Link {
        public int from;
        public int to;
        public String kind;
        private final Map<String, Object> attrs = new LinkedHashMap<>();

        public Link() {
        }

        public Link(int from, int to, String kind) {
            this.from = from;
            this.to = to;
            this.kind = kind;
        }

        @JsonAnyGetter
        public Map<String, Object> getAttrs() {
            return attrs;
        }

        @JsonAnySetter
        public void setAttr(String key, Object value) {
            attrs.put(key, value);
        }

        public Link attr(String key, Object value) {
            if (value != null) {
                attrs.put(key, value);
            }
            return this;
        }

        public Object get(String key) {
            return attrs.get(key);
        }

        public boolean is(String key) {
            return Boolean.TRUE.equals(attrs.get(key));
        }
    }
}
