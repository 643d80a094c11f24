package work.flowscript.exporter.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowscript.exporter.graph.VariableType;
import work.flowscript.exporter.graph.Workflow;
import work.flowscript.exporter.graph.WorkflowEdge;
import work.flowscript.exporter.graph.WorkflowNode;
import work.flowscript.exporter.graph.WorkflowVariable;

/**
 * Loads editor documents (local path or HTTP URL, JSON or YAML) into {@link Workflow} values.
 */
public final class WorkflowLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private WorkflowLoader() {}

    public static Workflow load(WorkflowSource source) {
        return source.remoteUri()
            .map(WorkflowLoader::loadFromHttp)
            .orElseGet(() -> loadFromLocalFile(source.localPath().orElseThrow()));
    }

    public static Workflow loadFromLocalFile(Path path) {
        log.debug("Reading workflow from {}", path);
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read workflow: " + path, ex);
        }
    }

    public static Workflow loadFromHttp(URI uri) {
        log.debug("Downloading workflow from {}", uri);
        try {
            var client = HttpClient.newHttpClient();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new IllegalStateException("HTTP " + response.statusCode() + " while downloading workflow: " + uri);
            }
            try (var body = response.body()) {
                return parse(body);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while downloading workflow: " + uri, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to download workflow: " + uri, ex);
        }
    }

    /**
     * Parses a JSON or YAML document held in memory.
     */
    public static Workflow parse(String document) {
        try {
            return fromTree(YAML_MAPPER.readTree(document));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed workflow document: " + ex.getMessage(), ex);
        }
    }

    private static Workflow parse(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed workflow document: " + ex.getOriginalMessage(), ex);
        }
        return fromTree(root);
    }

    private static Workflow fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Workflow document is empty");
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Workflow document must be an object");
        }
        var name = root.hasNonNull("name") ? root.get("name").asText() : null;
        var nodes = new ArrayList<WorkflowNode>();
        for (var item : array(root, "nodes")) {
            nodes.add(toNode(item));
        }
        var edges = new ArrayList<WorkflowEdge>();
        for (var item : array(root, "edges")) {
            edges.add(toEdge(item));
        }
        var variables = new ArrayList<WorkflowVariable>();
        for (var item : array(root, "variables")) {
            variables.add(toVariable(item));
        }
        return new Workflow(name, nodes, edges, variables);
    }

    private static List<JsonNode> array(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array");
        }
        var items = new ArrayList<JsonNode>();
        node.forEach(items::add);
        return items;
    }

    private static WorkflowNode toNode(JsonNode node) {
        requireObject(node, "node");
        var id = requiredText(node, "id", "node");
        var data = node.has("data") ? toMap(node.get("data")) : Map.<String, Object>of();
        var parent = text(node, "parentId");
        if (parent == null) {
            parent = text(node, "parentNode");
        }
        return new WorkflowNode(id, text(node, "type"), data, parent);
    }

    private static WorkflowEdge toEdge(JsonNode node) {
        requireObject(node, "edge");
        return new WorkflowEdge(
            text(node, "id"),
            requiredText(node, "source", "edge"),
            requiredText(node, "target", "edge"),
            text(node, "sourceHandle"),
            text(node, "targetHandle")
        );
    }

    private static WorkflowVariable toVariable(JsonNode node) {
        requireObject(node, "variable");
        var value = node.has("value") ? convertNode(node.get("value")) : null;
        return new WorkflowVariable(
            requiredText(node, "name", "variable"),
            value,
            VariableType.from(text(node, "type")),
            text(node, "scope")
        );
    }

    private static Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Node data must be an object: " + node);
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(node);
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Each " + what + " must be an object: " + node);
        }
    }

    private static String requiredText(JsonNode node, String field, String what) {
        var value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' on " + what + ": " + node);
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
