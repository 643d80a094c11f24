package work.flowscript.exporter.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single automation step, control construct or group taken from the editor document.
 */
public record WorkflowNode(String id, String type, Map<String, Object> data, String parentId) {
    public static final String GROUP_TYPE = "groupNode";

    public WorkflowNode {
        Objects.requireNonNull(id, "id");
        type = type == null ? "" : type;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Specific module tag: {@code data.moduleType} when present, otherwise the node type.
     */
    public String moduleType() {
        Object raw = data.get("moduleType");
        if (raw instanceof String str && !str.isBlank()) {
            return str;
        }
        return type;
    }

    public String label() {
        Object raw = data.get("label");
        if (raw != null && !String.valueOf(raw).isBlank()) {
            return String.valueOf(raw);
        }
        return moduleType();
    }

    public boolean isGroup() {
        return GROUP_TYPE.equals(type);
    }
}
