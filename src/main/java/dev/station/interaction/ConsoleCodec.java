package dev.station.interaction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.station.model.LogStream;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of {@link ConsoleMessage}s, one message per line.
 *
 * <pre>
 *   {"type":"log","stream":"out","text":"..."}
 *   {"type":"interaction_request","id":"req-1","kind":"buttons","prompt":null,
 *    "options":[{"name":"A","value":1}],"allowMultiple":false}
 *   {"type":"interaction_response","id":"req-1","selection":1}
 * </pre>
 */
public final class ConsoleCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String TYPE_LOG = "log";
    static final String TYPE_REQUEST = "interaction_request";
    static final String TYPE_RESPONSE = "interaction_response";

    private ConsoleCodec() {}

    public static String encode(ConsoleMessage message) {
        ObjectNode node = MAPPER.createObjectNode();
        if (message instanceof ConsoleMessage.Log l) {
            node.put("type", TYPE_LOG);
            node.put("stream", l.stream().wireName());
            node.put("text", l.text());
        } else if (message instanceof ConsoleMessage.Request r) {
            node.put("type", TYPE_REQUEST);
            node.put("id", r.id());
            writeRequest(node, r.request());
        } else if (message instanceof ConsoleMessage.Response r) {
            node.put("type", TYPE_RESPONSE);
            node.put("id", r.id());
            node.set("selection", MAPPER.valueToTree(r.selection()));
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode console message: " + message, e);
        }
    }

    /**
     * Decode one line.
     *
     * @throws IllegalArgumentException if the line is not a well-formed console message
     */
    public static ConsoleMessage decode(String line) {
        JsonNode root;
        try {
            root = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Console message must be a JSON object");
        }
        String type = text(root, "type");
        return switch (type) {
            case TYPE_LOG -> new ConsoleMessage.Log(LogStream.fromWire(text(root, "stream")), text(root, "text"));
            case TYPE_REQUEST -> new ConsoleMessage.Request(text(root, "id"), readRequest(root));
            case TYPE_RESPONSE -> {
                if (!root.has("selection")) {
                    throw new IllegalArgumentException("Response is missing 'selection'");
                }
                yield new ConsoleMessage.Response(text(root, "id"), toJava(root.get("selection")));
            }
            default -> throw new IllegalArgumentException("Unknown message type: " + type);
        };
    }

    private static void writeRequest(ObjectNode node, InteractionRequest request) {
        node.put("kind", request.kind().wireName());
        node.put("prompt", request.prompt());
        ArrayNode options = node.putArray("options");
        for (Option option : request.options()) {
            ObjectNode o = options.addObject();
            o.put("name", option.name());
            o.set("value", MAPPER.valueToTree(option.value()));
            // Boolean buttons carry a colour hint: true green, false red
            if (option.value() instanceof Boolean b) {
                o.put("color", b ? "green" : "red");
            }
        }
        node.put("allowMultiple", request.allowMultiple());
        if (request.kind() == InteractionKind.TEXT_INPUT) {
            node.put("size", request.size());
        }
    }

    private static InteractionRequest readRequest(JsonNode root) {
        InteractionKind kind = InteractionKind.fromWire(text(root, "kind"));
        JsonNode promptNode = root.get("prompt");
        String prompt = promptNode == null || promptNode.isNull() ? null : promptNode.asText();
        var options = new ArrayList<Option>();
        JsonNode optionsNode = root.get("options");
        if (optionsNode != null) {
            optionsNode.forEach(o -> options.add(Option.of(text(o, "name"), toJava(o.get("value")))));
        }
        boolean allowMultiple = root.path("allowMultiple").asBoolean(false);
        int size = root.path("size").asInt(0);
        return new InteractionRequest(kind, prompt, options, allowMultiple, size);
    }

    /**
     * Convert a JSON selection into plain Java values. An object with a
     * "value" field stands for that value, so consoles may echo options back whole.
     */
    static Object toJava(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            node.forEach(n -> values.add(toJava(n)));
            return values;
        }
        if (node.isObject()) {
            return node.has("value") ? toJava(node.get("value")) : MAPPER.convertValue(node, Object.class);
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToInt()) {
                return node.intValue();
            }
            return node.canConvertToLong() ? (Object) node.longValue() : (Object) node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Missing or non-string '%s' field".formatted(field));
        }
        return value.asText();
    }
}
