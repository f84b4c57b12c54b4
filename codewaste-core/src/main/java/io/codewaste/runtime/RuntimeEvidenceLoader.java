package io.codewaste.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codewaste.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads runtime invocation counts from a JSON file.
 *
 * <p>Accepted shapes:</p>
 * <pre>
 * {"functions": {"orders.service.validate": {"invocations": 12, "last_invoked_at": "..."}}}
 * {"orders.service.validate": 12}
 * [{"name": "validate", "count": 12}]
 * </pre>
 *
 * <p>A record is an integer, a number (truncated) or an object carrying
 * {@code invocations} or {@code count}. Records of any other shape are skipped.</p>
 */
public class RuntimeEvidenceLoader {

    private static final Logger log = LoggerFactory.getLogger(RuntimeEvidenceLoader.class);

    private final ObjectMapper objectMapper;

    public RuntimeEvidenceLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param path runtime evidence file, or null for none
     * @return records keyed by function name, in file order
     * @throws ConfigurationException if the file is missing, unreadable or not JSON
     */
    public Map<String, RuntimeRecord> load(Path path) {
        if (path == null) {
            return Map.of();
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Runtime evidence file not found: " + path);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Runtime evidence file is not valid JSON: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read runtime evidence file: " + path, e);
        }

        Map<String, RuntimeRecord> index = new LinkedHashMap<>();
        if (root == null) {
            return index;
        }
        if (root.isObject()) {
            JsonNode functions = root.get("functions");
            readObject(functions != null && functions.isObject() ? functions : root, index);
        } else if (root.isArray()) {
            readRows(root, index);
        }

        log.debug("Loaded {} runtime records from {}", index.size(), path);
        return index;
    }

    private void readObject(JsonNode object, Map<String, RuntimeRecord> index) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<RuntimeRecord> record = coerce(field.getValue());
            if (record.isPresent()) {
                index.put(field.getKey(), record.get());
            } else {
                log.warn("Skipping unusable runtime record for {}", field.getKey());
            }
        }
    }

    private void readRows(JsonNode rows, Map<String, RuntimeRecord> index) {
        for (JsonNode row : rows) {
            if (!row.isObject()) {
                continue;
            }
            String name = firstText(row, "name", "qualified_name", "function");
            if (name == null) {
                continue;
            }
            Optional<RuntimeRecord> record = coerce(row);
            if (record.isPresent()) {
                index.put(name, record.get());
            } else {
                log.warn("Skipping unusable runtime record for {}", name);
            }
        }
    }

    static Optional<RuntimeRecord> coerce(JsonNode value) {
        if (value.isIntegralNumber()) {
            return Optional.of(new RuntimeRecord(value.asInt(), null));
        }
        if (value.isFloatingPointNumber()) {
            return Optional.of(new RuntimeRecord((int) value.asDouble(), null));
        }
        if (!value.isObject()) {
            return Optional.empty();
        }

        JsonNode raw = value.hasNonNull("invocations") ? value.get("invocations") : value.get("count");
        if (raw == null || raw.isNull()) {
            return Optional.empty();
        }
        Integer invocations = null;
        if (raw.isNumber()) {
            invocations = (int) raw.asDouble();
        } else if (raw.isTextual()) {
            try {
                invocations = Integer.parseInt(raw.asText().strip());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (invocations == null) {
            return Optional.empty();
        }

        JsonNode lastInvoked = value.get("last_invoked_at");
        String lastInvokedAt = lastInvoked == null || lastInvoked.isNull() ? null : lastInvoked.asText();
        return Optional.of(new RuntimeRecord(invocations, lastInvokedAt));
    }

    private static String firstText(JsonNode row, String... keys) {
        for (String key : keys) {
            JsonNode node = row.get(key);
            if (node != null && !node.isNull() && !node.asText().isEmpty()) {
                return node.asText();
            }
        }
        return null;
    }
}
