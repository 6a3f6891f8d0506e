package it.unimib.datai.faaslocal.scheduler.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads function environment from a Cargo manifest:
 *
 * <pre>
 * [package.metadata.lambda.env]
 * LOG_FORMAT = "json"
 *
 * [package.metadata.lambda.bin.orders.env]
 * TABLE = "orders-local"
 * </pre>
 *
 * Binary entries override package entries. A manifest that does not exist has no metadata.
 */
public class CargoFunctionMetadataReader implements FunctionMetadataReader {
    private final TomlMapper mapper;

    public CargoFunctionMetadataReader() {
        this(new TomlMapper());
    }

    CargoFunctionMetadataReader(TomlMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Map<String, String> read(Path manifestPath, String binName) {
        if (manifestPath == null || !Files.exists(manifestPath)) {
            return Map.of();
        }

        JsonNode root;
        try {
            root = mapper.readTree(manifestPath.toFile());
        } catch (IOException e) {
            throw new FunctionMetadataException(manifestPath,
                    "Unable to parse manifest " + manifestPath + ": " + e.getMessage(), e);
        }

        JsonNode lambda = root.path("package").path("metadata").path("lambda");
        Map<String, String> env = new LinkedHashMap<>();
        copyEnv(lambda.path("env"), env);
        if (binName != null && !binName.isBlank()) {
            copyEnv(lambda.path("bin").path(binName).path("env"), env);
        }
        return env;
    }

    private static void copyEnv(JsonNode table, Map<String, String> target) {
        if (!table.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isValueNode()) {
                target.put(field.getKey(), value.asText());
            }
        }
    }
}
