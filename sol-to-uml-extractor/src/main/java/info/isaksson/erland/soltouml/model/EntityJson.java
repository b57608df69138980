package info.isaksson.erland.soltouml.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON form of extracted entities, as handed to diagram renderers and storage-layout tooling.
 *
 * <p>Writing is deterministic: entity, attribute and operator order is kept as extracted, map keys are
 * sorted, output is pretty printed with two-space indentation and ends with a newline.</p>
 */
public final class EntityJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();
    private static final TypeReference<List<Entity>> ENTITY_LIST = new TypeReference<>() {};

    private EntityJson() {}

    public static List<Entity> read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ENTITY_LIST);
        }
    }

    public static List<Entity> readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, ENTITY_LIST);
    }

    public static void write(List<Entity> entities, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).forType(ENTITY_LIST).writeValue(out, entities == null ? List.of() : entities);
            out.write('\n');
        }
    }

    public static String toJsonString(List<Entity> entities) throws IOException {
        return MAPPER.writer(PRETTY).forType(ENTITY_LIST).writeValueAsString(entities == null ? List.of() : entities) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
