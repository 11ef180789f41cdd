package io.herald.core.content;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads section payloads from {@code <root>/<section>.json}. Per-user sections are looked up under
 * {@code <root>/users/<userId>/} first. A missing list section reads as empty; a missing object section is an error.
 */
public final class FileContentSource implements ContentSource {
    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final Path root;
    private final ObjectMapper mapper;

    public FileContentSource(Path root, ObjectMapper mapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Object fetch(ContentSection section, ContentQuery query) throws IOException {
        Path file = locate(section, query.userId());
        if (!Files.exists(file)) {
            if (section.listValued()) {
                return List.of();
            }
            throw new IOException("no " + section.key() + " data at " + file);
        }
        String json = Files.readString(file);
        if (json.isBlank()) {
            return section.listValued() ? List.of() : Map.of();
        }
        return section.listValued() ? mapper.readValue(json, LIST) : mapper.readValue(json, OBJECT);
    }

    private Path locate(ContentSection section, String userId) {
        String fileName = section.key() + ".json";
        if (userId != null && !userId.isBlank() && !userId.contains("/") && !userId.contains("..")) {
            Path personal = root.resolve("users").resolve(userId).resolve(fileName);
            if (Files.exists(personal)) {
                return personal;
            }
        }
        return root.resolve(fileName);
    }
}
