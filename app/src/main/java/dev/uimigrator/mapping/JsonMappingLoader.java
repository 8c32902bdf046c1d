package dev.uimigrator.mapping;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads mapping databases from camelCase JSON. Unknown fields are ignored.
 */
public class JsonMappingLoader {

    static final String DEFAULT_RESOURCE = "/default-mappings.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonMappingLoader.class);

    private final ObjectMapper mapper;

    public JsonMappingLoader() {
        this.mapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public MappingDatabase load(Path file) {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            MappingDatabase database = read(in);
            LOGGER.info("Loaded {} type, {} property and {} namespace mappings from {}",
                    database.types().size(), database.properties().size(), database.namespaces().size(), file);
            return database;
        } catch (IOException ex) {
            throw new MappingLoadException("Failed to read mapping file " + file, ex);
        }
    }

    public MappingDatabase loadDefaults() {
        try (InputStream in = JsonMappingLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new MappingLoadException("Bundled mapping resource " + DEFAULT_RESOURCE + " is missing", null);
            }
            return read(in);
        } catch (IOException ex) {
            throw new MappingLoadException("Failed to read bundled mappings", ex);
        }
    }

    public MappingDatabase parse(String json) {
        try {
            MappingDatabase database = mapper.readValue(json, MappingDatabase.class);
            return database == null ? MappingDatabase.empty() : database;
        } catch (IOException ex) {
            throw new MappingLoadException("Invalid mapping JSON", ex);
        }
    }

    private MappingDatabase read(InputStream in) throws IOException {
        MappingDatabase database = mapper.readValue(in, MappingDatabase.class);
        return database == null ? MappingDatabase.empty() : database;
    }
}
