package org.calista.unglish.language;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.unglish.io.FileIO;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a {@link LanguageDefinition} from the classpath or from a file and turns it into a validated
 * {@link LanguageConfig}.
 */
public final class LanguageLoader {

    private static final Logger log = LogManager.getLogger(LanguageLoader.class);

    public static final String DEFAULT_RESOURCE = "languages/english.json";

    private final ObjectMapper mapper;

    public LanguageLoader() {
        this(defaultMapper());
    }

    public LanguageLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** The bundled English model. */
    public static LanguageConfig english() {
        try {
            return new LanguageLoader().loadResource(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read bundled language " + DEFAULT_RESOURCE, e);
        }
    }

    public LanguageDefinition readResource(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = LanguageLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("language resource not found: " + resource);
            return mapper.readValue(in, LanguageDefinition.class);
        }
    }

    public LanguageDefinition readFile(FileIO io, Path file) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(file, "file");
        String json = io.readString(file);
        if (json == null || json.isBlank()) throw new ConfigurationException("language file is empty: " + file);
        try {
            return mapper.readValue(json, LanguageDefinition.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("language file " + file + " is not valid: " + e.getOriginalMessage(), e);
        }
    }

    public LanguageConfig loadResource(String resource) throws IOException {
        return build(readResource(resource), resource);
    }

    public LanguageConfig loadFile(FileIO io, Path file) throws IOException {
        return build(readFile(io, file), file.toString());
    }

    private LanguageConfig build(LanguageDefinition definition, String source) {
        LanguageConfig cfg = LanguageConfig.from(definition);
        if (log.isInfoEnabled()) {
            log.info("Language '{}' loaded from {}: phonemes={}, prefixes={}, suffixes={}, spellingRules={}",
                    cfg.name, source, cfg.phonemes().size(), cfg.morphology.prefixes.size(),
                    cfg.morphology.suffixes.size(), cfg.orthography.spellingRules.size());
        }
        return cfg;
    }

    private static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return om;
    }
}
