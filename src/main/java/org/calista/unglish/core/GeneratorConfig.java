package org.calista.unglish.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.unglish.generate.GenerationOptions;
import org.calista.unglish.io.FileIO;
import org.calista.unglish.language.GenerationMode;
import org.calista.unglish.language.LanguageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Application config: plain POJO with defaults in the fields.
 * <ul>
 *   <li>{@link #loadOrCreate} writes the defaults when the file is missing or blank</li>
 *   <li>{@link #validate()} normalizes values instead of failing</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeneratorConfig {

    private static final Logger log = LoggerFactory.getLogger(GeneratorConfig.class);

    public String baseDir = "data";
    public Language language = new Language();
    public Generation generation = new Generation();
    public Batch batch = new Batch();
    public Export export = new Export();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Language {
        /** Classpath resource, used when {@link #file} is empty. */
        public String resource = LanguageLoader.DEFAULT_RESOURCE;
        /** Language JSON on disk, relative to the config root. */
        public String file = "";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Generation {
        public String mode = GenerationMode.LEXICON.key();
        public boolean morphology = true;
        public boolean trace = false;
        /** null: whatever the language says */
        public Boolean vowelReduction = null;
        public String hyphen = GenerationOptions.DEFAULT_HYPHEN;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Batch {
        public int count = 20;
        /** 0 = available processors */
        public int parallelism = 0;
        public int queueCapacity = 1024;
        /** null: unseeded batch */
        public Long baseSeed = null;
        public boolean skipFailures = false;
        public String threadNamePrefix = "unglish-batch-";
        public long shutdownTimeoutMs = 2000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Export {
        /** Relative to baseDir. */
        public String dir = "export";
        public String file = "words.jsonl";
        /** false replaces the file on every export */
        public boolean append = false;
        public boolean includeTrace = false;
    }

    // -------------------- Load / Save --------------------

    /**
     * Reads the config, creating it with defaults when missing (or blank).
     */
    public static GeneratorConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            GeneratorConfig created = new GeneratorConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            GeneratorConfig created = new GeneratorConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        GeneratorConfig cfg = mapper.readValue(json, GeneratorConfig.class);
        if (cfg == null) cfg = new GeneratorConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, GeneratorConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, GeneratorConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    /** Generation options as configured (no seed). */
    public GenerationOptions toOptions() {
        return GenerationOptions.builder()
                .mode(GenerationMode.fromKey(generation.mode))
                .morphology(generation.morphology)
                .trace(generation.trace)
                .vowelReduction(generation.vowelReduction)
                .hyphen(generation.hyphen)
                .build();
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (language == null) language = new Language();
        if (language.file == null) language.file = "";
        if (language.resource == null || language.resource.isBlank()) language.resource = LanguageLoader.DEFAULT_RESOURCE;

        if (generation == null) generation = new Generation();
        if (generation.mode == null || !isMode(generation.mode)) {
            log.warn("Unknown generation mode '{}', using {}", generation.mode, GenerationMode.LEXICON.key());
            generation.mode = GenerationMode.LEXICON.key();
        }
        if (generation.hyphen == null) generation.hyphen = GenerationOptions.DEFAULT_HYPHEN;

        if (batch == null) batch = new Batch();
        if (batch.count < 0) batch.count = 0;
        if (batch.parallelism < 0) batch.parallelism = 0;
        if (batch.queueCapacity < 32) batch.queueCapacity = 32;
        if (batch.threadNamePrefix == null || batch.threadNamePrefix.isBlank()) batch.threadNamePrefix = "unglish-batch-";
        if (batch.shutdownTimeoutMs < 250) batch.shutdownTimeoutMs = 250;

        if (export == null) export = new Export();
        if (export.dir == null || export.dir.isBlank()) export.dir = "export";
        if (export.file == null || export.file.isBlank()) export.file = "words.jsonl";
    }

    private static boolean isMode(String key) {
        for (GenerationMode m : GenerationMode.values()) {
            if (m.key().equals(key)) return true;
        }
        return false;
    }
}
