package org.calista.unglish.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.unglish.generate.BatchGenerator;
import org.calista.unglish.generate.GenerationOptions;
import org.calista.unglish.generate.WordGenerator;
import org.calista.unglish.io.FileIO;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config) -> loadOrCreate config, load the language, create generator + batch pool
 *   2) use           -> generator() / batch()
 *   3) close()       -> shuts the batch pool down
 */
public final class UnglishKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnglishKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final GeneratorConfig cfg;
    private final LanguageConfig language;
    private final WordGenerator generator;
    private final BatchGenerator batch;

    private UnglishKernel(FileIO io,
                          ObjectMapper mapper,
                          GeneratorConfig cfg,
                          LanguageConfig language,
                          WordGenerator generator,
                          BatchGenerator batch) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.language = Objects.requireNonNull(language, "language");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.batch = Objects.requireNonNull(batch, "batch");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        /** Overrides the language named in the config. */
        private LanguageConfig language;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder language(LanguageConfig language) {
            this.language = Objects.requireNonNull(language, "language");
            return this;
        }

        public UnglishKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            GeneratorConfig cfg = GeneratorConfig.loadOrCreate(external, cfgPath, om);

            LanguageConfig lang = (this.language != null) ? this.language : loadLanguage(external, om, cfg.language);

            // Base IO bound to cfg.baseDir (exports)
            FileIO io = new FileIO(configRoot.resolve(cfg.baseDir), charset, true);

            WordGenerator generator = new WordGenerator(lang);
            BatchGenerator batch = BatchGenerator.builder(generator)
                    .parallelism(cfg.batch.parallelism > 0 ? cfg.batch.parallelism : Runtime.getRuntime().availableProcessors())
                    .queueCapacity(cfg.batch.queueCapacity)
                    .threadNamePrefix(cfg.batch.threadNamePrefix)
                    .shutdownTimeoutMs(cfg.batch.shutdownTimeoutMs)
                    .skipFailures(cfg.batch.skipFailures)
                    .build();

            UnglishKernel k = new UnglishKernel(io, om, cfg, lang, generator, batch);
            k.logCreated(cfgPath);
            return k;
        }

        private static LanguageConfig loadLanguage(FileIO external, ObjectMapper om, GeneratorConfig.Language l) throws IOException {
            LanguageLoader loader = new LanguageLoader(om);
            if (l.file != null && !l.file.isBlank()) {
                return loader.loadFile(external, external.resolveExternal(Path.of(l.file)));
            }
            return loader.loadResource(l.resource);
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public GeneratorConfig config() { return cfg; }
    public LanguageConfig language() { return language; }
    public WordGenerator generator() { return generator; }
    public BatchGenerator batch() { return batch; }

    /**
     * Writes words as JSONL to {@code baseDir/export.dir/export.file}, replacing or appending per config.
     *
     * @return the file written
     */
    public Path export(List<Word> words) throws IOException {
        Objects.requireNonNull(words, "words");
        List<String> lines = new ArrayList<>(words.size());
        for (Word w : words) lines.add(mapper.writeValueAsString(w));

        Path out = io.resolve(cfg.export.dir + "/" + cfg.export.file);
        if (cfg.export.append) io.appendJsonl(out, lines);
        else io.writeJsonl(out, lines);
        log.info("Exported {} words to {} (append={})", words.size(), out, cfg.export.append);
        return out;
    }

    /** Options from the generation section, unseeded. */
    public GenerationOptions defaultOptions() {
        return cfg.toOptions();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        batch.close();
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("UnglishKernel created: config={}, baseDir={}, language={}, batchThreads={}",
                cfgPath, io.baseDir(), language.name, batch.parallelism());
    }
}
