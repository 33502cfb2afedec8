package org.calista.unglish.generate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.morphology.MorphologyEngine;
import org.calista.unglish.morphology.MorphologyPlan;
import org.calista.unglish.random.RandomSource;
import org.calista.unglish.random.impl.Mulberry32;
import org.calista.unglish.random.impl.UnseededRandomSource;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.word.Word;
import org.calista.unglish.word.WrittenForm;

import java.util.Objects;

/**
 * One word per call: plan affixes, build the root, repair it, pronounce and spell it, then affix it.
 *
 * <p>Stateless apart from the immutable language, so one instance serves any number of threads. All
 * randomness comes from a single source per call: the same seed and options give the same word.</p>
 */
public final class WordGenerator {
    private static final Logger log = LogManager.getLogger(WordGenerator.class);

    static final String STAGE = "generate";

    private final LanguageConfig lang;
    private final SyllableBuilder builder;
    private final PhonotacticRepair repair;
    private final PronunciationEngine pronunciation;
    private final OrthographyWriter writer;
    private final MorphologyEngine morphology;

    public WordGenerator(LanguageConfig lang) {
        this(lang, new SyllableBuilder(), new PhonotacticRepair(), new PronunciationEngine(), new OrthographyWriter());
    }

    public WordGenerator(LanguageConfig lang,
                         SyllableBuilder builder,
                         PhonotacticRepair repair,
                         PronunciationEngine pronunciation,
                         OrthographyWriter writer) {
        this.lang = Objects.requireNonNull(lang, "lang");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.repair = Objects.requireNonNull(repair, "repair");
        this.pronunciation = Objects.requireNonNull(pronunciation, "pronunciation");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.morphology = new MorphologyEngine(repair, pronunciation);
    }

    public LanguageConfig language() {
        return lang;
    }

    public Word generate() {
        return generate(GenerationOptions.defaults());
    }

    public Word generate(GenerationOptions options) {
        Objects.requireNonNull(options, "options");
        RandomSource rng = options.seed != null ? Mulberry32.of(options.seed) : new UnseededRandomSource();
        TraceRecorder trace = options.trace ? new TraceRecorder() : null;
        GenerationContext ctx = new GenerationContext(lang, options, rng, trace);

        MorphologyPlan plan = morphology.plan(ctx);

        int total = options.syllableCount != null ? options.syllableCount : ctx.pick(lang.structure.syllableCounts(options.mode));
        if (options.syllableCount != null) {
            // a requested total leaves the root at least one syllable
            MorphologyPlan fitted = plan.within(total - 1);
            if (fitted != plan && ctx.tracing()) ctx.decision(STAGE, "planFitted", fitted.toString());
            plan = fitted;
        }
        int rootCount = Math.max(1, total - plan.syllableReduction());
        ctx.decision(STAGE, "syllableCount", total);

        builder.build(ctx, rootCount, rootCount + plan.syllableReduction() == 1);
        repair.repair(ctx);
        String pron = pronunciation.pronounce(ctx);
        WrittenForm written = writer.write(ctx);

        if (!plan.isBare() && options.syllableCount != null && rootCount + morphology.addedSyllables(ctx, plan) != total) {
            // an allomorph changed the affix length on this root; the requested total wins
            if (ctx.tracing()) ctx.decision(STAGE, "planDropped", plan.toString());
            plan = MorphologyPlan.BARE;
        }
        if (!plan.isBare()) {
            ctx.decision(STAGE, "rootSyllableCount", rootCount);
            MorphologyEngine.Result affixed = morphology.apply(ctx, plan, written);
            pron = affixed.pronunciation;
            written = affixed.written;
        }

        if (trace != null) trace.morphologyApplied(!plan.isBare());
        Word word = new Word(ctx.syllables(), pron, written, trace == null ? null : trace.build());

        if (log.isDebugEnabled()) {
            log.debug("generated '{}' /{}/ mode={} seed={} plan={}", written.clean, pron, options.mode.key(), options.seed, plan);
        }
        return word;
    }
}
