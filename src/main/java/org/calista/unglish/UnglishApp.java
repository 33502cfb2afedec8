package org.calista.unglish;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.unglish.core.UnglishKernel;
import org.calista.unglish.generate.GenerationOptions;
import org.calista.unglish.language.ConfigurationException;
import org.calista.unglish.language.GenerationMode;
import org.calista.unglish.word.Word;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * Console runner.
 *
 * <p>With arguments, prints one batch and exits: {@code [count] [--seed N] [--mode lexicon|text] [--no-morphology]
 * [--export]}. Without arguments, reads commands from stdin:</p>
 * <pre>
 *   (empty)        one word
 *   N              N words
 *   seed N|off     fix or clear the base seed
 *   mode M         lexicon or text
 *   export N       write N words as JSONL under baseDir
 *   exit
 * </pre>
 */
public final class UnglishApp {

    private static final Logger log = LogManager.getLogger(UnglishApp.class);

    private final Path cfgPath;
    private UnglishKernel kernel;
    private GenerationOptions options;

    public static void main(String[] args) throws Exception {
        new UnglishApp().run(args);
    }

    public UnglishApp() {
        this.cfgPath = Path.of("config/unglish.json");
    }

    public void run(String[] args) throws IOException {
        try {
            kernel = UnglishKernel.builder()
                    .configRoot(Path.of("."))
                    .build(cfgPath);
            options = kernel.defaultOptions();
            if (kernel.config().batch.baseSeed != null) options = options.withSeed(kernel.config().batch.baseSeed);

            if (args.length > 0) runOnce(args);
            else runConsoleLoop();
        } finally {
            shutdown();
        }
    }

    private void runOnce(String[] args) throws IOException {
        int count = 1;
        boolean export = false;
        GenerationOptions.Builder b = options.toBuilder();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--seed" -> b.seed(Long.valueOf(Long.parseLong(value(args, ++i, a))));
                case "--mode" -> b.mode(GenerationMode.fromKey(value(args, ++i, a)));
                case "--no-morphology" -> b.morphology(false);
                case "--export" -> export = true;
                default -> count = Integer.parseInt(a);
            }
        }
        options = b.build();
        if (export) export(kernel.batch().generate(count, exportOptions()));
        else print(kernel.batch().generate(count, options));
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
        return args[i];
    }

    private void runConsoleLoop() throws IOException {
        log.info("Unglish started. language={}, mode={}", kernel.language().name, options.mode.key());
        log.info("Enter a count, 'seed N|off', 'mode lexicon|text', 'export N' or 'exit'.\n");

        try (Scanner sc = new Scanner(System.in)) {
            while (true) {
                System.out.print("> ");
                if (!sc.hasNextLine()) break;
                String line = sc.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) break;

                try {
                    handle(line);
                } catch (IllegalArgumentException | ConfigurationException e) {
                    System.out.println("error: " + e.getMessage());
                }
            }
        }
    }

    private void handle(String line) throws IOException {
        if (line.isEmpty()) {
            print(List.of(kernel.generator().generate(options)));
            advanceSeed(1);
            return;
        }
        String[] parts = line.split("\\s+");
        switch (parts[0].toLowerCase(Locale.ROOT)) {
            case "seed" -> {
                String v = parts.length > 1 ? parts[1] : "off";
                options = options.withSeed(v.equalsIgnoreCase("off") ? null : Long.valueOf(Long.parseLong(v)));
                System.out.println("seed = " + options.seed);
            }
            case "mode" -> {
                options = options.toBuilder().mode(GenerationMode.fromKey(parts.length > 1 ? parts[1] : null)).build();
                System.out.println("mode = " + options.mode.key());
            }
            case "export" -> {
                int n = parts.length > 1 ? Integer.parseInt(parts[1]) : kernel.config().batch.count;
                export(kernel.batch().generate(n, exportOptions()));
                advanceSeed(n);
            }
            default -> {
                int n = Integer.parseInt(parts[0]);
                print(kernel.batch().generate(n, options));
                advanceSeed(n);
            }
        }
    }

    /** Next request continues where the last seeded batch stopped. */
    private void advanceSeed(int n) {
        if (options.seed != null) options = options.withSeed(options.seed + n);
    }

    private GenerationOptions exportOptions() {
        return options.toBuilder().trace(kernel.config().export.includeTrace).build();
    }

    private static void print(List<Word> words) {
        for (Word w : words) {
            System.out.println(w.written.clean + "  /" + w.pronunciation + "/");
        }
    }

    private void export(List<Word> words) throws IOException {
        Path out = kernel.export(words);
        System.out.println("exported " + words.size() + " words to " + out);
    }

    private void shutdown() {
        if (kernel != null) kernel.close();
    }
}
