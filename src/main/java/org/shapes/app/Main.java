package org.shapes.app;

import org.shapes.core.io.ShapesFileLoader;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.config.LocalSettingsLoader;
import org.shapes.core.model.config.ShapesSettings;
import org.shapes.core.parse.ConsoleParseListener;
import org.shapes.core.parse.ParseListener;
import org.shapes.core.parse.ParseOutcome;
import org.shapes.core.parse.ShapesParseException;
import org.shapes.core.service.ShapesService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Командная строка:
 *   format &lt;in&gt; [-o &lt;out&gt;]   - разобрать и записать канонический текст
 *   json &lt;in&gt; [-o &lt;out&gt;]     - разобрать и выдать JSON
 *   check &lt;in&gt;...             - разобрать каждый файл и вывести сводку
 * Флаги: --no-repair --no-fallback --annotate-ports --verbose
 */
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = collectPositionalArgs(args);
        if (positional.isEmpty() || hasFlag(args, "--help")) {
            printUsage(err);
            return EXIT_USAGE;
        }

        ShapesSettings settings = buildSettings(args);
        // служебный вывод - в err, чтобы не смешивался с результатом в stdout
        ParseListener listener = settings.verbose ? new ConsoleParseListener(err, err) : ParseListener.NONE;
        ShapesService service = new ShapesService(settings, listener);

        String command = positional.get(0);
        List<String> inputs = positional.subList(1, positional.size());
        String outPath = findOptionValue(args, "-o");

        switch (command) {
            case "format", "json" -> {
                if (inputs.size() != 1) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                return convert(service, command, Paths.get(inputs.get(0)), outPath, out, err);
            }
            case "check" -> {
                if (inputs.isEmpty()) {
                    printUsage(err);
                    return EXIT_USAGE;
                }
                return check(service, inputs, out, err);
            }
            default -> {
                err.println("Unknown command: " + command);
                printUsage(err);
                return EXIT_USAGE;
            }
        }
    }

    private static int convert(ShapesService service, String command, Path in, String outPath,
                               PrintStream out, PrintStream err) {
        ParseOutcome outcome;
        try {
            outcome = service.parseShapesFile(in);
        } catch (ShapesParseException e) {
            err.println("[FAIL] " + in + " " + e.getKind() + ": " + e.getMessage());
            return EXIT_FAIL;
        }
        warnIfRecovered(in, outcome, err);

        ShapesFile file = outcome.shapesFile();
        String text = "json".equals(command) ? service.toJson(file) : service.serializeShapesFile(file);

        if (outPath == null) {
            out.print(text);
            if (!text.endsWith("\n")) out.println();
            return EXIT_OK;
        }

        try {
            if ("json".equals(command)) {
                ShapesFileLoader.write(Paths.get(outPath), text);
            } else {
                service.writeShapesFile(Paths.get(outPath), file);
            }
        } catch (IOException e) {
            err.println("[FAIL] " + outPath + " IO: " + e.getMessage());
            return EXIT_FAIL;
        }
        err.println("[WRITE] " + outPath + " shapes=" + file.shapes.size());
        return EXIT_OK;
    }

    private static int check(ShapesService service, List<String> inputs, PrintStream out, PrintStream err) {
        int code = EXIT_OK;
        for (String input : inputs) {
            Path path = Paths.get(input);
            try {
                ParseOutcome outcome = service.parseShapesFile(path);
                ShapesFile file = outcome.shapesFile();
                String tag = outcome.isSuspicious() ? "[WARN]" : "[OK]  ";
                out.println(tag + " " + path
                        + " strategy=" + outcome.strategy()
                        + " status=" + outcome.status()
                        + " shapes=" + file.shapes.size()
                        + " scales=" + file.scaleCount());
                if (outcome.isSuspicious()) {
                    code = EXIT_FAIL;
                }
            } catch (ShapesParseException e) {
                out.println("[FAIL] " + path + " " + e.getKind() + ": " + e.getMessage());
                code = EXIT_FAIL;
            }
        }
        return code;
    }

    private static void warnIfRecovered(Path in, ParseOutcome outcome, PrintStream err) {
        if (!outcome.usedFallback()) return;
        err.println("[WARN] " + in + " parsed by line scanner (status=" + outcome.status()
                + "), extended properties and names are lost: " + outcome.strictFailure());
    }

    private static ShapesSettings buildSettings(String[] args) {
        ShapesSettings settings = new ShapesSettings();
        LocalSettingsLoader.apply(settings);
        settings.applyOverridesFromSystem();

        if (hasFlag(args, "--no-repair")) settings.repairEnabled = false;
        if (hasFlag(args, "--no-fallback")) settings.fallbackEnabled = false;
        if (hasFlag(args, "--annotate-ports")) settings.annotatePorts = true;
        if (hasFlag(args, "--verbose")) settings.verbose = true;
        return settings;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  format <in> [-o <out>]");
        err.println("  json <in> [-o <out>]");
        err.println("  check <in>...");
        err.println("Flags: --no-repair --no-fallback --annotate-ports --verbose");
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (flag.equals(a)) return true;
        }
        return false;
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("-")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "-o".equals(token);
    }
}
