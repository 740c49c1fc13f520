package com.locode.resolution.command;

import com.locode.resolution.catalog.InMemoryCodeBank;
import com.locode.resolution.catalog.JsonCatalogImporter;
import com.locode.resolution.core.model.CodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Interactive console: loads a JSON catalog and runs commands read from standard input.
 *
 * <pre>
 * java com.locode.resolution.command.LocodeConsole catalog.json
 * </pre>
 */
public final class LocodeConsole {
    private static final Logger log = LoggerFactory.getLogger(LocodeConsole.class);

    private LocodeConsole() {
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: LocodeConsole <catalog.json>");
            System.exit(2);
        }

        InMemoryCodeBank codeBank;
        try {
            codeBank = new JsonCatalogImporter().load(Path.of(args[0]));
        } catch (IOException e) {
            log.error("console.load_failed path={} error={}", args[0], e.getMessage());
            System.err.println("Could not load catalog " + args[0] + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        PrintStream out = System.out;
        out.printf(Locale.ROOT, "Loaded %d locodes, %d subdivisions, %d states%n",
                codeBank.size(CodeType.LOCODE), codeBank.size(CodeType.SUBDIVISION), codeBank.size(CodeType.STATE));
        if (!codeBank.getValidationReport().isClean()) {
            out.println("Catalog has data-quality defects: " + codeBank.getValidationReport());
        }

        try {
            repl(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new CommandHandler(codeBank, out::println));
        } catch (IOException e) {
            log.error("console.read_failed error={}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Runs commands until end of input or {@code QUIT}.
     */
    static void repl(BufferedReader in, CommandHandler handler) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.equalsIgnoreCase("QUIT") || trimmed.equalsIgnoreCase("EXIT")) {
                return;
            }
            handler.run(trimmed);
        }
    }
}
