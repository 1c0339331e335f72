package com.spectra.cli;

import com.spectra.Lexer;
import com.spectra.LineIndex;
import com.spectra.ParseException;
import com.spectra.Parser;
import com.spectra.ast.Module;
import com.spectra.json.AstJsonException;
import com.spectra.json.AstJsonProvider;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses one Spectra source file and prints its AST as JSON.
 *
 * Usage:
 *   java -cp ... com.spectra.cli.ParseFile <file>
 *
 * Exit codes: 0 on success, 1 on a parse or I/O error, 2 on bad usage.
 * Parse errors are reported as {@code file:line:column: expected X, got Y}.
 */
public final class ParseFile {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private ParseFile() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: spectra-parse <file>");
            return EXIT_USAGE;
        }

        Path path = Path.of(args[0]);
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error reading " + path + ": " + e);
            return EXIT_FAILURE;
        }

        Module module;
        try {
            module = Parser.parse(source);
        } catch (ParseException e) {
            // end of input is reported at the last position in the file
            int offset = e.location() != null ? e.location().start() : new Lexer(source).sourceLength();
            LineIndex.Position position = LineIndex.of(source).position(offset);
            err.println(path + ":" + position + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            out.println(AstJsonProvider.getProvider().getSerializer().serializePretty(module));
        } catch (AstJsonException e) {
            err.println("Error writing JSON: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }
}
