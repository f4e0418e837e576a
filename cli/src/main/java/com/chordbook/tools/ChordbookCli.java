package com.chordbook.tools;

import com.chordbook.Version;
import com.chordbook.compiler.BookCompiler;
import com.chordbook.compiler.BookConfig;
import com.chordbook.compiler.CompileResult;
import com.chordbook.compiler.Diagnostic;
import com.chordbook.compiler.SourceText;
import com.chordbook.music.UnsupportedNotationException;
import com.chordbook.xml.AstXmlWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import javax.xml.stream.XMLStreamException;

/**
 * Compiles the song files named on the command line and prints the book tree as XML. Diagnostics
 * go to stderr.
 */
public final class ChordbookCli {
    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: ChordbookCli [--config book.properties] [--strict] [--version] <song file>...";

    private record Options(Path config, boolean strict, List<Path> files) {}

    private ChordbookCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path config = null;
        boolean strict = false;
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--version":
                    out.println("chordbook " + Version.RUNTIME);
                    return EXIT_OK;
                case "--strict":
                    strict = true;
                    break;
                case "--config":
                    if (i + 1 >= args.length) {
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    config = Path.of(args[++i]);
                    break;
                default:
                    if (args[i].startsWith("--")) {
                        err.println("Unknown option: " + args[i]);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    files.add(Path.of(args[i]));
                    break;
            }
        }
        if (files.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        return compile(new Options(config, strict, files), out, err);
    }

    private static int compile(Options options, PrintStream out, PrintStream err) {
        BookConfig config;
        List<SourceText> sources = new ArrayList<>();
        try {
            config = loadConfig(options.config(), options.files().get(0));
            for (Path file : options.files()) {
                sources.add(new SourceText(file.toString(), Files.readString(file, StandardCharsets.UTF_8)));
            }
        } catch (IOException ex) {
            err.println("Cannot read input: " + ex.getMessage());
            return EXIT_USAGE;
        } catch (UnsupportedNotationException | IllegalArgumentException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            return EXIT_USAGE;
        }

        CompileResult result = new BookCompiler(config).compile(sources);
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            err.println(diagnostic);
        }
        try {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            AstXmlWriter.write(result.getBook(), writer);
            writer.flush();
            out.println();
        } catch (XMLStreamException | IOException ex) {
            err.println("Cannot write XML: " + ex.getMessage());
            return EXIT_USAGE;
        }
        return options.strict() && result.hasErrors() ? EXIT_ERRORS : EXIT_OK;
    }

    /** Reads the book properties, or titles the book after the first input when none are given. */
    private static BookConfig loadConfig(Path path, Path firstInput)
            throws IOException, UnsupportedNotationException {
        if (path == null) {
            Path name = firstInput.getFileName();
            return BookConfig.builder(name != null ? name.toString() : "Songbook").build();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return BookConfig.fromProperties(properties);
    }
}
