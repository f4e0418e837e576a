package com.chordbook.compiler;

import com.chordbook.ast.Book;
import com.chordbook.ast.Song;
import com.chordbook.compiler.validation.ValidationRunner;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning song sources into a {@link Book}. Each song is parsed on its own with
 * fresh directive state, validated, and merged back in input order.
 */
public final class BookCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(BookCompiler.class);

    private final BookConfig config;
    private final ValidationRunner validation;

    public BookCompiler(BookConfig config) {
        this(config, ValidationRunner.defaultRules());
    }

    public BookCompiler(BookConfig config, ValidationRunner validation) {
        this.config = Objects.requireNonNull(config, "config");
        this.validation = Objects.requireNonNull(validation, "validation");
    }

    /** Compiles all sources on the calling thread. */
    public CompileResult compile(List<SourceText> sources) {
        return compile(sources, Runnable::run);
    }

    /**
     * Compiles the sources, parsing songs as independent tasks on {@code executor}. The result
     * does not depend on the executor: songs and diagnostics are merged in input order.
     */
    public CompileResult compile(List<SourceText> sources, Executor executor) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(executor, "executor");
        SongParser parser = new SongParser(config.toParserConfig());

        List<SourceTasks> pending = new ArrayList<>();
        for (SourceText source : sources) {
            SongSplitter.Split split = SongSplitter.split(source);
            SourceTasks tasks = new SourceTasks(orphanWarning(source, split.getPreamble()));
            for (SongText song : split.getSongs()) {
                tasks.songs.add(CompletableFuture.supplyAsync(() -> parseAndValidate(parser, song), executor));
            }
            pending.add(tasks);
        }

        List<Song> songs = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SourceTasks tasks : pending) {
            diagnostics.addAll(tasks.preamble);
            for (CompletableFuture<ParsedSong> task : tasks.songs) {
                ParsedSong parsed = join(task);
                songs.add(parsed.getSong());
                diagnostics.addAll(parsed.getDiagnostics());
            }
        }

        Book book =
                new Book(
                        config.getTitle(),
                        config.getSubtitle(),
                        config.getFrontImage(),
                        config.getTitleNote(),
                        config.getChorusLabel(),
                        config.getNotation(),
                        songs);
        CompileResult result = new CompileResult(book, diagnostics);
        LOG.info(
                "Compiled {} songs from {} sources: {} errors, {} diagnostics in total",
                songs.size(),
                sources.size(),
                result.getErrors().size(),
                diagnostics.size());
        return result;
    }

    /**
     * Like {@link #compile(List)} but fails when any error-level diagnostic was recorded.
     *
     * @throws CompileException carrying all diagnostics, the first error being its message
     */
    public Book compileStrict(List<SourceText> sources) throws CompileException {
        CompileResult result = compile(sources);
        List<Diagnostic> errors = result.getErrors();
        if (!errors.isEmpty()) {
            throw new CompileException(
                    errors.size() + " error(s), first: " + errors.get(0), result.getDiagnostics());
        }
        return result.getBook();
    }

    private static List<Diagnostic> orphanWarning(SourceText source, List<SourceLine> preamble) {
        for (SourceLine line : preamble) {
            if (!line.isBlank()) {
                return List.of(
                        Diagnostic.warning(
                                Diagnostic.Kind.ORPHAN_CONTENT,
                                "Content before the first song title is ignored",
                                line.location(source.getName())));
            }
        }
        return List.of();
    }

    private ParsedSong parseAndValidate(SongParser parser, SongText text) {
        ParsedSong parsed = parser.parse(text);
        List<Diagnostic> diagnostics = new ArrayList<>(parsed.getDiagnostics());
        diagnostics.addAll(validation.run(parsed.getSong()));
        diagnostics.sort(Comparator.comparing(Diagnostic::getLocation));
        if (!diagnostics.isEmpty()) {
            LOG.debug("Song '{}' has {} diagnostics", parsed.getSong().getTitle(), diagnostics.size());
        }
        return new ParsedSong(parsed.getSong(), diagnostics);
    }

    private static ParsedSong join(CompletableFuture<ParsedSong> task) {
        try {
            return task.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }

    /** Work started for one source: its preamble warning and one task per song. */
    private static final class SourceTasks {
        private final List<Diagnostic> preamble;
        private final List<CompletableFuture<ParsedSong>> songs = new ArrayList<>();

        SourceTasks(List<Diagnostic> preamble) {
            this.preamble = preamble;
        }
    }
}
