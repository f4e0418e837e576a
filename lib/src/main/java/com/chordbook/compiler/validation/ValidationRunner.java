package com.chordbook.compiler.validation;

import com.chordbook.ast.Song;
import com.chordbook.compiler.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Executes a list of validation rules and aggregates their diagnostics. */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Convenience factory that wires in the default rule set.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(new ChorusReferenceRule(), new ChorusLabelRule(), new VerseNumberRule()));
    }

    /**
     * Run all configured rules against one song.
     *
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<Diagnostic> run(Song song) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(song));
        }
        return diagnostics;
    }
}
