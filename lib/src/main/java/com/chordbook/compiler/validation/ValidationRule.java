package com.chordbook.compiler.validation;

import com.chordbook.ast.Song;
import com.chordbook.compiler.Diagnostic;
import java.util.List;

/**
 * A single check over one parsed song. Rules are deterministic and report problems in document
 * order.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule against one song.
     *
     * @param song A fully parsed song.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<Diagnostic> validate(Song song);
}
