package com.chordbook;

import com.chordbook.ast.AstVersion;

public final class Version {
    static final int MAJOR = 0;
    static final int MINOR = 3;
    static final int PATCH = 0;
    private static final String QUALIFIER = "alpha";

    public static final String FULL = MAJOR + "." + MINOR + "." + PATCH + "-" + QUALIFIER;
    public static final String RUNTIME = FULL + " (AST " + AstVersion.current().toVersionString() + ")";

    private Version() {}
}
