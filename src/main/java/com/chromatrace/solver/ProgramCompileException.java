package com.chromatrace.solver;

/**
 * Thrown when the compiler rejects the generated program or produces no bitcode.
 */
public class ProgramCompileException extends SolverException {

    private final String diagnostics;

    public ProgramCompileException(String message, String diagnostics) {
        super(diagnostics == null || diagnostics.isBlank() ? message : message + ":\n" + diagnostics);
        this.diagnostics = diagnostics;
    }

    /** The compiler's own output (stderr). */
    public String getDiagnostics() {
        return diagnostics;
    }
}
