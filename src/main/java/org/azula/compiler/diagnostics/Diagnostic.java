package org.azula.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * produced while scanning a source file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem the parser or driver should treat as fatal. */
        ERROR,
        /** A problem that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
