package com.gitcli.parse;

/**
 * Raised when git printed a line the parser does not understand. This points at an unsupported git
 * version or a parser bug, never at an operational failure.
 */
public class UnexpectedResultException extends RuntimeException {
    private final String line;
    private final int lineIndex;
    private final String output;

    public UnexpectedResultException(String reason, String line, int lineIndex, String output) {
        super(reason + " at line " + lineIndex + ": '" + line + "'");
        this.line = line;
        this.lineIndex = lineIndex;
        this.output = output;
    }

    public UnexpectedResultException(String reason, String line, int lineIndex, String output, Throwable cause) {
        this(reason, line, lineIndex, output);
        initCause(cause);
    }

    public String line() {
        return line;
    }

    public int lineIndex() {
        return lineIndex;
    }

    /** The complete output the line was taken from. */
    public String output() {
        return output;
    }
}
