package org.blockstruct;

/**
 * A function description line that does not follow the {@code <offset> <instruction>} grammar.
 */
public class InstructionParseException extends Exception {
    private final int lineNumber;
    private final String line;

    public InstructionParseException(int lineNumber, String line, String reason) {
        this(lineNumber, line, reason, null);
    }

    public InstructionParseException(int lineNumber, String line, String reason, Throwable cause) {
        super("line " + lineNumber + ": " + reason + " (\"" + line + "\")", cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** 1-based, the header counts as line 1 */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
