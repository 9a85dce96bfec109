package org.blockstruct;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the textual description of a single function.
 *
 * <p>The first line is a header (usually the function name) and is skipped. Every other line is
 * {@code <offset> <instruction>}, with the offset either in hex ({@code 0x}/{@code 0X}) or in decimal
 * and a single space before the instruction. The whole text is lowercased first. Blank lines are
 * ignored.
 */
public final class FunctionTextParser {
    private FunctionTextParser() {}

    public static List<Instruction> parse(String text) throws InstructionParseException {
        String[] lines = text.toLowerCase(Locale.ROOT).split("\n", -1);
        List<Instruction> out = new ArrayList<>(Math.max(0, lines.length - 1));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (line.isBlank()) continue;
            out.add(parseLine(i + 1, line));
        }
        return out;
    }

    /** The header line, trimmed; empty if the text is empty */
    public static String header(String text) {
        int nl = text.indexOf('\n');
        return (nl < 0 ? text : text.substring(0, nl)).trim();
    }

    static Instruction parseLine(int lineNumber, String line) throws InstructionParseException {
        int sep = line.indexOf(' ');
        if (sep < 0)
            throw new InstructionParseException(lineNumber, line, "missing separator between offset and instruction");
        String offsetToken = line.substring(0, sep);
        String instruction = line.substring(sep + 1).trim();
        if (instruction.isEmpty())
            throw new InstructionParseException(lineNumber, line, "missing instruction text");

        long offset;
        try {
            offset = HexUtils.parseOffset(offsetToken);
        } catch (NumberFormatException e) {
            throw new InstructionParseException(lineNumber, line, "malformed offset '" + offsetToken + "'", e);
        }
        return new Instruction(offset, instruction);
    }
}
