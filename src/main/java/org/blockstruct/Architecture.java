package org.blockstruct;

/**
 * Architecture specific knowledge the graph builder needs: what an instruction does to control flow
 * and where a direct branch goes.
 */
public interface Architecture {

    /** Control-flow effect of a single instruction */
    enum Flow {
        NONE,             // falls through (calls included)
        JUMP,             // unconditional transfer, fallthrough never taken
        CONDITIONAL_JUMP, // either the target or the fallthrough
        RETURN            // leaves the function
    }

    BinaryInfo.Arch getId();

    Flow flowOf(Instruction instruction);

    /**
     * Target of a direct branch.
     *
     * @return the target address, or null for indirect/unresolvable branches and for non-branches
     */
    Long branchTarget(Instruction instruction);

    static Architecture of(BinaryInfo info) {
        switch (info.getArch()) {
            case X86:
                return new X86Architecture();
            case ARM:
                return new ArmArchitecture();
            case JVM:
                return new JvmArchitecture();
            default:
                throw new IllegalArgumentException("unsupported architecture: " + info.getArch());
        }
    }

    /** First whitespace/comma separated token of the operands, e.g. "0x20" out of "0x20 <main+0x20>" */
    static String firstOperand(Instruction instruction) {
        String ops = instruction.getOperands().trim();
        int end = 0;
        while (end < ops.length() && !Character.isWhitespace(ops.charAt(end)) && ops.charAt(end) != ',') end++;
        return ops.substring(0, end);
    }

    /**
     * First token of the last comma separated operand, e.g. "0x20" out of "r0, 0x20" or
     * "r0, 0x20 <f+0x20>"
     */
    static String lastOperand(Instruction instruction) {
        String ops = instruction.getOperands();
        int symbol = ops.indexOf('<');
        if (symbol >= 0) ops = ops.substring(0, symbol);
        String last = ops.substring(ops.lastIndexOf(',') + 1).trim();
        int end = 0;
        while (end < last.length() && !Character.isWhitespace(last.charAt(end))) end++;
        return last.substring(0, end);
    }
}
