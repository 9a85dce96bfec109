package org.blockstruct;

import java.util.Set;

/**
 * JVM bytecode as emitted by {@link BcelInstructionSource}. Multiway switches end a block without
 * successors: a basic block only carries a fallthrough and a single conditional edge.
 */
public class JvmArchitecture implements Architecture {

    private static final Set<String> JUMPS = Set.of("goto", "goto_w");
    private static final Set<String> MULTIWAY = Set.of("tableswitch", "lookupswitch", "ret");
    private static final Set<String> RETURNS = Set.of(
            "return", "ireturn", "lreturn", "freturn", "dreturn", "areturn", "athrow");

    @Override
    public BinaryInfo.Arch getId() {
        return BinaryInfo.Arch.JVM;
    }

    @Override
    public Flow flowOf(Instruction instruction) {
        String mnem = instruction.getMnemonic();
        if (JUMPS.contains(mnem) || MULTIWAY.contains(mnem)) return Flow.JUMP;
        if (RETURNS.contains(mnem)) return Flow.RETURN;
        if (mnem.startsWith("if")) return Flow.CONDITIONAL_JUMP;
        return Flow.NONE;
    }

    @Override
    public Long branchTarget(Instruction instruction) {
        String mnem = instruction.getMnemonic();
        if (MULTIWAY.contains(mnem)) return null;
        if (flowOf(instruction) == Flow.NONE) return null;
        return HexUtils.tryParseOffset(Architecture.firstOperand(instruction));
    }
}
