package org.blockstruct;

import java.util.Set;

/**
 * ARM (A32/T32) and AArch64, lowercase mnemonics.
 */
public class ArmArchitecture implements Architecture {

    private static final Set<String> CONDITIONS = Set.of(
            "eq", "ne", "cs", "hs", "cc", "lo", "mi", "pl", "vs", "vc",
            "hi", "ls", "ge", "lt", "gt", "le");
    private static final Set<String> COMPARE_AND_BRANCH = Set.of("cbz", "cbnz", "tbz", "tbnz");
    private static final Set<String> CALLS = Set.of("bl", "blx", "blr");

    @Override
    public BinaryInfo.Arch getId() {
        return BinaryInfo.Arch.ARM;
    }

    @Override
    public Flow flowOf(Instruction instruction) {
        String mnem = instruction.getMnemonic();
        String ops = instruction.getOperands().trim();

        if (mnem.equals("ret")) return Flow.RETURN;
        if ((mnem.equals("pop") || mnem.startsWith("ldm")) && writesPc(ops)) return Flow.RETURN;
        if (mnem.equals("bx")) return ops.equals("lr") ? Flow.RETURN : Flow.JUMP;
        if (mnem.equals("br")) return Flow.JUMP;
        if (CALLS.contains(mnem)) return Flow.NONE;
        if (COMPARE_AND_BRANCH.contains(mnem)) return Flow.CONDITIONAL_JUMP;
        if (mnem.startsWith("b")) {
            String cond = mnem.substring(1);
            if (cond.endsWith(".w") || cond.endsWith(".n")) cond = cond.substring(0, cond.length() - 2); // thumb width
            if (cond.startsWith(".")) cond = cond.substring(1);
            if (cond.isEmpty() || cond.equals("al")) return Flow.JUMP;
            if (CONDITIONS.contains(cond)) return Flow.CONDITIONAL_JUMP;
        }
        return Flow.NONE;
    }

    @Override
    public Long branchTarget(Instruction instruction) {
        Flow flow = flowOf(instruction);
        if (flow != Flow.JUMP && flow != Flow.CONDITIONAL_JUMP) return null;
        // register operands (bx r3, br x16) simply fail to parse
        return HexUtils.tryParseOffset(Architecture.lastOperand(instruction));
    }

    private static boolean writesPc(String operands) {
        int open = operands.indexOf('{');
        int close = operands.indexOf('}');
        if (open < 0 || close < open) return false;
        for (String reg : operands.substring(open + 1, close).split(",")) {
            if (reg.trim().equals("pc")) return true;
        }
        return false;
    }
}
