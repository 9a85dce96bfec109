package org.blockstruct;

import java.util.Set;

/** x86 and x86-64, Intel syntax, lowercase mnemonics. */
public class X86Architecture implements Architecture {

    private static final Set<String> JUMPS = Set.of("jmp", "jmpq", "ljmp");
    private static final Set<String> LOOPS = Set.of("loop", "loope", "loopne", "loopz", "loopnz");
    private static final Set<String> RETURNS = Set.of(
            "ret", "retn", "retf", "retq", "iret", "iretd", "iretq",
            "hlt", "ud2", "sysret", "sysexit");
    // "repz ret", "bnd jmp 0x20", "notrack jmp rax": the prefix hides the real mnemonic
    private static final Set<String> PREFIXES = Set.of("rep", "repz", "repe", "repnz", "repne", "bnd", "notrack");

    @Override
    public BinaryInfo.Arch getId() {
        return BinaryInfo.Arch.X86;
    }

    @Override
    public Flow flowOf(Instruction instruction) {
        instruction = withoutPrefixes(instruction);
        String mnem = instruction.getMnemonic();
        if (JUMPS.contains(mnem)) return Flow.JUMP;
        if (RETURNS.contains(mnem)) return Flow.RETURN;
        if (LOOPS.contains(mnem)) return Flow.CONDITIONAL_JUMP;
        if (mnem.length() > 1 && mnem.charAt(0) == 'j') return Flow.CONDITIONAL_JUMP;
        return Flow.NONE;
    }

    @Override
    public Long branchTarget(Instruction instruction) {
        Flow flow = flowOf(instruction);
        if (flow != Flow.JUMP && flow != Flow.CONDITIONAL_JUMP) return null;
        return HexUtils.tryParseOffset(Architecture.firstOperand(withoutPrefixes(instruction)));
    }

    private static Instruction withoutPrefixes(Instruction instruction) {
        while (PREFIXES.contains(instruction.getMnemonic()) && !instruction.getOperands().isEmpty())
            instruction = new Instruction(instruction.getAddress(), instruction.getOperands());
        return instruction;
    }
}
