package org.blockstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Analysis of a single function: the instructions, in order and indexed by address, and the
 * control flow graph built from them.
 */
public class Analysis {
    private static final Logger logger = LoggerFactory.getLogger(Analysis.class);

    private final List<Instruction> instructions;      // linearly stored
    private final Map<Long, Integer> byAddress;        // address -> position in instructions
    private final BinaryInfo info;
    private final Architecture architecture;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private BasicBlock cfg;

    /**
     * @param instructions the function body, ordered by address
     * @param info         metadata of the binary; its architecture decides which instructions branch
     * @throws IllegalArgumentException if two instructions share an address or the architecture is unknown
     */
    public Analysis(List<Instruction> instructions, BinaryInfo info) {
        this.info = info;
        this.architecture = Architecture.of(info);
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.byAddress = new HashMap<>(this.instructions.size() * 2);
        for (int i = 0; i < this.instructions.size(); i++) {
            Integer previous = byAddress.putIfAbsent(this.instructions.get(i).getAddress(), i);
            if (previous != null)
                throw new IllegalArgumentException("duplicate instruction at "
                        + HexUtils.formatAddress(this.instructions.get(i).getAddress()));
        }
        buildCfg();
    }

    /**
     * Analysis of a function given as text, see {@link FunctionTextParser} for the syntax. The text
     * is converted to lowercase.
     */
    public Analysis(String function, BinaryInfo info) throws InstructionParseException {
        this(FunctionTextParser.parse(function), info);
    }

    /**
     * The n-th instruction. This is a position, not an address: the first instruction is 0 whatever
     * its offset. Out of bounds positions give {@link Instruction#EMPTY}.
     */
    public Instruction get(int index) {
        if (index < 0 || index >= instructions.size()) return Instruction.EMPTY;
        return instructions.get(index);
    }

    public int size() {
        return instructions.size();
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    /** Position of the instruction at the given address, -1 if there is none */
    public int indexOf(long address) {
        Integer pos = byAddress.get(address);
        return pos == null ? -1 : pos;
    }

    /** Entry block of the control flow graph, null for an empty function */
    public BasicBlock cfg() {
        return cfg;
    }

    /** All basic blocks in address order; the id of a block is its position here */
    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BinaryInfo getInfo() {
        return info;
    }

    public Architecture getArchitecture() {
        return architecture;
    }

    // O(n log n): leaders are kept sorted, everything else is linear
    private void buildCfg() {
        int n = instructions.size();
        if (n == 0) return;

        // 1) leaders: entry, branch targets, instruction after any transfer
        TreeSet<Integer> leaders = new TreeSet<>();
        leaders.add(0);
        for (int i = 0; i < n; i++) {
            Instruction ins = instructions.get(i);
            Architecture.Flow flow = architecture.flowOf(ins);
            if (flow == Architecture.Flow.NONE) continue;
            if (i + 1 < n) leaders.add(i + 1);
            int target = targetOf(ins);
            if (target >= 0) leaders.add(target);
        }

        // 2) one block for each run between leaders
        int[] blockAt = new int[n];
        Integer start = leaders.first();
        while (start != null) {
            Integer end = leaders.higher(start);
            int stop = end == null ? n : end;
            int id = blocks.size();
            blocks.add(new BasicBlock(id, instructions.subList(start, stop)));
            for (int i = start; i < stop; i++) blockAt[i] = id;
            start = end;
        }

        // 3) edges, from the effect of the last instruction
        for (int id = 0; id < blocks.size(); id++) {
            BasicBlock block = blocks.get(id);
            BasicBlock following = id + 1 < blocks.size() ? blocks.get(id + 1) : null;
            Instruction last = block.getLast();
            int target = targetOf(last);
            BasicBlock targetBlock = target >= 0 ? blocks.get(blockAt[target]) : null;
            switch (architecture.flowOf(last)) {
                case NONE:
                    block.setNext(following);
                    break;
                case JUMP:
                    block.setNext(targetBlock);
                    break;
                case CONDITIONAL_JUMP:
                    block.setNext(following);
                    if (targetBlock != following) block.setCond(targetBlock);
                    break;
                case RETURN:
                    break;
            }
        }
        cfg = blocks.get(0);
        logger.debug("{} instructions, {} basic blocks", n, blocks.size());
    }

    // position of the direct branch target inside this function, -1 otherwise
    private int targetOf(Instruction ins) {
        Long target = architecture.branchTarget(ins);
        if (target == null) return -1;
        Integer pos = byAddress.get(target);
        if (pos == null) {
            logger.debug("branch at {} leaves the function ({})", HexUtils.formatAddress(ins.getAddress()),
                    HexUtils.formatAddress(target));
            return -1;
        }
        return pos;
    }
}
