package org.blockstruct;

import java.util.Collections;
import java.util.List;

/**
 * A maximal straight-line run of instructions with at most two exits: the fallthrough
 * ({@code next}, also used for unconditional jumps) and the taken target of a conditional branch
 * ({@code cond}). Either may be null. Edges are wired by {@link Analysis} and not touched afterwards.
 */
public class BasicBlock extends AbstractBlock {
    private final List<Instruction> instructions;
    private BasicBlock next;
    private BasicBlock cond;

    public BasicBlock(int id, List<Instruction> instructions) {
        super(id);
        if (instructions.isEmpty())
            throw new IllegalArgumentException("a basic block needs at least one instruction");
        this.instructions = Collections.unmodifiableList(instructions);
    }

    void setNext(BasicBlock next) {
        this.next = next;
    }

    void setCond(BasicBlock cond) {
        this.cond = cond;
    }

    public BasicBlock getNext() {
        return next;
    }

    public BasicBlock getCond() {
        return cond;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public int getInstructionCount() {
        return instructions.size();
    }

    public Instruction getInstruction(int index) {
        return instructions.get(index);
    }

    public Instruction getFirst() {
        return instructions.get(0);
    }

    public Instruction getLast() {
        return instructions.get(instructions.size() - 1);
    }

    @Override
    public BlockType getType() {
        return BlockType.BASIC;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public AbstractBlock child(int index) {
        throw new IndexOutOfBoundsException("a basic block has no children");
    }

    @Override
    public BasicBlock entry() {
        return this;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitBasic(this);
    }

    @Override
    List<AbstractBlock> detachChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return "BASIC#" + getId() + "[" + HexUtils.formatAddress(getFirst().getAddress())
                + ".." + HexUtils.formatAddress(getLast().getAddress()) + "]";
    }
}
