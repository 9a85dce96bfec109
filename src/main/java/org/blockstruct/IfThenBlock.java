package org.blockstruct;

import java.util.Arrays;
import java.util.List;

/** {@code if (head) then}. Children: 0 = head, 1 = then. */
public class IfThenBlock extends AbstractBlock {
    private BasicBlock head;
    private AbstractBlock then;

    public IfThenBlock(int id, BasicBlock head, AbstractBlock then) {
        super(id);
        checkAdoptable(head);
        checkAdoptable(then);
        if (head == then)
            throw new IllegalArgumentException("head and then branch are the same block " + head);
        BasicBlock thenEntry = then.entry();
        if (head.getNext() != thenEntry && head.getCond() != thenEntry)
            throw new IllegalArgumentException(then + " is not a successor of " + head);
        adopt(head);
        adopt(then);
        this.head = head;
        this.then = then;
    }

    public BasicBlock getHead() {
        checkLive();
        return head;
    }

    public AbstractBlock getThen() {
        checkLive();
        return then;
    }

    @Override
    public BlockType getType() {
        return BlockType.IF_THEN;
    }

    @Override
    public int size() {
        checkLive();
        return 2;
    }

    @Override
    public AbstractBlock child(int index) {
        checkLive();
        switch (index) {
            case 0:
                return head;
            case 1:
                return then;
            default:
                throw new IndexOutOfBoundsException("if-then child " + index);
        }
    }

    @Override
    public BasicBlock entry() {
        checkLive();
        return head;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitIfThen(this);
    }

    @Override
    List<AbstractBlock> detachChildren() {
        List<AbstractBlock> out = Arrays.asList(head, then);
        head = null;
        then = null;
        return out;
    }
}
