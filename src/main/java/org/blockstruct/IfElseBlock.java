package org.blockstruct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code if / else if* / else} ladder.
 *
 * <p>Children: 0 = head, 1 = then, 2 = else, 3.. = the intermediate condition blocks between the
 * head and the then branch, in source order.
 *
 * <p>The chain is recovered from the raw edges: starting at the head, follow {@code next} unless it
 * leads to the else branch, in which case follow {@code cond}; every block met before reaching the
 * then branch is one more link.
 */
public class IfElseBlock extends AbstractBlock {
    private BasicBlock head;
    private AbstractBlock then;
    private AbstractBlock elseBranch;
    private List<BasicBlock> chain;

    public IfElseBlock(int id, BasicBlock head, AbstractBlock then, AbstractBlock elseBranch) {
        super(id);
        checkAdoptable(head);
        checkAdoptable(then);
        checkAdoptable(elseBranch);
        if (head == then || head == elseBranch || then == elseBranch)
            throw new IllegalArgumentException("head, then and else must be distinct blocks");

        List<BasicBlock> links = resolveChain(head, then.entry(), elseBranch.entry());
        for (BasicBlock link : links) checkAdoptable(link);

        adopt(head);
        adopt(then);
        adopt(elseBranch);
        for (BasicBlock link : links) adopt(link);
        this.head = head;
        this.then = then;
        this.elseBranch = elseBranch;
        this.chain = links;
    }

    private static List<BasicBlock> resolveChain(BasicBlock head, BasicBlock thenEntry, BasicBlock elseEntry) {
        List<BasicBlock> links = new ArrayList<>();
        BasicBlock current = step(head, elseEntry);
        while (current != thenEntry) {
            if (current == null || current == head || current == elseEntry || links.contains(current))
                throw new IllegalArgumentException("no else-if chain from " + head + " to " + thenEntry);
            links.add(current);
            current = step(current, elseEntry);
        }
        return links;
    }

    private static BasicBlock step(BasicBlock from, BasicBlock elseEntry) {
        return from.getNext() != elseEntry ? from.getNext() : from.getCond();
    }

    public BasicBlock getHead() {
        checkLive();
        return head;
    }

    public AbstractBlock getThen() {
        checkLive();
        return then;
    }

    public AbstractBlock getElse() {
        checkLive();
        return elseBranch;
    }

    /** Intermediate condition blocks, first else-if first */
    public List<BasicBlock> getChain() {
        checkLive();
        return Collections.unmodifiableList(chain);
    }

    @Override
    public BlockType getType() {
        return BlockType.IF_ELSE;
    }

    @Override
    public int size() {
        checkLive();
        return 3 + chain.size();
    }

    @Override
    public AbstractBlock child(int index) {
        checkLive();
        switch (index) {
            case 0:
                return head;
            case 1:
                return then;
            case 2:
                return elseBranch;
            default:
                if (index < 0 || index - 3 >= chain.size())
                    throw new IndexOutOfBoundsException("if-else child " + index);
                return chain.get(index - 3);
        }
    }

    @Override
    public BasicBlock entry() {
        checkLive();
        return head;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitIfElse(this);
    }

    @Override
    List<AbstractBlock> detachChildren() {
        List<AbstractBlock> out = new ArrayList<>(3 + chain.size());
        out.add(head);
        out.add(then);
        out.add(elseBranch);
        out.addAll(chain);
        head = null;
        then = null;
        elseBranch = null;
        chain = List.of();
        return out;
    }
}
