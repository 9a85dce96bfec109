package org.blockstruct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line composition of blocks. Sequences never nest: a sequence given as input is dissolved
 * and its components are moved into the new one.
 */
public class SequenceBlock extends AbstractBlock {
    private List<AbstractBlock> components = new ArrayList<>();

    public SequenceBlock(int id, AbstractBlock fst, AbstractBlock snd) {
        super(id);
        checkAdoptable(fst);
        checkAdoptable(snd);
        if (fst == snd)
            throw new IllegalArgumentException("cannot sequence " + fst + " with itself");
        merge(fst);
        merge(snd);
    }

    private void merge(AbstractBlock block) {
        if (block instanceof SequenceBlock) {
            for (AbstractBlock component : block.dissolve()) {
                adopt(component);
                components.add(component);
            }
        } else {
            adopt(block);
            components.add(block);
        }
    }

    public List<AbstractBlock> getComponents() {
        checkLive();
        return Collections.unmodifiableList(components);
    }

    @Override
    public BlockType getType() {
        return BlockType.SEQUENCE;
    }

    @Override
    public int size() {
        checkLive();
        return components.size();
    }

    @Override
    public AbstractBlock child(int index) {
        checkLive();
        return components.get(index);
    }

    @Override
    public BasicBlock entry() {
        checkLive();
        return components.get(0).entry();
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }

    @Override
    List<AbstractBlock> detachChildren() {
        List<AbstractBlock> out = components;
        components = new ArrayList<>();
        return out;
    }
}
