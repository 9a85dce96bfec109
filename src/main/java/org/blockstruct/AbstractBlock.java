package org.blockstruct;

import java.util.List;

/**
 * Node of the control-flow structure: either a {@link BasicBlock} or a composite built by the
 * {@link ControlFlowStructurer}.
 *
 * <p>Every block has at most one owner. A composite adopts its children when it is constructed and
 * releases them when it is released; children moved into another composite (sequence flattening)
 * change owner and are no longer reachable from the old one.
 */
public abstract class AbstractBlock {
    private final int id;
    private AbstractBlock owner;
    private boolean released;

    // package-private: the set of block kinds is closed
    AbstractBlock(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public abstract BlockType getType();

    /** Number of children */
    public abstract int size();

    /** Child at the given position, see the subclasses for the layout */
    public abstract AbstractBlock child(int index);

    /** First basic block executed when control enters this block */
    public abstract BasicBlock entry();

    public abstract <R> R accept(BlockVisitor<R> visitor);

    /** The composite owning this block, null for roots */
    public AbstractBlock getOwner() {
        return owner;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Releases this block and, recursively, every block it owns. Owned blocks cannot be released on
     * their own: they go together with their owner.
     *
     * @throws IllegalStateException if the block is owned or already released
     */
    public final void release() {
        if (owner != null)
            throw new IllegalStateException("block " + id + " is owned by block " + owner.id);
        releaseTree();
    }

    private void releaseTree() {
        checkLive();
        List<AbstractBlock> children = detachChildren();
        released = true;
        for (AbstractBlock child : children) {
            child.owner = null;
            child.releaseTree();
        }
    }

    /** Drops every reference to the children and hands them back, in child order */
    abstract List<AbstractBlock> detachChildren();

    /**
     * Ownership transfer out of a dissolved composite: the children lose their owner and this block
     * becomes a released, empty shell. The children themselves stay live.
     */
    final List<AbstractBlock> dissolve() {
        checkLive();
        List<AbstractBlock> children = detachChildren();
        released = true;
        for (AbstractBlock child : children) child.owner = null;
        return children;
    }

    final void adopt(AbstractBlock child) {
        checkAdoptable(child);
        child.owner = this;
    }

    static void checkAdoptable(AbstractBlock block) {
        if (block == null)
            throw new NullPointerException("block");
        if (block.released)
            throw new IllegalStateException("block " + block.id + " was released");
        if (block.owner != null)
            throw new IllegalStateException("block " + block.id + " is already owned by block " + block.owner.id);
    }

    final void checkLive() {
        if (released) throw new IllegalStateException("block " + id + " was released");
    }

    @Override
    public String toString() {
        return getType() + "#" + id;
    }
}
