package org.blockstruct;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class SequenceBlockTest {

    static BasicBlock block(int id) {
        return new BasicBlock(id, List.of(new Instruction(id * 4L, "nop")));
    }

    @Test
    public void twoBasicBlocks() {
        BasicBlock a = block(0);
        BasicBlock b = block(1);
        SequenceBlock seq = new SequenceBlock(2, a, b);
        Assert.assertEquals(BlockType.SEQUENCE, seq.getType());
        Assert.assertEquals(2, seq.size());
        Assert.assertSame(a, seq.child(0));
        Assert.assertSame(b, seq.child(1));
        Assert.assertSame(seq, a.getOwner());
        Assert.assertSame(seq, b.getOwner());
        Assert.assertSame(a, seq.entry());
        Assert.assertNull(seq.getOwner());
    }

    @Test
    public void nestedSequencesAreFlattened() {
        BasicBlock a = block(0), b = block(1), c = block(2), d = block(3), e = block(4);
        SequenceBlock left = new SequenceBlock(5, a, b);
        SequenceBlock right = new SequenceBlock(6, new SequenceBlock(7, c, d), e);
        SequenceBlock seq = new SequenceBlock(8, left, right);

        Assert.assertEquals(5, seq.size());
        Assert.assertEquals(List.of(a, b, c, d, e), seq.getComponents());
        for (AbstractBlock child : seq.getComponents()) {
            Assert.assertSame(seq, child.getOwner());
            Assert.assertEquals(BlockType.BASIC, child.getType());
        }
        Assert.assertTrue(left.isReleased());
        Assert.assertTrue(right.isReleased());
        Assert.assertFalse(seq.isReleased());
        Assert.assertFalse(a.isReleased());
    }

    @Test
    public void onlyOneSideIsASequence() {
        BasicBlock a = block(0), b = block(1), c = block(2);
        SequenceBlock seq = new SequenceBlock(4, a, new SequenceBlock(3, b, c));
        Assert.assertEquals(List.of(a, b, c), seq.getComponents());
    }

    @Test(expected = IllegalStateException.class)
    public void dissolvedSequenceCannotBeRead() {
        SequenceBlock inner = new SequenceBlock(2, block(0), block(1));
        new SequenceBlock(4, inner, block(3));
        inner.size();
    }

    @Test(expected = IllegalArgumentException.class)
    public void sameBlockTwice() {
        BasicBlock a = block(0);
        new SequenceBlock(1, a, a);
    }

    @Test
    public void ownedBlockCannotBeAdopted() {
        BasicBlock a = block(0), b = block(1), c = block(2);
        new SequenceBlock(3, a, b);
        try {
            new SequenceBlock(4, b, c);
            Assert.fail();
        } catch (IllegalStateException expected) {
            Assert.assertNull(c.getOwner());
        }
    }

    @Test
    public void releaseIsRecursive() {
        BasicBlock a = block(0), b = block(1);
        SequenceBlock seq = new SequenceBlock(2, a, b);
        try {
            a.release();
            Assert.fail();
        } catch (IllegalStateException expected) {
            Assert.assertFalse(a.isReleased());
        }
        seq.release();
        Assert.assertTrue(seq.isReleased());
        Assert.assertTrue(a.isReleased());
        Assert.assertTrue(b.isReleased());
        Assert.assertNull(a.getOwner());
    }

    @Test(expected = IllegalStateException.class)
    public void releasedBlockCannotBeAdopted() {
        BasicBlock a = block(0);
        a.release();
        new SequenceBlock(2, a, block(1));
    }

    @Test(expected = IllegalStateException.class)
    public void doubleRelease() {
        BasicBlock a = block(0);
        a.release();
        a.release();
    }

    @Test(expected = NullPointerException.class)
    public void nullComponent() {
        new SequenceBlock(1, block(0), null);
    }
}
