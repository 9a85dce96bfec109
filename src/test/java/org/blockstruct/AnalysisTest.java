package org.blockstruct;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class AnalysisTest {
    static final BinaryInfo X86 = new BinaryInfo(BinaryInfo.Arch.X86, false, false, false, false);
    static final BinaryInfo ARM = new BinaryInfo(BinaryInfo.Arch.ARM, false, false, false, false);

    static final String IF_THEN = "main\n"
            + "0x0 push ebp\n"
            + "0x1 cmp eax, 0\n"
            + "0x4 je 0x9\n"
            + "0x6 mov eax, 1\n"
            + "0x9 pop ebp\n"
            + "0xa ret\n";

    @Test
    public void indexingIsByPosition() throws Exception {
        Analysis analysis = new Analysis("f\n0x10 nop\n0x11 nop\n0x12 ret", X86);
        Assert.assertEquals(3, analysis.size());
        Assert.assertEquals(0x10, analysis.get(0).getAddress());
        Assert.assertEquals(0x12, analysis.get(2).getAddress());
        Assert.assertSame(Instruction.EMPTY, analysis.get(3));
        Assert.assertSame(Instruction.EMPTY, analysis.get(-1));
        Assert.assertEquals(1, analysis.indexOf(0x11));
        Assert.assertEquals(-1, analysis.indexOf(0x13));
    }

    @Test
    public void hexAndDecimalOffsetsAgree() throws Exception {
        Assert.assertEquals(16, new Analysis("f\n0x10 ret", X86).get(0).getAddress());
        Assert.assertEquals(16, new Analysis("f\n16 ret", X86).get(0).getAddress());
    }

    @Test(expected = InstructionParseException.class)
    public void parseErrorsPropagate() throws Exception {
        new Analysis("f\nnot-an-offset ret", X86);
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateAddresses() throws Exception {
        new Analysis("f\n0x10 nop\n16 ret", X86);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownArchitecture() throws Exception {
        new Analysis("f\n0x0 ret", new BinaryInfo());
    }

    @Test
    public void emptyFunction() throws Exception {
        Analysis analysis = new Analysis("f", X86);
        Assert.assertEquals(0, analysis.size());
        Assert.assertNull(analysis.cfg());
        Assert.assertTrue(analysis.getBlocks().isEmpty());
    }

    @Test
    public void straightLineIsOneBlock() throws Exception {
        Analysis analysis = new Analysis("f\n0x0 push ebp\n0x1 mov ebp, esp\n0x3 pop ebp\n0x4 ret", X86);
        Assert.assertEquals(1, analysis.getBlocks().size());
        BasicBlock block = analysis.cfg();
        Assert.assertEquals(4, block.getInstructionCount());
        Assert.assertNull(block.getNext());
        Assert.assertNull(block.getCond());
    }

    @Test
    public void conditionalBranchSplitsBlocks() throws Exception {
        Analysis analysis = new Analysis(IF_THEN, X86);
        List<BasicBlock> blocks = analysis.getBlocks();
        Assert.assertEquals(3, blocks.size());

        BasicBlock head = analysis.cfg();
        Assert.assertSame(blocks.get(0), head);
        Assert.assertEquals(0x4, head.getLast().getAddress());
        Assert.assertSame(blocks.get(1), head.getNext());
        Assert.assertSame(blocks.get(2), head.getCond());

        Assert.assertEquals(0x6, blocks.get(1).getFirst().getAddress());
        Assert.assertSame(blocks.get(2), blocks.get(1).getNext());
        Assert.assertNull(blocks.get(1).getCond());

        Assert.assertEquals(2, blocks.get(2).getInstructionCount());
        Assert.assertNull(blocks.get(2).getNext());
        Assert.assertNull(blocks.get(2).getCond());
        for (int i = 0; i < blocks.size(); i++) Assert.assertEquals(i, blocks.get(i).getId());
    }

    @Test
    public void unconditionalJumpOnlyHasNext() throws Exception {
        Analysis analysis = new Analysis("f\n0x0 jmp 0x3\n0x2 nop\n0x3 ret", X86);
        List<BasicBlock> blocks = analysis.getBlocks();
        Assert.assertEquals(3, blocks.size());
        Assert.assertSame(blocks.get(2), blocks.get(0).getNext());
        Assert.assertNull(blocks.get(0).getCond());
        Assert.assertSame(blocks.get(2), blocks.get(1).getNext());
    }

    @Test
    public void conditionalToFallthroughKeepsOneEdge() throws Exception {
        Analysis analysis = new Analysis("f\n0x0 jne 0x2\n0x2 ret", X86);
        BasicBlock head = analysis.cfg();
        Assert.assertSame(analysis.getBlocks().get(1), head.getNext());
        Assert.assertNull(head.getCond());
    }

    @Test
    public void branchOutsideTheFunctionHasNoEdge() throws Exception {
        Analysis analysis = new Analysis("f\n0x0 je 0x100\n0x2 nop\n0x3 jmp 0x200", X86);
        List<BasicBlock> blocks = analysis.getBlocks();
        Assert.assertEquals(2, blocks.size());
        Assert.assertSame(blocks.get(1), blocks.get(0).getNext());
        Assert.assertNull(blocks.get(0).getCond());
        Assert.assertNull(blocks.get(1).getNext());
    }

    @Test
    public void armBranches() throws Exception {
        Analysis analysis = new Analysis("f\n"
                + "0x0 cmp r0, #0\n"
                + "0x4 beq 0xc\n"
                + "0x8 mov r0, #1\n"
                + "0xc bx lr\n", ARM);
        List<BasicBlock> blocks = analysis.getBlocks();
        Assert.assertEquals(3, blocks.size());
        Assert.assertSame(blocks.get(1), blocks.get(0).getNext());
        Assert.assertSame(blocks.get(2), blocks.get(0).getCond());
        Assert.assertNull(blocks.get(2).getNext());
    }

    @Test
    public void armSymbolizedTargets() throws Exception {
        for (String branch : new String[]{"beq 0xc <f+0xc>", "cbz r0, 0xc <f+0xc>"}) {
            Analysis analysis = new Analysis("f\n"
                    + "0x0 cmp r0, #0\n"
                    + "0x4 " + branch + "\n"
                    + "0x8 mov r0, #1\n"
                    + "0xc bx lr\n", ARM);
            List<BasicBlock> blocks = analysis.getBlocks();
            Assert.assertEquals(branch, 3, blocks.size());
            Assert.assertSame(branch, blocks.get(2), blocks.get(0).getCond());
        }
    }

    @Test
    public void instructionListConstructor() {
        List<Instruction> body = Arrays.asList(
                new Instruction(0, "iload_0"),
                new Instruction(1, "ifge 0x6"),
                new Instruction(4, "iconst_0"),
                new Instruction(5, "istore_0"),
                new Instruction(6, "iload_0"),
                new Instruction(7, "ireturn"));
        Analysis analysis = new Analysis(body, AnalysisRunner.JVM_INFO);
        Assert.assertEquals(3, analysis.getBlocks().size());
        Assert.assertEquals(BinaryInfo.Arch.JVM, analysis.getArchitecture().getId());
        Assert.assertSame(AnalysisRunner.JVM_INFO, analysis.getInfo());
    }
}
