package org.blockstruct;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.InputStream;
import java.util.List;

public class BcelInstructionSourceTest {
    private BcelInstructionSource source;
    private final ControlFlowStructurer structurer = new ControlFlowStructurer();

    @Before
    public void scanFixture() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/org/blockstruct/fixtures/Branchy.class")) {
            Assert.assertNotNull("fixture class not on the test classpath", in);
            source = BcelInstructionSource.scan(in, "Branchy.class");
        }
    }

    private Analysis analyse(String name, String desc) {
        return new Analysis(source.disassemble(source.findMethod(name, desc)), AnalysisRunner.JVM_INFO);
    }

    @Test
    public void methods() {
        Assert.assertEquals("org.blockstruct.fixtures.Branchy", source.getClassName());
        Assert.assertTrue(source.getMethods().stream().anyMatch(m -> m.name.equals("<init>")));
        Assert.assertEquals("add(II)I", source.findMethod("add", "(II)I").toString());
        Assert.assertEquals("add(JJ)J", source.findMethod("add", "(JJ)J").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingMethod() {
        source.findMethod("add", "(DD)D");
    }

    @Test
    public void straightLineMethod() throws Exception {
        List<Instruction> body = source.disassemble(source.findMethod("add", "(II)I"));
        Assert.assertEquals(4, body.size());
        Assert.assertEquals("iload_0", body.get(0).getText());
        Assert.assertEquals("iadd", body.get(2).getMnemonic());
        Assert.assertEquals("ireturn", body.get(3).getMnemonic());
        Assert.assertEquals(0, body.get(0).getAddress());

        Analysis analysis = new Analysis(body, AnalysisRunner.JVM_INFO);
        Assert.assertEquals(1, analysis.getBlocks().size());
        Assert.assertSame(analysis.cfg(), structurer.structure(analysis));
    }

    @Test
    public void branchOperandsAreOffsets() {
        List<Instruction> body = source.disassemble(source.findMethod("clamp", "(I)I"));
        Assert.assertEquals("ifge 0x6", body.get(1).getText());
        Assert.assertEquals(6, body.get(4).getAddress());
    }

    @Test
    public void ifThen() throws Exception {
        AbstractBlock tree = structurer.structure(analyse("clamp", "(I)I"));
        Assert.assertEquals(BlockType.SEQUENCE, tree.getType());
        Assert.assertEquals(2, tree.size());
        Assert.assertEquals(BlockType.IF_THEN, tree.child(0).getType());
        Assert.assertEquals(BlockType.BASIC, tree.child(1).getType());
    }

    @Test
    public void ifElse() throws Exception {
        AbstractBlock tree = structurer.structure(analyse("sign", "(I)I"));
        Assert.assertEquals(BlockType.IF_ELSE, tree.getType());
        Assert.assertEquals(3, tree.size());
    }

    @Test(expected = UnstructurableRegionException.class)
    public void loop() throws Exception {
        structurer.structure(analyse("sum", "(I)I"));
    }
}
