package org.blockstruct;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.*;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes one analysed function as JSON: binary info, instruction nodes, basic blocks, the next/cond
 * edges and, when structuring succeeded, the structure tree.
 */
public class JsonExporter {

    public static void export(String function, Analysis analysis, AbstractBlock structure, Path out) throws IOException {
        ObjectMapper om = new ObjectMapper();
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), toJson(om, function, analysis, structure));
    }

    static ObjectNode toJson(ObjectMapper om, String function, Analysis analysis, AbstractBlock structure) {
        ObjectNode root = om.createObjectNode();
        root.put("function", function);
        root.set("info", info(om, analysis.getInfo()));

        ArrayNode nodes = om.createArrayNode();
        for (Instruction ins : analysis.getInstructions()) {
            ObjectNode n = om.createObjectNode();
            n.put("offset", unsigned(ins.getAddress()));
            n.put("mnemonic", ins.getMnemonic());
            n.put("operands", ins.getOperands());
            nodes.add(n);
        }
        root.set("nodes", nodes);

        ArrayNode blocks = om.createArrayNode();
        ArrayNode next = om.createArrayNode();
        ArrayNode cond = om.createArrayNode();
        for (BasicBlock bb : analysis.getBlocks()) {
            ObjectNode b = om.createObjectNode();
            b.put("id", bb.getId());
            b.put("first", unsigned(bb.getFirst().getAddress()));
            b.put("last", unsigned(bb.getLast().getAddress()));
            b.put("instructions", bb.getInstructionCount());
            blocks.add(b);
            if (bb.getNext() != null) next.add(edge(om, bb, bb.getNext()));    // fallthrough
            if (bb.getCond() != null) cond.add(edge(om, bb, bb.getCond()));    // taken branch
        }
        root.set("blocks", blocks);

        ObjectNode edges = om.createObjectNode();
        edges.set("next", next);
        edges.set("cond", cond);
        root.set("edges", edges);

        root.set("structure", structure == null ? NullNode.getInstance() : structure.accept(new TreeWriter(om)));
        return root;
    }

    static ObjectNode info(ObjectMapper om, BinaryInfo info) {
        ObjectNode n = om.createObjectNode();
        n.put("arch", info.getArch().name().toLowerCase(Locale.ROOT));
        n.put("bigEndian", info.isBigEndian());
        n.put("canary", info.hasCanaries());
        n.put("stripped", info.isStripped());
        n.put("bits64", info.is64Bit());
        return n;
    }

    // addresses are unsigned 64-bit
    private static BigInteger unsigned(long address) {
        return new BigInteger(Long.toUnsignedString(address));
    }

    private static ObjectNode edge(ObjectMapper om, BasicBlock src, BasicBlock dst) {
        ObjectNode p = om.createObjectNode();
        p.put("src", src.getId());
        p.put("dst", dst.getId());
        return p;
    }

    /** Structure tree: basic blocks are leaves referring to the "blocks" array by id */
    private static class TreeWriter implements BlockVisitor<ObjectNode> {
        private final ObjectMapper om;

        TreeWriter(ObjectMapper om) {
            this.om = om;
        }

        @Override
        public ObjectNode visitBasic(BasicBlock block) {
            return node(block);
        }

        @Override
        public ObjectNode visitSequence(SequenceBlock block) {
            ObjectNode n = node(block);
            n.set("components", children(block, 0));
            return n;
        }

        @Override
        public ObjectNode visitIfThen(IfThenBlock block) {
            ObjectNode n = node(block);
            n.set("head", block.getHead().accept(this));
            n.set("then", block.getThen().accept(this));
            return n;
        }

        @Override
        public ObjectNode visitIfElse(IfElseBlock block) {
            ObjectNode n = node(block);
            n.set("head", block.getHead().accept(this));
            n.set("then", block.getThen().accept(this));
            n.set("else", block.getElse().accept(this));
            n.set("chain", children(block, 3));
            return n;
        }

        private ObjectNode node(AbstractBlock block) {
            ObjectNode n = om.createObjectNode();
            n.put("type", block.getType().name());
            n.put("id", block.getId());
            return n;
        }

        private ArrayNode children(AbstractBlock block, int from) {
            ArrayNode arr = om.createArrayNode();
            for (int i = from; i < block.size(); i++) arr.add(block.child(i).accept(this));
            return arr;
        }
    }
}
