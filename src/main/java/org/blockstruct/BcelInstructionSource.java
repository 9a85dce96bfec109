package org.blockstruct;

import org.apache.bcel.classfile.ClassParser;
import org.apache.bcel.classfile.Code;
import org.apache.bcel.classfile.JavaClass;
import org.apache.bcel.classfile.Method;
import org.apache.bcel.generic.BranchInstruction;
import org.apache.bcel.generic.CPInstruction;
import org.apache.bcel.generic.ConstantPoolGen;
import org.apache.bcel.generic.FieldInstruction;
import org.apache.bcel.generic.InstructionHandle;
import org.apache.bcel.generic.InstructionList;
import org.apache.bcel.generic.InvokeInstruction;
import org.apache.bcel.generic.LocalVariableInstruction;
import org.apache.bcel.generic.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JVM class files as an instruction source: BCEL decodes the Code attribute of each method into
 * {@link Instruction}s, whose address is the bytecode offset.
 * Branch operands are printed as 0x-prefixed target offsets so {@link JvmArchitecture} can resolve them.
 */
public class BcelInstructionSource {
    private static final Logger logger = LoggerFactory.getLogger(BcelInstructionSource.class);

    /** Method signature (name + descriptor) together with its bytecode */
    public static class MethodCode {
        public final String name;    // e.g., "doStuff", "<init>"
        public final String desc;    // e.g., "(I)I"
        final Method method;

        MethodCode(Method method) {
            this.name = method.getName();
            this.desc = method.getSignature();
            this.method = method;
        }

        @Override public String toString() { return name + desc; }

        @Override public boolean equals(Object o) {
            if (!(o instanceof MethodCode)) return false;
            MethodCode m = (MethodCode) o;
            return Objects.equals(name, m.name) && Objects.equals(desc, m.desc);
        }

        @Override public int hashCode() { return Objects.hash(name, desc); }
    }

    private final JavaClass javaClass;
    private final ConstantPoolGen cpg;

    private BcelInstructionSource(JavaClass javaClass) {
        this.javaClass = javaClass;
        this.cpg = new ConstantPoolGen(javaClass.getConstantPool());
    }

    /** Parses a class file; the name is only used in error messages */
    public static BcelInstructionSource scan(InputStream in, String fileName) throws IOException {
        return new BcelInstructionSource(new ClassParser(in, fileName).parse());
    }

    public String getClassName() {
        return javaClass.getClassName();
    }

    /** Methods with a Code attribute; abstract and native ones are skipped */
    public List<MethodCode> getMethods() {
        List<MethodCode> list = new ArrayList<>();
        for (Method m : javaClass.getMethods()) {
            if (m.getCode() == null) continue;
            list.add(new MethodCode(m));
        }
        return list;
    }

    public MethodCode findMethod(String name, String desc) {
        for (MethodCode m : getMethods()) {
            if (m.name.equals(name) && m.desc.equals(desc)) return m;
        }
        throw new IllegalArgumentException("cannot find method : " + name + desc);
    }

    public List<Instruction> disassemble(MethodCode method) {
        Code code = method.method.getCode();
        InstructionList il = new InstructionList(code.getCode());
        List<Instruction> out = new ArrayList<>(il.getLength());
        for (InstructionHandle ih : il.getInstructionHandles()) {
            org.apache.bcel.generic.Instruction inst = ih.getInstruction();
            String ops = operandsToString(inst);
            String text = ops.isEmpty() ? inst.getName() : inst.getName() + " " + ops;
            out.add(new Instruction(ih.getPosition(), text));
        }
        return out;
    }

    private String operandsToString(org.apache.bcel.generic.Instruction inst) {
        if (inst instanceof Select) {
            Select sel = (Select) inst;
            StringBuilder sb = new StringBuilder();
            for (InstructionHandle t : sel.getTargets()) {
                sb.append(HexUtils.formatAddress(t.getPosition())).append(' ');
            }
            return sb.append("default ").append(HexUtils.formatAddress(sel.getTarget().getPosition())).toString();
        }
        if (inst instanceof BranchInstruction) {
            return HexUtils.formatAddress(((BranchInstruction) inst).getTarget().getPosition());
        }
        if (inst instanceof CPInstruction) {
            try {
                if (inst instanceof InvokeInstruction) {
                    InvokeInstruction ci = (InvokeInstruction) inst;
                    return ci.getReferenceType(cpg) + "." + ci.getMethodName(cpg) + ci.getSignature(cpg);
                }
                if (inst instanceof FieldInstruction) {
                    FieldInstruction fi = (FieldInstruction) inst;
                    return fi.getReferenceType(cpg) + "." + fi.getFieldName(cpg);
                }
            } catch (RuntimeException e) {
                // invokedynamic has no owning class: fall back to the pool index
                logger.debug("no symbolic operand for {}: {}", inst.getName(), e.getMessage());
            }
            return "#" + ((CPInstruction) inst).getIndex();
        }
        if (inst instanceof LocalVariableInstruction && !inst.getName().contains("_")) {
            // iload_0 and friends already carry their index
            return String.valueOf(((LocalVariableInstruction) inst).getIndex());
        }
        return "";
    }
}
