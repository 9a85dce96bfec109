package org.blockstruct;

/**
 * One decoded instruction: its address and the full "mnemonic operands" text.
 * The mnemonic/operands split happens on the first space, and only when asked for.
 */
public class Instruction {
    public static final Instruction EMPTY = new Instruction();

    private final long address;   // unsigned offset
    private final String text;    // e.g., "mov eax, ebx"
    private int argsAt = -1;      // index of the first space, or text.length() if none

    /** Empty instruction, used as the out-of-bounds sentinel */
    public Instruction() {
        this(0L, "");
    }

    public Instruction(long address, String text) {
        this.address = address;
        this.text = text == null ? "" : text;
    }

    public long getAddress() {
        return address;
    }

    public String getText() {
        return text;
    }

    public String getMnemonic() {
        return text.substring(0, splitPoint());
    }

    public String getOperands() {
        int at = splitPoint();
        if (at >= text.length()) return "";
        return text.substring(at + 1);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public String label() {
        return HexUtils.formatAddress(address) + ": " + text;
    }

    private int splitPoint() {
        if (argsAt < 0) {
            int space = text.indexOf(' ');
            argsAt = space < 0 ? text.length() : space;
        }
        return argsAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        return address == ((Instruction) o).address;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(address);
    }

    @Override
    public String toString() {
        return label();
    }
}
