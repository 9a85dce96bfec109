package org.blockstruct;

import java.util.Locale;

/**
 * Descriptive metadata of the analysed binary. Consumed, never produced, by the analysis.
 */
public class BinaryInfo {

    public enum Arch {
        UNKNOWN, X86, ARM, JVM;

        /** Case-insensitive lookup, e.g. "x86" or "ARM". */
        public static Arch parse(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Arch arch;
    private final boolean bigEndian;
    private final boolean canary;
    private final boolean stripped;
    private final boolean bits64;

    public BinaryInfo() {
        this(Arch.UNKNOWN, false, false, false, false);
    }

    public BinaryInfo(Arch arch, boolean bigEndian, boolean canary, boolean stripped, boolean bits64) {
        this.arch = arch == null ? Arch.UNKNOWN : arch;
        this.bigEndian = bigEndian;
        this.canary = canary;
        this.stripped = stripped;
        this.bits64 = bits64;
    }

    public Arch getArch() { return arch; }

    public boolean isBigEndian() { return bigEndian; }

    public boolean hasCanaries() { return canary; }

    public boolean isStripped() { return stripped; }

    public boolean is64Bit() { return bits64; }

    @Override
    public String toString() {
        return arch.name().toLowerCase(Locale.ROOT) + (bits64 ? "/64" : "/32")
                + (bigEndian ? " BE" : " LE")
                + (canary ? " canary" : "")
                + (stripped ? " stripped" : "");
    }
}
