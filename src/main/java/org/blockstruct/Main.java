package org.blockstruct;

import java.nio.file.*;
import java.io.IOException;
import java.util.*;
import java.util.stream.Collectors;

public class Main {
    private static final String USAGE =
            "Usage: java -jar blockstruct.jar <function-file|class-file|dir> "
                    + "[--arch x86|arm|jvm] [--64] [--big-endian] [--canary] [--stripped] [--out dir]";

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println(USAGE);
            System.exit(1);
        }

        // 1) options
        BinaryInfo.Arch arch = BinaryInfo.Arch.X86;
        boolean bits64 = false, bigEndian = false, canary = false, stripped = false;
        Path outDir = Paths.get("out");
        String inputArg = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--arch":
                    if (i + 1 >= args.length) usage("--arch needs a value");
                    try {
                        arch = BinaryInfo.Arch.parse(args[++i]);
                    } catch (IllegalArgumentException e) {
                        usage("unknown architecture: " + args[i]);
                    }
                    break;
                case "--64": bits64 = true; break;
                case "--big-endian": bigEndian = true; break;
                case "--canary": canary = true; break;
                case "--stripped": stripped = true; break;
                case "--out":
                    if (i + 1 >= args.length) usage("--out needs a value");
                    outDir = Paths.get(args[++i]);
                    break;
                default:
                    if (args[i].startsWith("--") || inputArg != null) usage("unexpected argument: " + args[i]);
                    inputArg = args[i];
            }
        }
        if (inputArg == null) usage("missing input");

        // 2) input: a single file or a directory walked for .class/.txt files
        Path input = Paths.get(inputArg).toAbsolutePath();
        if (!Files.exists(input)) {
            System.err.println("Input not found: " + input);
            System.exit(2);
        }
        List<Path> files = collectInputs(input);

        // 3) run
        Diagnosis diagnosis = new Diagnosis();
        AnalysisRunner runner = new AnalysisRunner(new BinaryInfo(arch, bigEndian, canary, stripped, bits64), outDir, diagnosis);
        runner.run(files);
        if (diagnosis.hasSuggestions()) diagnosis.printReport();
    }

    static List<Path> collectInputs(Path input) throws IOException {
        if (!Files.isDirectory(input)) return List.of(input);
        try (var stream = Files.walk(input)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".class") || p.toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static void usage(String problem) {
        System.err.println(problem);
        System.err.println(USAGE);
        System.exit(1);
    }
}
