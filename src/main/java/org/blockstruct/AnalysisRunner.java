package org.blockstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the analysis over a batch of input files and exports one JSON file per function.
 * Function text files use the configured binary info; class files are always JVM bytecode.
 */
public class AnalysisRunner {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisRunner.class);
    static final BinaryInfo JVM_INFO = new BinaryInfo(BinaryInfo.Arch.JVM, true, false, false, false);

    private final BinaryInfo info;
    private final Path outDir;
    private final Diagnosis diagnosis;
    private final ControlFlowStructurer structurer = new ControlFlowStructurer();

    private int successCount;
    private int unstructuredCount;
    private int failCount;

    public AnalysisRunner(BinaryInfo info, Path outDir, Diagnosis diagnosis) {
        this.info = info;
        this.outDir = outDir;
        this.diagnosis = diagnosis;
    }

    /** @return number of functions that were fully structured */
    public int run(List<Path> files) throws IOException {
        Files.createDirectories(outDir);
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (fileName.endsWith(".class")) {
                runClassFile(file);
            } else {
                runFunctionText(file);
            }
        }

        System.out.println("\n" + "=".repeat(40));
        System.out.println(">>> Analysis Finished Summary");
        System.out.println("  - Success      : " + successCount);
        System.out.println("  - Unstructured : " + unstructuredCount);
        System.out.println("  - Fail         : " + failCount);
        System.out.println("=".repeat(40));
        return successCount;
    }

    private void runFunctionText(Path file) {
        String fileName = file.getFileName().toString();
        String name = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        try {
            String text = Files.readString(file);
            String header = FunctionTextParser.header(text);
            if (!header.isEmpty() && !header.contains(" ")) name = header.replace(":", "");
            analyze(name, new Analysis(text, info));
        } catch (InstructionParseException e) {
            failCount++;
            diagnosis.addParseFailure(name, e);
            System.out.println("[RESULT] FAIL         : " + name + " ( " + e.getMessage() + " )");
        } catch (Exception e) {
            fail(name, e);
        }
    }

    private void runClassFile(Path file) {
        BcelInstructionSource source;
        try (InputStream in = Files.newInputStream(file)) {
            source = BcelInstructionSource.scan(in, file.toString());
        } catch (Exception e) {
            fail(file.getFileName().toString(), e);
            return;
        }
        for (BcelInstructionSource.MethodCode method : source.getMethods()) {
            String name = source.getClassName() + "." + method.name + method.desc;   // overloads differ by descriptor
            try {
                analyze(name, new Analysis(source.disassemble(method), JVM_INFO));
            } catch (Exception e) {
                fail(name, e);
            }
        }
    }

    private void analyze(String name, Analysis analysis) throws IOException {
        AbstractBlock tree = null;
        try {
            tree = structurer.structure(analysis);
        } catch (UnstructurableRegionException e) {
            diagnosis.addUnstructured(name, e);
        }

        String safeFileName = name.replace("<", "").replace(">", "").replaceAll("[^A-Za-z0-9._$-]", "_") + ".json";
        JsonExporter.export(name, analysis, tree, outDir.resolve(safeFileName));

        if (tree != null || analysis.size() == 0) {
            successCount++;
            System.out.println("[RESULT] SUCCESS      : " + name);
        } else {
            unstructuredCount++;
            System.out.println("[RESULT] UNSTRUCTURED : " + name + " ( " + diagnosis.getUnstructured().get(name) + " regions left )");
        }
    }

    private void fail(String name, Exception e) {
        failCount++;
        diagnosis.addFailure(name, e);
        logger.debug("analysis of {} failed", name, e);
        System.out.println("[RESULT] FAIL         : " + name + " ( Error: " + e.getMessage() + " )");
    }

    public int getSuccessCount() { return successCount; }

    public int getUnstructuredCount() { return unstructuredCount; }

    public int getFailCount() { return failCount; }
}
