package org.blockstruct;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects what went wrong during a batch run and explains it at the end.
 */
public class Diagnosis {
    private final Map<String, String> parseFailures = new LinkedHashMap<>();   // function -> reason
    private final Map<String, Integer> unstructured = new LinkedHashMap<>();   // function -> regions left
    private final Map<String, String> otherFailures = new LinkedHashMap<>();   // function -> reason

    public void addParseFailure(String function, InstructionParseException e) {
        parseFailures.put(function, e.getMessage());
    }

    public void addUnstructured(String function, UnstructurableRegionException e) {
        unstructured.put(function, e.getRegions().size());
    }

    public void addFailure(String function, Exception e) {
        otherFailures.put(function, e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    public boolean hasSuggestions() {
        return !parseFailures.isEmpty() || !unstructured.isEmpty() || !otherFailures.isEmpty();
    }

    public Map<String, String> getParseFailures() { return parseFailures; }

    public Map<String, Integer> getUnstructured() { return unstructured; }

    public Map<String, String> getOtherFailures() { return otherFailures; }

    public void printReport() {
        System.out.println("\n" + "=".repeat(20) + " DIAGNOSIS REPORT " + "=".repeat(20));

        if (!parseFailures.isEmpty()) {
            System.out.println("[Input Format Issue]");
            System.out.println("  - The following functions could not be parsed:");
            for (Map.Entry<String, String> e : parseFailures.entrySet()) {
                System.out.println("    * " + e.getKey() + " : " + e.getValue());
            }
            System.out.println("  - Action: every line after the header must be '<offset> <instruction>',");
            System.out.println("    with the offset in decimal or 0x-prefixed hex.");
        }

        if (!unstructured.isEmpty()) {
            System.out.println("\n[Structuring Issue]");
            System.out.println("  - The following functions were exported as plain control flow graphs:");
            for (Map.Entry<String, Integer> e : unstructured.entrySet()) {
                System.out.println("    * " + e.getKey() + " (" + e.getValue() + " regions left)");
            }
            System.out.println("  - Note: loops and crossing branches are not structured.");
        }

        if (!otherFailures.isEmpty()) {
            System.out.println("\n[Analysis Failure]");
            for (Map.Entry<String, String> e : otherFailures.entrySet()) {
                System.out.println("    * " + e.getKey() + " : " + e.getValue());
            }
        }

        if (!hasSuggestions()) {
            System.out.println("No parse or structuring issues identified.");
        }

        System.out.println("=".repeat(58) + "\n");
    }
}
