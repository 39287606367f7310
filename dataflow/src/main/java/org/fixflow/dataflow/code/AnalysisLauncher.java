package org.fixflow.dataflow.code;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.fixflow.dataflow.constantpropagation.ConstantPropagation;
import org.fixflow.dataflow.livevariable.LiveVariableAnalysis;
import org.fixflow.dataflow.util.UserError;

/** Runs one of the bundled analyses on a listing and prints the state at every instruction. */
public class AnalysisLauncher {

    /** Main method. */
    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }
        Path input = Paths.get(args[0]);
        if (!Files.isReadable(input)) {
            printError("Cannot read input file: " + input.toAbsolutePath());
            printUsage();
            System.exit(1);
        }

        String analysis = "constant";
        boolean error = false;
        boolean verbose = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "-analysis":
                    if (i >= args.length - 1) {
                        printError("Did not find <name> after -analysis.");
                        error = true;
                        continue;
                    }
                    i++;
                    analysis = args[i];
                    break;
                case "-verbose":
                    verbose = true;
                    break;
                default:
                    printError("Unknown command line argument: " + args[i]);
                    error = true;
                    break;
            }
        }

        if (error) {
            System.exit(1);
        }

        try {
            CodeEditor code = InstructionParser.parse(input);
            System.out.print(generateStringOfListing(code, analysis, verbose));
        } catch (IOException e) {
            printError("Cannot read input file: " + e.getMessage());
            System.exit(1);
        } catch (UserError e) {
            printError(e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Runs an analysis on the code and lists the code with the state at every instruction.
     *
     * @param code the code
     * @param analysis {@code constant} for constant propagation (states after each instruction)
     *     or {@code liveness} for live variables (states before each instruction)
     * @param verbose also list unreached instructions
     * @return the listing
     * @throws UserError if the analysis name is unknown
     */
    public static String generateStringOfListing(
            CodeEditor code, String analysis, boolean verbose) {
        Map<String, Object> args = new HashMap<>();
        args.put("verbose", verbose);

        StringStateVisualizer viz = new StringStateVisualizer();
        viz.init(args);
        Map<String, Object> res;
        switch (analysis) {
            case "constant":
                ConstantPropagation constants = new ConstantPropagation();
                constants.analyze(code);
                res = viz.visualize(code, constants::getStateAfter, constants.getFinalState());
                break;
            case "liveness":
                LiveVariableAnalysis liveness = new LiveVariableAnalysis();
                liveness.analyze(code);
                res =
                        viz.visualize(
                                code,
                                liveness::liveVariablesBefore,
                                liveness.liveVariablesAtEntry());
                break;
            default:
                throw new UserError(
                        "Unknown analysis: %s (expected constant or liveness)", analysis);
        }
        return (String) res.get(StringStateVisualizer.STRING_LISTING);
    }

    /**
     * Print error message.
     *
     * @param string error message
     */
    public static void printError(String string) {
        System.err.println("ERROR: " + string);
    }

    /** Print usage information. */
    private static void printUsage() {
        System.out.println(
                "Run a dataflow analysis on a listing and print the state at every instruction.");
        System.out.println("Parameters: <listing> [-analysis constant|liveness] [-verbose]");
        System.out.println(
                "    -analysis: constant propagation or live variables (defaults to 'constant').");
        System.out.println(
                "    -verbose:  Also list unreachable instructions (defaults to 'false').");
    }
}
