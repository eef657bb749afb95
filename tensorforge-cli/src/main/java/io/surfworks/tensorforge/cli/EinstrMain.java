package io.surfworks.tensorforge.cli;

import io.surfworks.tensorforge.einstr.Einstr;
import io.surfworks.tensorforge.einstr.EinstrException;
import io.surfworks.tensorforge.einstr.EinstrOptions;
import io.surfworks.tensorforge.einstr.Expression;
import io.surfworks.tensorforge.einstr.InputTerm;
import io.surfworks.tensorforge.einstr.OperationFamily;
import io.surfworks.tensorforge.einstr.SplitExpression;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Inspects einsum subscripts: parses, matches and validates them, then prints
 * the canonical expression, fusing groups and, for the fused family, both halves.
 */
public final class EinstrMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private EinstrMain() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return EXIT_OK;
        }

        String subscripts = null;
        int[] ranks = null;
        OperationFamily family = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    printUsage(out);
                    return EXIT_OK;
                }
                case "--json" -> json = true;
                case "--ranks", "--family" -> {
                    if (i + 1 >= args.length) {
                        err.println("Error: " + arg + " requires a value");
                        return EXIT_USAGE;
                    }
                    String value = args[++i];
                    try {
                        if (arg.equals("--ranks")) {
                            ranks = parseRanks(value);
                        } else {
                            family = OperationFamily.fromLabel(value);
                        }
                    } catch (IllegalArgumentException e) {
                        err.println("Error: " + e.getMessage());
                        return EXIT_USAGE;
                    }
                }
                default -> {
                    if (arg.startsWith("--") || subscripts != null) {
                        err.println("Unknown argument: " + arg);
                        printUsage(err);
                        return EXIT_USAGE;
                    }
                    subscripts = arg;
                }
            }
        }

        if (subscripts == null) {
            err.println("Error: missing subscripts");
            return EXIT_USAGE;
        }

        EinstrOptions options;
        try {
            options = EinstrOptions.fromSystemProperties();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        PlanReport report = inspect(subscripts, family, ranks, options);
        if (json) {
            out.println(report.toJson());
        } else if (report.isSuccess()) {
            out.print(report.toText());
        }
        if (!report.isSuccess()) {
            err.println("Error: " + report.error().message());
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    /**
     * Runs the engine over one set of subscripts.
     *
     * @param family the family to validate against, or null to infer it from the term counts
     * @param ranks  operand ranks, or null to give each operand exactly its literal indices
     */
    static PlanReport inspect(String subscripts, OperationFamily family, int[] ranks, EinstrOptions options) {
        try {
            Expression parsed = Einstr.parse(subscripts, options);
            if (family == null) {
                family = inferFamily(parsed);
            }
            int[] operandRanks = ranks != null ? ranks : literalRanks(parsed);
            Expression expr = Einstr.parse(family, subscripts, options, operandRanks);
            SplitExpression split = family == OperationFamily.EINSUMSVD ? Einstr.splitEinsumsvd(expr) : null;
            return PlanReport.of(subscripts, family, toList(operandRanks), expr, split);
        } catch (EinstrException e) {
            return PlanReport.failure(subscripts, family, e);
        }
    }

    /**
     * One output is a contraction; one input with two outputs a decomposition; anything else fused.
     */
    static OperationFamily inferFamily(Expression expr) {
        if (expr.outputs().size() == 1) {
            return OperationFamily.EINSUM;
        }
        if (expr.inputs().size() == 1 && expr.outputs().size() == 2) {
            return OperationFamily.EINSVD;
        }
        return OperationFamily.EINSUMSVD;
    }

    static int[] parseRanks(String value) {
        String[] parts = value.split(",", -1);
        int[] ranks = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                ranks[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid rank '" + parts[i] + "' in --ranks " + value, e);
            }
            if (ranks[i] < 0) {
                throw new IllegalArgumentException("Negative rank in --ranks " + value);
            }
        }
        return ranks;
    }

    private static int[] literalRanks(Expression expr) {
        return expr.inputs().stream().mapToInt(InputTerm::literalCount).toArray();
    }

    private static List<Integer> toList(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int value : values) {
            list.add(value);
        }
        return list;
    }

    private static void printUsage(PrintStream out) {
        out.println("tensorforge-einstr - einsum subscript inspector");
        out.println();
        out.println("Usage: tensorforge-einstr <subscripts> [options]");
        out.println();
        out.println("Options:");
        out.println("  --ranks R1,R2,...     Operand ranks (default: the literal index count of each input)");
        out.println("  --family NAME         einsum, einsvd or einsumsvd (default: inferred from the terms)");
        out.println("  --json                Print the report as JSON");
        out.println("  --help, -h            Print this help message");
        out.println();
        out.println("System properties:");
        out.println("  " + EinstrOptions.MAX_INDICES_PROPERTY);
        out.println("  " + EinstrOptions.BROADCAST_POLICY_PROPERTY);
    }
}
