package io.surfworks.tensorforge.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.surfworks.tensorforge.einstr.EinstrException;
import io.surfworks.tensorforge.einstr.Expression;
import io.surfworks.tensorforge.einstr.FusingGroup;
import io.surfworks.tensorforge.einstr.IndexSymbols;
import io.surfworks.tensorforge.einstr.OperationFamily;
import io.surfworks.tensorforge.einstr.OutputTerm;
import io.surfworks.tensorforge.einstr.SplitExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * What the engine made of one set of subscripts: the matched expression, its
 * output terms with their fusing groups, and for the fused family the two halves.
 *
 * <p>Null components are left out of the JSON form.
 */
public record PlanReport(
    String subscripts,
    String family,
    List<Integer> ranks,
    String matched,
    String canonical,
    Integer indexCount,
    List<OutputReport> outputs,
    SplitReport split,
    ErrorReport error
) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * One output term.
     *
     * @param term   canonical text with fusing parentheses
     * @param fusing fused position ranges as {@code [start, end)} pairs
     */
    public record OutputReport(String term, List<List<Integer>> fusing) {
    }

    /**
     * The contraction and decomposition halves of a fused expression.
     */
    public record SplitReport(String contraction, String decomposition, String newIndex) {
    }

    public record ErrorReport(String kind, String message) {
    }

    public PlanReport {
        ranks = ranks == null ? null : List.copyOf(ranks);
        outputs = outputs == null ? null : List.copyOf(outputs);
    }

    /**
     * Builds the report for a matched and validated expression.
     *
     * @param split the halves, or null outside the fused family
     */
    public static PlanReport of(String subscripts, OperationFamily family, List<Integer> ranks,
                                Expression expr, SplitExpression split) {
        List<OutputReport> outputs = new ArrayList<>();
        for (OutputTerm output : expr.outputs()) {
            List<List<Integer>> fusing = new ArrayList<>();
            for (FusingGroup group : output.fusing()) {
                fusing.add(List.of(group.start(), group.end()));
            }
            outputs.add(new OutputReport(output.toString(), fusing));
        }
        SplitReport splitReport = split == null ? null : new SplitReport(
            split.contraction().indicesString(),
            split.decomposition().indicesString(),
            String.valueOf(IndexSymbols.letter(split.newIndex())));
        return new PlanReport(subscripts, family.label(), ranks, expr.toString(), expr.indicesString(),
            expr.nindices(), outputs, splitReport, null);
    }

    public static PlanReport failure(String subscripts, OperationFamily family, EinstrException e) {
        return new PlanReport(subscripts, family == null ? null : family.label(), null, null, null, null, null, null,
            new ErrorReport(e.kind().name(), e.getMessage()));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static PlanReport fromJson(String json) {
        return GSON.fromJson(json, PlanReport.class);
    }

    /**
     * Human-readable form, one field per line.
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        line(sb, "subscripts", subscripts);
        line(sb, "family", family);
        if (error != null) {
            line(sb, "error", error.kind() + ": " + error.message());
            return sb.toString();
        }
        line(sb, "ranks", String.valueOf(ranks));
        line(sb, "matched", matched);
        line(sb, "canonical", canonical);
        line(sb, "indices", String.valueOf(indexCount));
        for (int i = 0; i < outputs.size(); i++) {
            OutputReport output = outputs.get(i);
            String groups = output.fusing().isEmpty() ? "" : "  fused " + output.fusing();
            line(sb, "output " + i, output.term() + groups);
        }
        if (split != null) {
            line(sb, "contraction", split.contraction());
            line(sb, "decomposition", split.decomposition());
            line(sb, "new index", split.newIndex());
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format("%-15s%s%n", label + ":", value));
    }
}
