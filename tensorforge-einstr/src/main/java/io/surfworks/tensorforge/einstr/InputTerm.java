package io.surfworks.tensorforge.einstr;

import java.util.List;

/**
 * Subscripts of one operand. Input terms never carry fusing groups.
 */
public record InputTerm(List<Integer> indices, String source) implements Term {

    public InputTerm {
        indices = Term.checkIndices(indices);
        source = source == null ? "" : source;
    }

    public static InputTerm of(List<Integer> indices) {
        InputTerm term = new InputTerm(indices, "");
        return new InputTerm(indices, term.indicesString());
    }

    @Override
    public String toString() {
        return indicesString();
    }
}
