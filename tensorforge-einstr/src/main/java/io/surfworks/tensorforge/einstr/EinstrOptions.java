package io.surfworks.tensorforge.einstr;

import java.util.Locale;

/**
 * Engine configuration.
 *
 * @param maxIndices      size of the symbol alphabet; expressions with more distinct indices are rejected
 * @param broadcastPolicy how ellipsis runs of different input terms are reconciled
 */
public record EinstrOptions(int maxIndices, BroadcastPolicy broadcastPolicy) {

    public static final String MAX_INDICES_PROPERTY = "tensorforge.einstr.maxIndices";
    public static final String BROADCAST_POLICY_PROPERTY = "tensorforge.einstr.broadcastPolicy";

    private static final EinstrOptions DEFAULTS =
        new EinstrOptions(IndexSymbols.ALPHABET.length(), BroadcastPolicy.LONGEST_RUN);

    /**
     * Reconciliation of ellipsis runs across input terms.
     */
    public enum BroadcastPolicy {
        /** Output ellipses take the longest input run; other runs may differ in length */
        LONGEST_RUN,
        /** Every ellipsis-bearing input must expand to a run of the same length */
        EQUAL_RUNS
    }

    public EinstrOptions {
        if (maxIndices < 1 || maxIndices > IndexSymbols.ALPHABET.length()) {
            throw new IllegalArgumentException(
                "maxIndices must be between 1 and " + IndexSymbols.ALPHABET.length() + ", got " + maxIndices);
        }
        if (broadcastPolicy == null) {
            throw new IllegalArgumentException("broadcastPolicy must not be null");
        }
    }

    public static EinstrOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from system properties, falling back to the defaults for unset keys.
     *
     * @throws IllegalArgumentException if a property is set to an unparseable value
     */
    public static EinstrOptions fromSystemProperties() {
        Builder builder = builder();
        String maxIndices = System.getProperty(MAX_INDICES_PROPERTY);
        if (maxIndices != null) {
            try {
                builder.maxIndices(Integer.parseInt(maxIndices.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + MAX_INDICES_PROPERTY + ": " + maxIndices, e);
            }
        }
        String policy = System.getProperty(BROADCAST_POLICY_PROPERTY);
        if (policy != null) {
            builder.broadcastPolicy(BroadcastPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxIndices = DEFAULTS.maxIndices();
        private BroadcastPolicy broadcastPolicy = DEFAULTS.broadcastPolicy();

        public Builder maxIndices(int maxIndices) {
            this.maxIndices = maxIndices;
            return this;
        }

        public Builder broadcastPolicy(BroadcastPolicy broadcastPolicy) {
            this.broadcastPolicy = broadcastPolicy;
            return this;
        }

        public EinstrOptions build() {
            return new EinstrOptions(maxIndices, broadcastPolicy);
        }
    }
}
