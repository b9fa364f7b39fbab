package com.bayesenum.server.ai.inference.trace;

import java.util.Locale;

/**
 * One step of an enumeration run. {@code depth} is the recursion depth (0 for
 * events about the query variable itself).
 */
public final class EnumerationTraceEvent {

    public enum Type {
        /** A trial value of the query variable is being scored. */
        QUERY_VALUE,
        /** A bound variable (evidence or the trial query value) contributes its CPT factor. */
        OBSERVED,
        /** A hidden variable is about to be summed out. */
        HIDDEN,
        /** One value of a hidden variable, with its CPT factor. */
        HIDDEN_VALUE,
        /** Product of a hidden value's factor and everything below it. */
        HIDDEN_SUBTOTAL,
        /** Sum over all values of a hidden variable. */
        HIDDEN_TOTAL,
        /** Raw score of one query value before normalization. */
        UNNORMALIZED,
        /** Posterior of one query value. */
        NORMALIZED
    }

    private final Type type;
    private final int depth;
    private final String variable;
    private final String value;
    private final double amount;

    public EnumerationTraceEvent(Type type, int depth, String variable, String value, double amount) {
        this.type = type;
        this.depth = depth;
        this.variable = variable;
        this.value = value;
        this.amount = amount;
    }

    public Type getType() {
        return type;
    }

    public int getDepth() {
        return depth;
    }

    public String getVariable() {
        return variable;
    }

    /** The value involved, or null for {@link Type#HIDDEN} and {@link Type#HIDDEN_TOTAL}. */
    public String getValue() {
        return value;
    }

    /** Probability factor, partial product or sum, depending on the type. */
    public double getAmount() {
        return amount;
    }

    /** Human-readable line without indentation. */
    public String describe() {
        switch (type) {
            case QUERY_VALUE:
                return "--- Scoring " + variable + "=" + value + " ---";
            case OBSERVED:
                return String.format(Locale.ROOT, "%s observed = %s, P(%s=%s | parents) = %.6f",
                        variable, value, variable, value, amount);
            case HIDDEN:
                return variable + " hidden, summing over its values";
            case HIDDEN_VALUE:
                return String.format(Locale.ROOT, "  trying %s=%s, P = %.6f", variable, value, amount);
            case HIDDEN_SUBTOTAL:
                return String.format(Locale.ROOT, "  subtotal for %s=%s: %.6f", variable, value, amount);
            case HIDDEN_TOTAL:
                return String.format(Locale.ROOT, "total for %s: %.6f", variable, amount);
            case UNNORMALIZED:
                return String.format(Locale.ROOT, "unnormalized score for %s=%s: %.6f", variable, value, amount);
            case NORMALIZED:
                return String.format(Locale.ROOT, "P(%s=%s | evidence) = %.6f", variable, value, amount);
            default:
                throw new IllegalStateException("Unhandled trace event type " + type);
        }
    }

    /** {@link #describe()} indented by two spaces per depth level. */
    public String indented() {
        return "  ".repeat(depth) + describe();
    }

    @Override
    public String toString() {
        return "EnumerationTraceEvent{" + type + ", depth=" + depth + ", " + variable
                + (value != null ? "=" + value : "") + ", amount=" + amount + '}';
    }
}
