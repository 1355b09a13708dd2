package com.example.canonical.ingestion.schema;

/**
 * Closed interval {@code [low, high]}.
 */
public record NumericRange(double low, double high) {

    public NumericRange {
        if (Double.isNaN(low) || Double.isNaN(high) || low > high) {
            throw new IllegalArgumentException("Invalid range [%s, %s]".formatted(low, high));
        }
    }

    public static NumericRange of(double low, double high) {
        return new NumericRange(low, high);
    }

    public boolean contains(double value) {
        return value >= low && value <= high;
    }

    public double clamp(double value) {
        return Math.max(low, Math.min(value, high));
    }

    @Override
    public String toString() {
        return "[" + format(low) + ", " + format(high) + "]";
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
}
