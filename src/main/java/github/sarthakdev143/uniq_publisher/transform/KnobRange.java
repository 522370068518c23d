package github.sarthakdev143.uniq_publisher.transform;

import java.util.Locale;
import java.util.SplittableRandom;

/**
 * Closed interval a single transform knob is drawn from. {@code min == max} pins the knob.
 */
public record KnobRange(double min, double max) {

    private static final double EPSILON = 1e-9;

    public KnobRange {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Knob range bounds must be finite.");
        }
        if (min > max) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "Knob range min %.4f is greater than max %.4f.", min, max));
        }
    }

    public static KnobRange fixed(double value) {
        return new KnobRange(value, value);
    }

    public boolean isFixed() {
        return min == max;
    }

    public boolean contains(double value) {
        return value >= min - EPSILON && value <= max + EPSILON;
    }

    /**
     * Whether at least one whole number lies inside the range, as integer knobs require.
     */
    public boolean containsInteger() {
        return Math.ceil(min) <= Math.floor(max);
    }

    double draw(SplittableRandom random) {
        if (isFixed()) {
            return min;
        }
        return min + random.nextDouble() * (max - min);
    }

    int drawInt(SplittableRandom random) {
        if (!containsInteger()) {
            throw new IllegalStateException("Knob range " + this + " contains no whole number.");
        }
        int low = (int) Math.ceil(min);
        int high = (int) Math.floor(max);
        if (low == high) {
            return low;
        }
        return random.nextInt(low, high + 1);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%.4f, %.4f]", min, max);
    }
}
