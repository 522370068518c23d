package github.sarthakdev143.uniq_publisher.transform;

import github.sarthakdev143.uniq_publisher.exception.TransformOutOfBoundsException;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Allowed range for every transform knob. Ranges are kept tight enough that a variant stays
 * perceptually identical to its source.
 */
public record TransformBounds(
        KnobRange cropPx,
        KnobRange scaleDelta,
        KnobRange hueShiftDeg,
        KnobRange noiseLevel,
        KnobRange speedFactor,
        KnobRange audioPitchSemitones,
        KnobRange brightness,
        KnobRange contrast,
        KnobRange saturation,
        KnobRange gamma,
        KnobRange bitrateFactor) {

    public TransformBounds {
        requireRange("cropPx", cropPx);
        requireRange("scaleDelta", scaleDelta);
        requireRange("hueShiftDeg", hueShiftDeg);
        requireRange("noiseLevel", noiseLevel);
        requireRange("speedFactor", speedFactor);
        requireRange("audioPitchSemitones", audioPitchSemitones);
        requireRange("brightness", brightness);
        requireRange("contrast", contrast);
        requireRange("saturation", saturation);
        requireRange("gamma", gamma);
        requireRange("bitrateFactor", bitrateFactor);

        requireInteger("cropPx", cropPx);
        requireInteger("noiseLevel", noiseLevel);
        if (cropPx.min() < 0) {
            throw new IllegalArgumentException("cropPx range must not be negative.");
        }
        if (noiseLevel.min() < 0 || noiseLevel.max() > 100) {
            throw new IllegalArgumentException("noiseLevel range must be within [0, 100].");
        }
        if (scaleDelta.min() <= -1) {
            throw new IllegalArgumentException("scaleDelta range must stay above -1.");
        }
        requirePositive("speedFactor", speedFactor);
        requirePositive("contrast", contrast);
        requirePositive("saturation", saturation);
        requirePositive("gamma", gamma);
        requirePositive("bitrateFactor", bitrateFactor);
    }

    public static TransformBounds defaults() {
        return new TransformBounds(
                new KnobRange(0, 4),
                new KnobRange(-0.01, 0.01),
                new KnobRange(-2, 2),
                new KnobRange(1, 3),
                new KnobRange(0.98, 1.02),
                new KnobRange(-0.3, 0.3),
                new KnobRange(-0.03, 0.03),
                new KnobRange(0.98, 1.02),
                new KnobRange(0.98, 1.02),
                new KnobRange(0.98, 1.02),
                new KnobRange(0.95, 1.05));
    }

    /**
     * Re-checks a spec against these bounds.
     *
     * @throws TransformOutOfBoundsException naming every knob that drifted outside its range
     */
    public void verify(TransformSpec spec) throws TransformOutOfBoundsException {
        List<String> violations = new ArrayList<>();
        check(violations, "cropPx", cropPx, spec.cropPx());
        check(violations, "scaleDelta", scaleDelta, spec.scaleDelta());
        check(violations, "hueShiftDeg", hueShiftDeg, spec.hueShiftDeg());
        check(violations, "noiseLevel", noiseLevel, spec.noiseLevel());
        check(violations, "speedFactor", speedFactor, spec.speedFactor());
        check(violations, "audioPitchSemitones", audioPitchSemitones, spec.audioPitchSemitones());
        check(violations, "brightness", brightness, spec.brightness());
        check(violations, "contrast", contrast, spec.contrast());
        check(violations, "saturation", saturation, spec.saturation());
        check(violations, "gamma", gamma, spec.gamma());
        check(violations, "bitrateFactor", bitrateFactor, spec.bitrateFactor());

        if (!violations.isEmpty()) {
            throw new TransformOutOfBoundsException(
                    "Transform for " + spec.accountSalt() + " is out of bounds: " + String.join(", ", violations));
        }
    }

    private static void check(List<String> violations, String knob, KnobRange range, double value) {
        if (!range.contains(value)) {
            violations.add(String.format(Locale.ROOT, "%s=%.4f not in %s", knob, value, range));
        }
    }

    private static void requireRange(String knob, KnobRange range) {
        if (range == null) {
            throw new IllegalArgumentException("Range for " + knob + " is required.");
        }
    }

    private static void requireInteger(String knob, KnobRange range) {
        if (!range.containsInteger()) {
            throw new IllegalArgumentException(knob + " range " + range + " must contain a whole number.");
        }
    }

    private static void requirePositive(String knob, KnobRange range) {
        if (range.min() <= 0) {
            throw new IllegalArgumentException(knob + " range must be positive.");
        }
    }
}
