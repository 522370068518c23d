package github.sarthakdev143.uniq_publisher.model;

/**
 * Bounded transformation parameters for one variant. {@code seed} and {@code accountSalt} are kept so
 * the exact spec can be derived again.
 */
public record TransformSpec(
        long seed,
        String accountSalt,
        int cropPx,
        double scaleDelta,
        double hueShiftDeg,
        int noiseLevel,
        double speedFactor,
        double audioPitchSemitones,
        double brightness,
        double contrast,
        double saturation,
        double gamma,
        double bitrateFactor) {
}
