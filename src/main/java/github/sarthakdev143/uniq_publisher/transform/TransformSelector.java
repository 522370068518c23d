package github.sarthakdev143.uniq_publisher.transform;

import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import github.sarthakdev143.uniq_publisher.util.Checksums;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.SplittableRandom;

/**
 * Derives the transform for one account from the batch seed and the account's salt.
 *
 * <p>The salt is hashed together with the seed before anything is drawn, so accounts sharing a seed
 * still get unrelated parameters. Knobs are drawn in declaration order; changing that order changes
 * every spec produced for an existing seed.
 */
@Component
public class TransformSelector {

    private final TransformBounds bounds;

    public TransformSelector(TransformBounds bounds) {
        this.bounds = bounds;
    }

    public static String saltFor(AccountTarget target) {
        return target.key();
    }

    public TransformSpec select(long seed, String accountSalt) {
        String salt = accountSalt == null ? "" : accountSalt;
        SplittableRandom random = new SplittableRandom(mix(seed, salt));

        int cropPx = bounds.cropPx().drawInt(random);
        double scaleDelta = bounds.scaleDelta().draw(random);
        double hueShiftDeg = bounds.hueShiftDeg().draw(random);
        int noiseLevel = bounds.noiseLevel().drawInt(random);
        double speedFactor = bounds.speedFactor().draw(random);
        double audioPitchSemitones = bounds.audioPitchSemitones().draw(random);
        double brightness = bounds.brightness().draw(random);
        double contrast = bounds.contrast().draw(random);
        double saturation = bounds.saturation().draw(random);
        double gamma = bounds.gamma().draw(random);
        double bitrateFactor = bounds.bitrateFactor().draw(random);

        return new TransformSpec(
                seed,
                salt,
                cropPx,
                scaleDelta,
                hueShiftDeg,
                noiseLevel,
                speedFactor,
                audioPitchSemitones,
                brightness,
                contrast,
                saturation,
                gamma,
                bitrateFactor);
    }

    public TransformSpec select(long seed, AccountTarget target) {
        return select(seed, saltFor(target));
    }

    /**
     * Fresh spec for the same account, used when an encode of {@code previous} produced unusable output.
     */
    public TransformSpec redraw(TransformSpec previous) {
        return select(previous.seed() + 1, previous.accountSalt());
    }

    public TransformBounds bounds() {
        return bounds;
    }

    static long mix(long seed, String salt) {
        MessageDigest digest = Checksums.newDigest();
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(seed).array());
        digest.update(salt.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(digest.digest()).getLong();
    }
}
