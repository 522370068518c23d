package github.sarthakdev143.uniq_publisher.transform;

import github.sarthakdev143.uniq_publisher.model.AccountTarget;
import github.sarthakdev143.uniq_publisher.model.AccountType;
import github.sarthakdev143.uniq_publisher.model.Platform;
import github.sarthakdev143.uniq_publisher.model.TransformSpec;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TransformSelectorTest {

    private final TransformBounds bounds = TransformBounds.defaults();
    private final TransformSelector selector = new TransformSelector(bounds);

    @Test
    void selectIsDeterministicForSameSeedAndSalt() {
        TransformSpec first = selector.select(42L, "vk:123");
        TransformSpec second = selector.select(42L, "vk:123");

        assertThat(second).isEqualTo(first);
    }

    @Test
    void selectGivesDifferentSpecsForDifferentSalts() {
        Set<TransformSpec> specs = new HashSet<>();
        for (int account = 0; account < 50; account++) {
            TransformSpec spec = selector.select(42L, "vk:" + account);
            specs.add(new TransformSpec(
                    0L,
                    "",
                    spec.cropPx(),
                    spec.scaleDelta(),
                    spec.hueShiftDeg(),
                    spec.noiseLevel(),
                    spec.speedFactor(),
                    spec.audioPitchSemitones(),
                    spec.brightness(),
                    spec.contrast(),
                    spec.saturation(),
                    spec.gamma(),
                    spec.bitrateFactor()));
        }

        assertThat(specs).hasSize(50);
    }

    @Test
    void selectedValuesStayWithinBounds() {
        for (long seed = 0; seed < 500; seed++) {
            TransformSpec spec = selector.select(seed, "io:acc-" + seed);
            assertThatCode(() -> bounds.verify(spec)).doesNotThrowAnyException();
        }
    }

    @Test
    void fixedRangesYieldTheirSingleValue() {
        TransformBounds pinned = new TransformBounds(
                KnobRange.fixed(2),
                KnobRange.fixed(0),
                KnobRange.fixed(1.5),
                KnobRange.fixed(3),
                KnobRange.fixed(1.0),
                KnobRange.fixed(0),
                KnobRange.fixed(0.01),
                KnobRange.fixed(1.0),
                KnobRange.fixed(1.0),
                KnobRange.fixed(1.0),
                KnobRange.fixed(1.02));

        TransformSpec spec = new TransformSelector(pinned).select(7L, "pi:board");

        assertThat(spec.cropPx()).isEqualTo(2);
        assertThat(spec.hueShiftDeg()).isEqualTo(1.5);
        assertThat(spec.noiseLevel()).isEqualTo(3);
        assertThat(spec.brightness()).isEqualTo(0.01);
        assertThat(spec.bitrateFactor()).isEqualTo(1.02);
    }

    @Test
    void redrawReseedsWithNextSeedForSameAccount() {
        TransformSpec original = selector.select(100L, "gg:channel");

        TransformSpec redrawn = selector.redraw(original);

        assertThat(redrawn.seed()).isEqualTo(101L);
        assertThat(redrawn.accountSalt()).isEqualTo("gg:channel");
        assertThat(redrawn).isEqualTo(selector.select(101L, "gg:channel"));
        assertThat(redrawn).isNotEqualTo(original);
    }

    @Test
    void saltIsPlatformCodeAndAccountId() {
        AccountTarget target = new AccountTarget("555", Platform.INSTAGRAM, AccountType.PAGE);

        assertThat(TransformSelector.saltFor(target)).isEqualTo("io:555");
        assertThat(selector.select(9L, target)).isEqualTo(selector.select(9L, "io:555"));
    }

    @Test
    void saltChangesTheDerivedRandomSeed() {
        assertThat(TransformSelector.mix(1L, "vk:1")).isNotEqualTo(TransformSelector.mix(1L, "vk:2"));
        assertThat(TransformSelector.mix(1L, "vk:1")).isEqualTo(TransformSelector.mix(1L, "vk:1"));
    }
}
