package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.BatchValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduledTimeParserTest {

    private final ScheduledTimeParser parser = new ScheduledTimeParser(new UniqPublisherProperties());

    @Test
    void localTimeIsReadInMoscow() {
        assertThat(parser.parse("2026-01-31T18:00")).isEqualTo(Instant.parse("2026-01-31T15:00:00Z"));
    }

    @Test
    void explicitOffsetWins() {
        assertThat(parser.parse("2026-01-31T18:00:00+01:00")).isEqualTo(Instant.parse("2026-01-31T17:00:00Z"));
        assertThat(parser.parse(" 2026-01-31T18:00:00Z ")).isEqualTo(Instant.parse("2026-01-31T18:00:00Z"));
    }

    @Test
    void digitsAreEpochSeconds() {
        assertThat(parser.parse("1767225600")).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void invalidInputIsRejected() {
        assertThatThrownBy(() -> parser.parse("tomorrow"))
                .isInstanceOf(BatchValidationException.class)
                .hasMessageContaining("ISO-8601");
        assertThatThrownBy(() -> parser.parse(" "))
                .isInstanceOf(BatchValidationException.class)
                .hasMessage("scheduledAt is required.");
        assertThatThrownBy(() -> parser.parse("99999999999999999999999"))
                .isInstanceOf(BatchValidationException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void describeUsesSchedulingZone() {
        assertThat(parser.describe(Instant.parse("2026-01-31T15:00:00Z"))).isEqualTo("2026-01-31T18:00:00+03:00");
    }

    @Test
    void unknownZoneFailsFast() {
        UniqPublisherProperties properties = new UniqPublisherProperties();
        properties.getSchedule().setZone("Mars/Olympus");

        assertThatThrownBy(() -> new ScheduledTimeParser(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("uniq-publisher.schedule.zone");
    }
}
