package github.sarthakdev143.uniq_publisher.service.impl;

import github.sarthakdev143.uniq_publisher.config.UniqPublisherProperties;
import github.sarthakdev143.uniq_publisher.exception.BatchValidationException;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Turns caller input into a publish instant. Times without an offset are read in the configured
 * scheduling zone ({@code Europe/Moscow} by default).
 */
@Component
public class ScheduledTimeParser {

    private final ZoneId zone;

    public ScheduledTimeParser(UniqPublisherProperties properties) {
        try {
            this.zone = ZoneId.of(properties.getSchedule().getZone());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                    "Invalid uniq-publisher.schedule.zone: " + properties.getSchedule().getZone(), e);
        }
    }

    public Instant parse(String input) {
        if (input == null || input.isBlank()) {
            throw new BatchValidationException("scheduledAt is required.");
        }

        String value = input.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(value));
            } catch (NumberFormatException | DateTimeException e) {
                throw new BatchValidationException("scheduledAt epoch seconds out of range: " + value);
            }
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // No offset; read as local time in the scheduling zone.
        }
        try {
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new BatchValidationException(
                    "scheduledAt must be ISO-8601, e.g. 2026-01-31T18:00 or 2026-01-31T18:00+03:00.");
        }
    }

    public String describe(Instant instant) {
        return instant.atZone(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public ZoneId zone() {
        return zone;
    }
}
