package com.partner.match.processors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partner.match.dto.AvailabilitySlot;
import com.partner.match.dto.TimeInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Converts stored availability into {@link TimeInterval}s once, at the engine boundary.
 * <p>
 * Weekday-based slots are pinned to the week starting Monday {@link #REFERENCE_WEEK_START}
 * so that recurring weekly windows of different participants share one calendar. Anything
 * that cannot be parsed is dropped and counts as no availability. A weekday slot whose end
 * time precedes its start time runs overnight into the following day.
 * </p>
 */
@Slf4j
@Component
public class AvailabilityParser {
    public static final LocalDate REFERENCE_WEEK_START = LocalDate.of(2024, 1, 1);
    private static final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<AvailabilitySlot>> SLOT_LIST = new TypeReference<>() {
    };

    public List<TimeInterval> parse(String participantId, String availabilityJson) {
        if (availabilityJson == null || availabilityJson.isBlank()) {
            return List.of();
        }
        try {
            return parse(participantId, om.readValue(availabilityJson, SLOT_LIST));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable availability for participant {}: {}", participantId, e.getOriginalMessage());
            return List.of();
        }
    }

    public List<TimeInterval> parse(String participantId, List<AvailabilitySlot> slots) {
        if (slots == null) {
            return List.of();
        }
        List<TimeInterval> intervals = new ArrayList<>(slots.size());
        for (AvailabilitySlot slot : slots) {
            toInterval(participantId, slot).ifPresent(intervals::add);
        }
        return intervals;
    }

    Optional<TimeInterval> toInterval(String participantId, AvailabilitySlot slot) {
        if (slot == null) {
            return Optional.empty();
        }
        ZoneId zone = resolveZone(slot.getTimezone());
        Optional<Instant> start = resolveInstant(slot.getDay(), slot.getStartTime(), zone, 0);
        Optional<Instant> end = resolveInstant(slot.getDay(), slot.getEndTime(), zone, 0);
        if (start.isEmpty() || end.isEmpty()) {
            log.debug("Skipping unparseable slot {} for participant {}", slot, participantId);
            return Optional.empty();
        }
        if (end.get().isBefore(start.get()) && isWallClockTime(slot.getStartTime()) && isWallClockTime(slot.getEndTime())) {
            // overnight window, ends on the following day
            end = resolveInstant(slot.getDay(), slot.getEndTime(), zone, 1);
        }

        TimeInterval interval = new TimeInterval(start.get(), end.get(), participantId);
        if (interval.isDegenerate()) {
            log.debug("Skipping empty or inverted slot {} for participant {}", slot, participantId);
            return Optional.empty();
        }
        return Optional.of(interval);
    }

    private ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.debug("Unknown timezone {}; falling back to UTC", timezone);
            return ZoneOffset.UTC;
        }
    }

    private Optional<Instant> resolveInstant(String day, String time, ZoneId zone, int dayOffset) {
        if (time == null || time.isBlank()) {
            return Optional.empty();
        }
        String value = time.trim();

        Optional<Instant> absolute = attempt(() -> OffsetDateTime.parse(value).toInstant())
                .or(() -> attempt(() -> Instant.parse(value)))
                .or(() -> attempt(() -> LocalDateTime.parse(value).atZone(zone).toInstant()));
        if (absolute.isPresent()) {
            return absolute;
        }

        Optional<LocalTime> localTime = attempt(() -> LocalTime.parse(value));
        Optional<LocalDate> date = resolveDate(day);
        if (localTime.isEmpty() || date.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(date.get().plusDays(dayOffset).atTime(localTime.get()).atZone(zone).toInstant());
    }

    private static boolean isWallClockTime(String time) {
        return time != null && attempt(() -> LocalTime.parse(time.trim())).isPresent();
    }

    private Optional<LocalDate> resolveDate(String day) {
        if (day == null || day.isBlank()) {
            return Optional.empty();
        }
        String normalized = day.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() >= 3) {
            for (DayOfWeek dayOfWeek : DayOfWeek.values()) {
                if (dayOfWeek.name().startsWith(normalized)) {
                    return Optional.of(REFERENCE_WEEK_START.with(TemporalAdjusters.nextOrSame(dayOfWeek)));
                }
            }
        }
        return attempt(() -> LocalDate.parse(day.trim()));
    }

    private static <T> Optional<T> attempt(Supplier<T> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
