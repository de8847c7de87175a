package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.ScheduleSlot;
import com.partner.match.dto.TimeInterval;
import com.partner.match.metrics.MatchingMetrics;
import com.partner.match.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Anchor-based slot finder: every availability interval is a candidate slot bounded by its own
 * start and end, annotated with every participant whose availability overlaps it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionSchedulerImpl implements SessionScheduler {
    static final int MAX_SLOTS = 5;

    private final MatchingMetrics metrics;

    @Override
    public List<ScheduleSlot> findSlots(Collection<Participant> participants, long requiredDurationMinutes,
                                        int minParticipants) {
        RequestValidator.requirePositiveDuration(requiredDurationMinutes);
        int required = Math.max(1, minParticipants);
        long requiredMillis = Duration.ofMinutes(requiredDurationMinutes).toMillis();

        List<TimeInterval> intervals = flatten(participants);
        if (intervals.isEmpty()) {
            log.debug("No availability among {} participants", participants == null ? 0 : participants.size());
            return List.of();
        }

        List<ScheduleSlot> slots = new ArrayList<>();
        for (TimeInterval anchor : intervals) {
            if (anchor.durationMillis() < requiredMillis) {
                continue;
            }
            Set<String> attendees = new LinkedHashSet<>();
            attendees.add(anchor.getParticipantId());
            for (TimeInterval other : intervals) {
                if (!other.getStart().isBefore(anchor.getEnd())) {
                    break;
                }
                if (anchor.overlaps(other)) {
                    attendees.add(other.getParticipantId());
                }
            }
            if (attendees.size() >= required) {
                slots.add(new ScheduleSlot(anchor.getStart(), anchor.getEnd(), List.copyOf(attendees)));
            }
        }

        slots.sort(Comparator.comparingInt((ScheduleSlot slot) -> slot.getParticipantIds().size()).reversed());
        List<ScheduleSlot> best = List.copyOf(slots.subList(0, Math.min(MAX_SLOTS, slots.size())));
        metrics.recordScheduleSlots(best.size());
        log.info("Found {} candidate slots ({} returned) for {} intervals, duration={}m, minParticipants={}",
                slots.size(), best.size(), intervals.size(), requiredDurationMinutes, required);
        return best;
    }

    private static List<TimeInterval> flatten(Collection<Participant> participants) {
        if (participants == null) {
            return List.of();
        }
        return participants.stream()
                .filter(participant -> participant != null && participant.getId() != null)
                .flatMap(participant -> participant.getAvailability().stream()
                        .filter(interval -> !interval.isDegenerate())
                        .map(interval -> new TimeInterval(interval.getStart(), interval.getEnd(), participant.getId())))
                .sorted(Comparator.comparing(TimeInterval::getStart))
                .toList();
    }
}
