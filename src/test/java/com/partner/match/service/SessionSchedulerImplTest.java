package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.ScheduleSlot;
import com.partner.match.exceptions.InvalidRequestException;
import com.partner.match.metrics.MatchingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.partner.match.testsupport.Participants.hours;
import static com.partner.match.testsupport.Participants.monday;
import static com.partner.match.testsupport.Participants.participant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionSchedulerImplTest {

    private final SessionSchedulerImpl scheduler = new SessionSchedulerImpl(new MatchingMetrics(new SimpleMeterRegistry()));

    @Test
    void shouldAnnotateAnchorWithOverlappingParticipants() {
        List<Participant> participants = List.of(
                participant("a").availability(List.of(monday("a", 9, 12))).build(),
                participant("b").availability(List.of(monday("b", 10, 11))).build(),
                participant("c").availability(List.of(monday("c", 11, 13))).build());

        List<ScheduleSlot> slots = scheduler.findSlots(participants, 60, 2);

        assertEquals(3, slots.size());
        ScheduleSlot best = slots.get(0);
        assertEquals(monday("a", 9, 12).getStart(), best.getStart());
        assertEquals(List.of("a", "b", "c"), best.getParticipantIds());
        assertEquals(180, best.durationMinutes());
    }

    @Test
    void shouldDropSlotsShorterThanRequiredDuration() {
        List<Participant> participants = List.of(
                participant("a").availability(List.of(monday("a", 9, 12))).build(),
                participant("b").availability(List.of(hours("b", 600, 630))).build());

        List<ScheduleSlot> slots = scheduler.findSlots(participants, 60, 2);

        assertEquals(1, slots.size());
        assertEquals(List.of("a", "b"), slots.get(0).getParticipantIds());
    }

    @Test
    void shouldDropSlotsWithTooFewParticipants() {
        List<Participant> participants = List.of(
                participant("a").availability(List.of(monday("a", 9, 10))).build(),
                participant("b").availability(List.of(monday("b", 14, 15))).build());

        assertTrue(scheduler.findSlots(participants, 30, 2).isEmpty());
        assertEquals(2, scheduler.findSlots(participants, 30, 0).size());
    }

    @Test
    void shouldNotCountTouchingIntervalsAsOverlap() {
        List<Participant> participants = List.of(
                participant("a").availability(List.of(monday("a", 9, 10))).build(),
                participant("b").availability(List.of(monday("b", 10, 11))).build());

        assertTrue(scheduler.findSlots(participants, 30, 2).isEmpty());
    }

    @Test
    void shouldReturnAtMostFiveSlotsOrderedByAttendance() {
        List<Participant> participants = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            participants.add(participant("p" + i).availability(List.of(monday("p" + i, i, i + 2))).build());
        }
        participants.add(participant("all-day").availability(List.of(monday("all-day", 0, 12))).build());

        List<ScheduleSlot> slots = scheduler.findSlots(participants, 60, 1);

        assertEquals(SessionSchedulerImpl.MAX_SLOTS, slots.size());
        assertEquals("all-day", slots.get(0).getParticipantIds().get(0));
        for (int i = 0; i + 1 < slots.size(); i++) {
            assertTrue(slots.get(i).getParticipantIds().size() >= slots.get(i + 1).getParticipantIds().size());
        }
    }

    @Test
    void shouldIgnoreDegenerateAvailability() {
        List<Participant> participants = List.of(
                participant("a").availability(List.of(monday("a", 12, 9))).build(),
                participant("b").build());

        assertTrue(scheduler.findSlots(participants, 30, 1).isEmpty());
        assertTrue(scheduler.findSlots(null, 30, 1).isEmpty());
    }

    @Test
    void shouldSkipParticipantsWithoutId() {
        List<Participant> participants = List.of(
                participant(null).availability(List.of(monday(null, 9, 12))).build(),
                participant("a").availability(List.of(monday("a", 9, 12))).build(),
                participant("b").availability(List.of(hours("b", 600, 630))).build());

        List<ScheduleSlot> slots = scheduler.findSlots(participants, 60, 2);

        assertEquals(1, slots.size());
        assertEquals(List.of("a", "b"), slots.get(0).getParticipantIds());
    }

    @Test
    void shouldRejectNonPositiveDuration() {
        assertThrows(InvalidRequestException.class, () -> scheduler.findSlots(List.of(), 0, 2));
    }
}
