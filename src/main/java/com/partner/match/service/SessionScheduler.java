package com.partner.match.service;

import com.partner.match.dto.Participant;
import com.partner.match.dto.ScheduleSlot;

import java.util.Collection;
import java.util.List;

public interface SessionScheduler {
    List<ScheduleSlot> findSlots(Collection<Participant> participants, long requiredDurationMinutes, int minParticipants);
}
