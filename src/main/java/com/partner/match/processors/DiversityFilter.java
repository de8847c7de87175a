package com.partner.match.processors;

import com.partner.match.dto.MatchResult;
import com.partner.match.dto.Participant;
import com.partner.match.utils.basic.Constant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-orders a ranked list so no institution or academic level dominates the head of it.
 * <p>
 * A first pass admits candidates in rank order while their institution has fewer than
 * {@value #MAX_PER_INSTITUTION} and their level fewer than {@value #MAX_PER_LEVEL} admitted
 * peers. Skipped candidates are then appended in rank order. Every prefix of the output is
 * the result a limit-bounded pass would produce.
 * </p>
 */
@Slf4j
@Component
public class DiversityFilter {
    static final int MAX_PER_INSTITUTION = 3;
    static final int MAX_PER_LEVEL = 2;

    public List<MatchResult> diversify(List<MatchResult> ranked) {
        List<MatchResult> diversified = new ArrayList<>(ranked.size());
        Set<String> admittedIds = new HashSet<>();
        Map<String, Integer> institutions = new HashMap<>();
        Map<String, Integer> levels = new HashMap<>();

        for (MatchResult candidate : ranked) {
            if (admittedIds.contains(candidate.getParticipantId())) {
                continue;
            }
            String institution = institutionOf(candidate.getParticipant());
            String level = levelOf(candidate.getParticipant());
            boolean institutionOpen = institutions.getOrDefault(institution, 0) < MAX_PER_INSTITUTION;
            boolean levelOpen = levels.getOrDefault(level, 0) < MAX_PER_LEVEL;
            if (institutionOpen && levelOpen) {
                diversified.add(candidate);
                admittedIds.add(candidate.getParticipantId());
                institutions.merge(institution, 1, Integer::sum);
                levels.merge(level, 1, Integer::sum);
            }
        }
        int firstPass = diversified.size();

        for (MatchResult candidate : ranked) {
            if (admittedIds.add(candidate.getParticipantId())) {
                diversified.add(candidate);
            }
        }
        log.debug("Diversity pass admitted {} of {} candidates before backfill", firstPass, diversified.size());
        return diversified;
    }

    private static String institutionOf(Participant participant) {
        return participant.getInstitution() != null ? participant.getInstitution() : Constant.UNKNOWN;
    }

    private static String levelOf(Participant participant) {
        return participant.getAcademicLevel() != null ? participant.getAcademicLevel().name() : Constant.UNKNOWN;
    }
}
