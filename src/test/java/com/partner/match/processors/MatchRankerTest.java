package com.partner.match.processors;

import com.partner.match.dto.CompatibilityScore;
import com.partner.match.dto.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.partner.match.testsupport.Participants.participant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchRankerTest {

    private final MatchRanker ranker = new MatchRanker();

    @Test
    void shouldOrderByOverallWhenFarApart() {
        List<MatchResult> ranked = ranker.rank(List.of(
                result("low", 0.3, 0.9, 0.9),
                result("high", 0.9, 0.1, 0.1),
                result("mid", 0.6, 0.5, 0.5)));

        assertEquals(List.of("high", "mid", "low"), ids(ranked));
    }

    @Test
    void shouldBreakNearTiesBySubjectMatchThenTimeOverlap() {
        List<MatchResult> ranked = ranker.rank(List.of(
                result("a", 0.80, 0.40, 0.9),
                result("b", 0.75, 0.90, 0.1),
                result("c", 0.78, 0.42, 0.95)));

        assertEquals(List.of("b", "c", "a"), ids(ranked));
    }

    @Test
    void shouldKeepInputOrderForFullTies() {
        List<MatchResult> ranked = ranker.rank(List.of(
                result("first", 0.5, 0.5, 0.5),
                result("second", 0.5, 0.5, 0.5)));

        assertEquals(List.of("first", "second"), ids(ranked));
    }

    @Test
    void shouldNeverPlaceClearlyWorseResultFirst() {
        Random random = new Random(11);
        List<MatchResult> results = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            results.add(result("p" + i, random.nextDouble(), random.nextDouble(), random.nextDouble()));
        }

        List<MatchResult> ranked = ranker.rank(results);

        assertEquals(results.size(), ranked.size());
        for (int i = 0; i + 1 < ranked.size(); i++) {
            double current = ranked.get(i).getCompatibilityScore().getOverall();
            double next = ranked.get(i + 1).getCompatibilityScore().getOverall();
            assertTrue(current >= next - MatchRanker.OVERALL_TOLERANCE,
                    "adjacent pair out of order: " + current + " before " + next);
        }
    }

    private static MatchResult result(String id, double overall, double subject, double time) {
        return MatchResult.builder()
                .participant(participant(id).build())
                .compatibilityScore(CompatibilityScore.builder()
                        .overall(overall).subjectMatch(subject).timeOverlap(time).build())
                .build();
    }

    private static List<String> ids(List<MatchResult> results) {
        return results.stream().map(MatchResult::getParticipantId).toList();
    }
}
