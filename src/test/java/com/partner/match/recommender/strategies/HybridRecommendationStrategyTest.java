package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.SubjectProficiency;
import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.RecommendationMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Set;

import static com.partner.match.testsupport.Participants.participant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HybridRecommendationStrategyTest {

    @Mock
    private CollaborativeFilteringStrategy collaborative;
    @Mock
    private ContentBasedStrategy content;

    private HybridRecommendationStrategy strategy;
    private final Participant target = participant("t").build();
    private final List<Participant> pool = List.of();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        strategy = new HybridRecommendationStrategy(collaborative, content);
    }

    @Test
    void shouldBlendScoresAndTagMethodsByContributors() {
        when(collaborative.recommend(target, pool, 4)).thenReturn(List.of(
                recommendation("a", 2.0, RecommendationMethod.COLLABORATIVE, "liked by peers"),
                recommendation("b", 1.0, RecommendationMethod.COLLABORATIVE, "one peer")));
        when(content.recommend(target, pool, 4)).thenReturn(List.of(
                recommendation("b", 0.5, RecommendationMethod.CONTENT, "similar profile"),
                recommendation("c", 0.9, RecommendationMethod.CONTENT, "same institution")));

        List<Recommendation> blended = strategy.recommend(target, pool, 2);

        assertEquals(List.of("a", "b"), blended.stream().map(Recommendation::getParticipantId).toList());
        assertEquals(1.2, blended.get(0).getScore(), 1e-9);
        assertEquals(RecommendationMethod.COLLABORATIVE, blended.get(0).getMethod());
        assertEquals(0.8, blended.get(1).getScore(), 1e-9);
        assertEquals(RecommendationMethod.HYBRID, blended.get(1).getMethod());
        assertEquals("one peer; similar profile", blended.get(1).getReason());
        verify(collaborative).recommend(target, pool, 4);
        verify(content).recommend(target, pool, 4);
    }

    @Test
    void shouldFallBackToContentOnlyResults() {
        when(collaborative.recommend(target, pool, 6)).thenReturn(List.of());
        when(content.recommend(target, pool, 6)).thenReturn(List.of(
                recommendation("c", 0.9, RecommendationMethod.CONTENT, "same institution")));

        List<Recommendation> blended = strategy.recommend(target, pool, 3);

        assertEquals(1, blended.size());
        assertEquals(0.36, blended.get(0).getScore(), 1e-9);
        assertEquals(RecommendationMethod.CONTENT, blended.get(0).getMethod());
    }

    @Test
    void shouldReturnEmptyWhenNeitherEngineContributes() {
        when(collaborative.recommend(target, pool, 2)).thenReturn(List.of());
        when(content.recommend(target, pool, 2)).thenReturn(List.of());

        assertTrue(strategy.recommend(target, pool, 1).isEmpty());
    }

    @Test
    void shouldHandleLimitsBeyondHalfOfIntRange() {
        HybridRecommendationStrategy real = new HybridRecommendationStrategy(
                new CollaborativeFilteringStrategy(), new ContentBasedStrategy());
        Participant requester = rated("t", 1, 2, 3).institution("MIT").build();
        List<Participant> participants = List.of(
                requester,
                rated("n1", 1, 2, 3).partnerIds(Set.of("x")).build(),
                rated("n2", 2, 3, 4).partnerIds(Set.of("x")).build(),
                participant("x").institution("MIT").build());

        List<Recommendation> small = real.recommend(requester, participants, 10);
        List<Recommendation> large = real.recommend(requester, participants, 1 << 30);

        assertEquals(3, small.size());
        assertEquals(small, large);
        assertEquals(RecommendationMethod.HYBRID, large.get(0).getMethod());
        assertEquals("x", large.get(0).getParticipantId());
    }

    private static Participant.ParticipantBuilder rated(String id, int math, int cs, int bio) {
        return participant(id).subjects(List.of(
                SubjectProficiency.of("math", AcademicLevel.values()[math - 1]),
                SubjectProficiency.of("cs", AcademicLevel.values()[cs - 1]),
                SubjectProficiency.of("bio", AcademicLevel.values()[bio - 1])));
    }

    private static Recommendation recommendation(String id, double score, RecommendationMethod method, String reason) {
        return Recommendation.builder()
                .participant(participant(id).build())
                .score(score)
                .method(method)
                .reason(reason)
                .build();
    }
}
