package com.partner.match.recommender.strategies;

import com.partner.match.dto.Participant;
import com.partner.match.dto.Recommendation;
import com.partner.match.dto.SubjectProficiency;
import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.RecommendationMethod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.partner.match.testsupport.Participants.participant;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollaborativeFilteringStrategyTest {

    private final CollaborativeFilteringStrategy strategy = new CollaborativeFilteringStrategy();

    @Test
    void shouldRecommendPartnersOfSimilarParticipants() {
        Participant target = rated("t", 1, 2, 3).partnerIds(Set.of("w")).build();
        List<Participant> pool = List.of(
                target,
                rated("n1", 1, 2, 3).partnerIds(Set.of("x", "w")).build(),
                rated("n2", 2, 3, 4).partnerIds(Set.of("x")).build(),
                rated("anti", 4, 3, 1).partnerIds(Set.of("z")).build(),
                participant("x").build(),
                participant("w").build(),
                participant("z").build());

        List<Recommendation> recommendations = strategy.recommend(target, pool, 5);

        assertEquals(1, recommendations.size());
        Recommendation top = recommendations.get(0);
        assertEquals("x", top.getParticipantId());
        assertEquals(2.0, top.getScore(), 1e-9);
        assertEquals(RecommendationMethod.COLLABORATIVE, top.getMethod());
        assertEquals("Recommended by 2 participants similar to you (similarity: 1.00)", top.getReason());
    }

    @Test
    void shouldSkipExistingPartnersWhenTargetIsNotInPool() {
        Participant target = rated("t", 1, 2, 3).partnerIds(Set.of("w")).build();
        List<Participant> pool = List.of(
                rated("n1", 1, 2, 3).partnerIds(Set.of("x", "w", "y")).build(),
                participant("x").build(),
                participant("w").build(),
                participant("y").partnerIds(Set.of("t")).build());

        List<Recommendation> recommendations = strategy.recommend(target, pool, 5);

        assertEquals(List.of("x"), recommendations.stream().map(Recommendation::getParticipantId).toList());
    }

    @Test
    void shouldRequireTwoSharedSubjectsForSimilarity() {
        Participant target = rated("t", 1, 2, 3).build();
        Participant oneShared = participant("o")
                .subjects(List.of(SubjectProficiency.of("math", AcademicLevel.BEGINNER))).build();

        assertEquals(0.0, CollaborativeFilteringStrategy.similarity(target, oneShared));
        assertEquals(1.0, CollaborativeFilteringStrategy.similarity(target, rated("s", 2, 3, 4).build()), 1e-9);
    }

    @Test
    void shouldReturnEmptyWithoutSimilarParticipants() {
        Participant target = rated("t", 1, 2, 3).build();

        assertTrue(strategy.recommend(target, List.of(target, participant("x").build()), 5).isEmpty());
    }

    @Test
    void shouldSupportOnlyCollaborative() {
        assertTrue(strategy.supports(RecommendationMethod.COLLABORATIVE));
        assertTrue(!strategy.supports(RecommendationMethod.HYBRID));
    }

    private static Participant.ParticipantBuilder rated(String id, int math, int cs, int bio) {
        return participant(id).subjects(List.of(
                SubjectProficiency.of("math", level(math)),
                SubjectProficiency.of("cs", level(cs)),
                SubjectProficiency.of("bio", level(bio))));
    }

    private static AcademicLevel level(int rating) {
        return AcademicLevel.values()[rating - 1];
    }
}
