package com.partner.match.dto;

import com.partner.match.dto.enums.AcademicLevel;
import com.partner.match.dto.enums.LearningStyle;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A study participant as handed to the engine by the data-query layer.
 * <p>
 * Availability is already parsed into {@link TimeInterval}s; see
 * {@link com.partner.match.processors.AvailabilityParser} for the boundary conversion.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class Participant {
    String id;
    AcademicLevel academicLevel;
    LearningStyle learningStyle;
    String institution;
    String timezone;
    String region;
    String major;
    Integer graduationYear;
    @Builder.Default
    List<SubjectProficiency> subjects = List.of();
    @Builder.Default
    List<TimeInterval> availability = List.of();
    int recentActivity;
    @Builder.Default
    Set<String> partnerIds = Set.of();
    @Builder.Default
    boolean active = true;
    @Builder.Default
    boolean profileComplete = true;

    public Set<String> subjectIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (SubjectProficiency subject : subjects) {
            ids.add(subject.getSubjectId());
        }
        return ids;
    }

    public Optional<AcademicLevel> proficiencyIn(String subjectId) {
        return subjects.stream()
                .filter(s -> s.getSubjectId().equals(subjectId))
                .map(SubjectProficiency::getProficiencyLevel)
                .findFirst();
    }

    public boolean isPartneredWith(String participantId) {
        return partnerIds.contains(participantId);
    }
}
