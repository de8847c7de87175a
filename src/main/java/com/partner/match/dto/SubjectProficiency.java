package com.partner.match.dto;

import com.partner.match.dto.enums.AcademicLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class SubjectProficiency {
    String subjectId;
    AcademicLevel proficiencyLevel;

    public AcademicLevel getProficiencyLevel() {
        return AcademicLevel.orDefault(proficiencyLevel);
    }
}
