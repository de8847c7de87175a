package com.partner.match.dto;

import com.partner.match.dto.enums.CommunicationStyle;
import com.partner.match.dto.enums.GroupSize;
import com.partner.match.dto.enums.SessionType;
import com.partner.match.dto.enums.StudyIntensity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MatchPreferences {
    SessionType sessionType;
    GroupSize groupSize;
    CommunicationStyle communicationStyle;
    StudyIntensity studyIntensity;
}
