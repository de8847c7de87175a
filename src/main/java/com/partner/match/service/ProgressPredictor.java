package com.partner.match.service;

import com.partner.match.dto.ProgressGoal;
import com.partner.match.dto.ProgressPrediction;
import com.partner.match.dto.ProgressSample;

import java.util.List;

public interface ProgressPredictor {
    ProgressPrediction predict(List<ProgressSample> samples, ProgressGoal goal);
}
