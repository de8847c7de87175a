package com.partner.match.service;

import com.partner.match.dto.ProgressGoal;
import com.partner.match.dto.ProgressPrediction;
import com.partner.match.dto.ProgressSample;
import com.partner.match.exceptions.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Projects a study goal's completion date from a least-squares line through cumulative hours.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinearProgressPredictor implements ProgressPredictor {
    static final double SPARSE_DATA_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.95;

    private final Clock clock;

    @Override
    public ProgressPrediction predict(List<ProgressSample> samples, ProgressGoal goal) {
        if (goal == null || goal.getDeadline() == null) {
            throw new InvalidRequestException("Progress goal with a deadline is required");
        }
        List<ProgressSample> ordered = samples == null ? List.of() : samples.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ProgressSample::getDate))
                .toList();

        if (ordered.size() < 2) {
            log.debug("Only {} progress samples, falling back to the deadline", ordered.size());
            return ProgressPrediction.builder()
                    .estimatedCompletion(goal.getDeadline())
                    .confidence(SPARSE_DATA_CONFIDENCE)
                    .currentRate(0.0)
                    .requiredRate(requiredRate(goal, totalHours(ordered)))
                    .build();
        }

        LocalDate origin = ordered.get(0).getDate();
        int n = ordered.size();
        double[] x = new double[n];
        double[] y = new double[n];
        double cumulative = 0;
        for (int i = 0; i < n; i++) {
            cumulative += ordered.get(i).getHours();
            x[i] = ChronoUnit.DAYS.between(origin, ordered.get(i).getDate());
            y[i] = cumulative;
        }

        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0, sxx = 0, ssTot = 0;
        for (int i = 0; i < n; i++) {
            sxy += (x[i] - meanX) * (y[i] - meanY);
            sxx += (x[i] - meanX) * (x[i] - meanX);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }
        double slope = sxx == 0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * x[i]);
            ssRes += residual * residual;
        }
        double rSquared = ssTot == 0 ? 0.0 : 1 - ssRes / ssTot;

        LocalDate lastDate = ordered.get(n - 1).getDate();
        double remaining = goal.getTargetHours() - cumulative;

        LocalDate completion;
        double confidence;
        if (remaining <= 0) {
            completion = lastDate;
            confidence = clampConfidence(rSquared);
        } else if (slope <= 0) {
            completion = goal.getDeadline();
            confidence = 0.0;
        } else {
            completion = lastDate.plusDays((long) Math.ceil(remaining / slope));
            confidence = clampConfidence(rSquared);
        }

        log.debug("Progress projection: slope={}, r2={}, remaining={}, completion={}", slope, rSquared, remaining, completion);
        return ProgressPrediction.builder()
                .estimatedCompletion(completion)
                .confidence(confidence)
                .currentRate(Math.max(0.0, slope))
                .requiredRate(requiredRate(goal, cumulative))
                .build();
    }

    private double requiredRate(ProgressGoal goal, double completedHours) {
        double remaining = Math.max(0.0, goal.getTargetHours() - completedHours);
        long daysLeft = ChronoUnit.DAYS.between(LocalDate.now(clock), goal.getDeadline());
        if (remaining == 0) {
            return 0.0;
        }
        return daysLeft > 0 ? remaining / daysLeft : remaining;
    }

    private static double totalHours(List<ProgressSample> samples) {
        return samples.stream().mapToDouble(ProgressSample::getHours).sum();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double clampConfidence(double rSquared) {
        if (Double.isNaN(rSquared)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(MAX_CONFIDENCE, rSquared));
    }
}
