package com.counterfactual.engine.domain.service.cleaning;

import com.counterfactual.engine.domain.model.SeriesPoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class FrequencyInference {

    private FrequencyInference() {
    }

    /**
     * Modal gap between consecutive timestamps when one gap clearly dominates (seen more than once
     * and strictly more often than any other), otherwise the lower median gap.
     *
     * @param points strictly increasing, at least two
     */
    public static Duration infer(List<SeriesPoint> points) {
        if (points.size() < 2) {
            throw new IllegalArgumentException("frequency needs at least 2 points, got " + points.size());
        }
        List<Duration> deltas = new ArrayList<>(points.size() - 1);
        Map<Duration, Integer> counts = new HashMap<>();
        for (int i = 1; i < points.size(); i++) {
            Duration delta = Duration.between(points.get(i - 1).timestamp(), points.get(i).timestamp());
            deltas.add(delta);
            counts.merge(delta, 1, Integer::sum);
        }

        Duration mode = null;
        int best = 0;
        int runnerUp = 0;
        for (Map.Entry<Duration, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            if (count > best) {
                runnerUp = best;
                best = count;
                mode = entry.getKey();
            } else if (count > runnerUp) {
                runnerUp = count;
            }
        }
        if (best > 1 && best > runnerUp) {
            return mode;
        }

        Collections.sort(deltas);
        return deltas.get((deltas.size() - 1) / 2);
    }
}
