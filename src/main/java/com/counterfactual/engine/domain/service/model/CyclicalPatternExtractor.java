package com.counterfactual.engine.domain.service.model;

import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.model.CyclicalModel;
import com.counterfactual.engine.domain.model.SeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive decomposition of a pre-event window into a baseline and per-phase offsets.
 */
@Slf4j
@Component
public class CyclicalPatternExtractor {

    public CyclicalModel extract(List<SeriesPoint> preEvent, CyclePeriod period, ZoneId zone) {
        if (preEvent.isEmpty()) {
            throw new IllegalArgumentException("cyclical extraction needs at least one point");
        }

        double baseline = shiftedMean(preEvent);

        Map<Integer, double[]> sums = new HashMap<>();
        for (SeriesPoint point : preEvent) {
            int phase = period.phaseOf(point.timestamp().atZone(zone));
            double[] acc = sums.computeIfAbsent(phase, k -> new double[2]);
            acc[0] += point.value() - baseline;
            acc[1] += 1;
        }

        Map<Integer, Double> offsets = new HashMap<>(sums.size());
        for (Map.Entry<Integer, double[]> entry : sums.entrySet()) {
            offsets.put(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]);
        }

        log.debug("[Cyclical] period={}, points={}, baseline={}, phases={}",
                period, preEvent.size(), baseline, offsets.size());
        return new CyclicalModel(period, zone, baseline, offsets);
    }

    /**
     * Mean taken relative to the first value, so a constant window returns that value exactly.
     */
    static double shiftedMean(List<SeriesPoint> points) {
        double reference = points.get(0).value();
        double sum = 0.0;
        for (SeriesPoint point : points) {
            sum += point.value() - reference;
        }
        return reference + sum / points.size();
    }
}
