package com.counterfactual.engine.domain.service.forecast;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.model.ArModel;
import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.CounterfactualResult;
import com.counterfactual.engine.domain.model.CounterfactualResult.ModelSummary;
import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.model.CyclicalModel;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.ForecastPoint;
import com.counterfactual.engine.domain.model.SeriesPoint;
import com.counterfactual.engine.domain.service.model.AutoregressiveEstimator;
import com.counterfactual.engine.domain.service.model.CyclicalPatternExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Forecasts one entity through one event window and its trailing horizon. Models are fit on the
 * points strictly before the event's start and dropped once the result is built.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ForecastGenerator {

    private final CyclicalPatternExtractor cyclicalPatternExtractor;
    private final AutoregressiveEstimator autoregressiveEstimator;

    public CounterfactualResult generate(CleanedSeries series, Event event, ForecastConfig config) {
        String entityId = series.entityId();
        List<SeriesPoint> preEvent = series.before(event.start());

        int required = config.minPreEventPoints();
        if (preEvent.size() < required) {
            throw new InsufficientDataException(entityId, preEvent.size(), required,
                    "event " + event.name() + " has " + preEvent.size()
                            + " pre-event points for entity " + entityId + ", needs at least " + required);
        }

        Duration frequency = series.frequency();
        CyclePeriod period = config.getCyclePeriod() != null
                ? config.getCyclePeriod()
                : CyclePeriod.forFrequency(frequency);

        CyclicalModel cyclical = cyclicalPatternExtractor.extract(preEvent, period, config.getZone());

        double[] residuals = new double[preEvent.size()];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = cyclical.residual(preEvent.get(i));
        }
        ArModel ar = autoregressiveEstimator.fit(residuals, config.getArOrder(), entityId);

        List<ForecastPoint> points = rollout(series, event, config, cyclical, ar, residuals);

        log.debug("[Forecast] entity={}, event={}, period={}, preEvent={}, steps={}, ar={}",
                entityId, event.name(), period, preEvent.size(), points.size(), ar);

        return CounterfactualResult.builder()
                .entityId(entityId)
                .eventName(event.name())
                .points(points)
                .model(ModelSummary.builder()
                        .cyclePeriod(period)
                        .frequency(frequency.toString())
                        .preEventPoints(preEvent.size())
                        .baseline(cyclical.baseline())
                        .observedPhases(cyclical.offsets().size())
                        .arCoefficients(ar.coefficients())
                        .arIntercept(ar.intercept())
                        .residualStd(ar.residualStd())
                        .arDegenerate(ar.degenerate())
                        .build())
                .build();
    }

    private List<ForecastPoint> rollout(CleanedSeries series, Event event, ForecastConfig config,
                                        CyclicalModel cyclical, ArModel ar, double[] observedResiduals) {
        int order = ar.order();
        // ring of the last p residuals; seeded from observations, then fed with predictions
        double[] history = new double[order];
        System.arraycopy(observedResiduals, observedResiduals.length - order, history, 0, order);
        int newest = order - 1;

        NoiseGenerator noise = NoiseGenerator.forPair(config, series.entityId(), event.name(), ar.residualStd());
        Instant end = event.horizonEnd(config.getForecastDays());
        Duration step = series.frequency();

        List<ForecastPoint> points = new ArrayList<>();
        for (Instant t = event.start(); !t.isAfter(end); t = t.plus(step)) {
            double residual = 0.0;
            if (order > 0) {
                residual = ar.predict(history, newest);
                newest = (newest + 1) % order;
                history[newest] = residual;
            }
            double value = cyclical.baseline() + cyclical.offsetAt(t) + residual + noise.next();
            points.add(new ForecastPoint(t, series.entityId(), event.name(), config.clamp(value)));
        }
        return points;
    }
}
