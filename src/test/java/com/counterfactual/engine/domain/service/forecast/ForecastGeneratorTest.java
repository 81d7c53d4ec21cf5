package com.counterfactual.engine.domain.service.forecast;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.model.CleanedSeries;
import com.counterfactual.engine.domain.model.CounterfactualResult;
import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.ForecastPoint;
import com.counterfactual.engine.domain.service.model.AutoregressiveEstimator;
import com.counterfactual.engine.domain.service.model.CyclicalPatternExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static com.counterfactual.engine.support.SeriesFixtures.HOUR;
import static com.counterfactual.engine.support.SeriesFixtures.hour;
import static com.counterfactual.engine.support.SeriesFixtures.hourly;
import static org.junit.jupiter.api.Assertions.*;

class ForecastGeneratorTest {

    private final ForecastGenerator generator =
            new ForecastGenerator(new CyclicalPatternExtractor(), new AutoregressiveEstimator());

    private final ForecastConfig noiseless = ForecastConfig.builder()
            .noiseFactor(0.0)
            .forecastDays(1)
            .build();

    // --- Reference scenarios ---

    @Test
    void testConstantSeriesForecastsExactConstant() {
        CleanedSeries series = hourly("A", 200, i -> 100.0);
        Event event = new Event("promo", hour(150), hour(151));

        CounterfactualResult result = generator.generate(series, event, noiseless);

        // two event hours plus a one-day horizon, inclusive
        assertEquals(2 + 24, result.getPoints().size());
        for (ForecastPoint point : result.getPoints()) {
            assertEquals(100.0, point.value(), 0.0);
        }
        assertEquals(hour(150), result.getPoints().get(0).timestamp());
        assertEquals(hour(175), result.getPoints().get(25).timestamp());
    }

    @Test
    void testSeasonalSeriesWithoutArSignal() {
        CleanedSeries series = hourly("A", 24 * 10, i -> 50 + 10 * Math.sin(i % 24));
        Event event = new Event("outage", hour(24 * 8 + 5), hour(24 * 8 + 17));
        ForecastConfig config = noiseless.toBuilder().cyclePeriod(CyclePeriod.HOUR).build();

        CounterfactualResult result = generator.generate(series, event, config);

        for (ForecastPoint point : result.getPoints()) {
            int hourOfDay = point.timestamp().atZone(config.getZone()).getHour();
            assertEquals(50 + 10 * Math.sin(hourOfDay), point.value(), 1e-9);
        }
        assertEquals(CyclePeriod.HOUR, result.getModel().getCyclePeriod());
        assertEquals(24 * 8 + 5, result.getModel().getPreEventPoints());
    }

    // --- Rollout ---

    @Test
    void testArRolloutFollowsFittedRecurrence() {
        double[] values = new double[100];
        SplittableRandom rng = new SplittableRandom(3);
        for (int i = 1; i < values.length; i++) {
            values[i] = 0.8 * values[i - 1] + rng.nextGaussian();
        }
        CleanedSeries series = hourly("A", values.length, i -> 20 + values[i]);
        Event event = new Event("e", hour(100), hour(100));
        // a single phase keeps the seasonal term constant across the rollout
        ForecastConfig config = noiseless.toBuilder().cyclePeriod(CyclePeriod.MONTH).forecastDays(2).build();

        CounterfactualResult result = generator.generate(series, event, config);

        double phi = result.getModel().getArCoefficients()[0];
        assertFalse(result.getModel().isArDegenerate());
        assertTrue(Math.abs(phi) < 1.0);

        List<ForecastPoint> points = result.getPoints();
        assertEquals(49, points.size());
        for (int k = 0; k + 2 < points.size(); k++) {
            double step = points.get(k + 1).value() - points.get(k).value();
            double next = points.get(k + 2).value() - points.get(k + 1).value();
            assertEquals(phi * step, next, 1e-9);
        }
    }

    @Test
    void testOrderZeroUsesCyclicalPatternOnly() {
        CleanedSeries series = hourly("A", 48, i -> 5 + (i % 2));
        Event event = new Event("e", hour(48), hour(49));
        ForecastConfig config = noiseless.toBuilder().arOrder(0).forecastDays(0).build();

        CounterfactualResult result = generator.generate(series, event, config);

        assertEquals(2, result.getPoints().size());
        assertEquals(5.0, result.getPoints().get(0).value(), 1e-12);
        assertEquals(6.0, result.getPoints().get(1).value(), 1e-12);
    }

    @Test
    void testValuesAreClamped() {
        CleanedSeries series = hourly("A", 48, i -> 100.0);
        Event event = new Event("e", hour(40), hour(41));

        CounterfactualResult capped = generator.generate(series, event,
                noiseless.toBuilder().maxValue(90.0).build());
        CounterfactualResult floored = generator.generate(series, event,
                noiseless.toBuilder().minValue(120.0).build());

        capped.getPoints().forEach(p -> assertEquals(90.0, p.value()));
        floored.getPoints().forEach(p -> assertEquals(120.0, p.value()));
    }

    @Test
    void testNoisyValuesStayWithinBounds() {
        SplittableRandom rng = new SplittableRandom(3);
        CleanedSeries series = hourly("A", 240, i -> 50.0 + 10.0 * rng.nextGaussian());
        Event event = new Event("e", hour(200), hour(210));
        ForecastConfig config = ForecastConfig.builder()
                .noiseFactor(1.0)
                .noiseSeed(17)
                .forecastDays(2)
                .minValue(48.0)
                .maxValue(52.0)
                .build();

        CounterfactualResult result = generator.generate(series, event, config);

        assertEquals(11 + 48, result.getPoints().size());
        boolean hitBound = false;
        for (ForecastPoint point : result.getPoints()) {
            assertTrue(point.value() >= 48.0 && point.value() <= 52.0, "out of bounds: " + point.value());
            hitBound |= point.value() == 48.0 || point.value() == 52.0;
        }
        assertTrue(hitBound);
    }

    @Test
    void testEventAfterAllDataIsForecastOnly() {
        CleanedSeries series = hourly("A", 48, i -> 7.0);
        Event event = new Event("later", hour(60), hour(62));

        CounterfactualResult result = generator.generate(series, event, noiseless.toBuilder().forecastDays(0).build());

        assertEquals(3, result.getPoints().size());
        assertEquals(48, result.getModel().getPreEventPoints());
        result.getPoints().forEach(p -> assertEquals(7.0, p.value(), 0.0));
    }

    @Test
    void testForecastStepsFollowSeriesFrequency() {
        CleanedSeries series = hourly("A", 48, i -> 1.0);
        Event event = new Event("e", hour(40).plusSeconds(1800), hour(42));

        CounterfactualResult result = generator.generate(series, event, noiseless.toBuilder().forecastDays(0).build());

        assertEquals(2, result.getPoints().size());
        assertEquals(hour(41).plusSeconds(1800), result.getPoints().get(1).timestamp());
        assertEquals(HOUR.toString(), result.getModel().getFrequency());
    }

    // --- Noise ---

    @Test
    void testSeededNoiseIsReproducible() {
        SplittableRandom rng = new SplittableRandom(11);
        double[] values = new double[120];
        for (int i = 0; i < values.length; i++) {
            values[i] = 30 + rng.nextGaussian();
        }
        CleanedSeries series = hourly("A", values.length, i -> values[i]);
        Event event = new Event("e", hour(100), hour(110));
        ForecastConfig seeded = ForecastConfig.builder().noiseFactor(0.5).noiseSeed(42).forecastDays(0).build();

        List<ForecastPoint> first = generator.generate(series, event, seeded).getPoints();
        List<ForecastPoint> second = generator.generate(series, event, seeded).getPoints();
        List<ForecastPoint> otherSeed = generator.generate(series, event,
                seeded.toBuilder().noiseSeed(43).build()).getPoints();
        List<ForecastPoint> silent = generator.generate(series, event,
                seeded.toBuilder().noiseFactor(0.0).build()).getPoints();

        assertEquals(first, second);
        assertNotEquals(first, otherSeed);
        assertNotEquals(first, silent);
    }

    // --- Insufficient history ---

    @Test
    void testTooFewPreEventPointsThrows() {
        CleanedSeries series = hourly("A", 48, i -> 1.0);
        Event event = new Event("early", hour(3), hour(5));
        ForecastConfig config = noiseless.toBuilder().arOrder(2).build();

        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> generator.generate(series, event, config));
        assertEquals("A", ex.getEntityId());
        assertEquals(3, ex.getAvailable());
        assertEquals(4, ex.getRequired());
    }
}
