package com.counterfactual.engine.domain.service.comparison;

import com.counterfactual.engine.domain.model.ComparisonReport;
import com.counterfactual.engine.domain.model.ComparisonReport.DifferenceSummary;
import com.counterfactual.engine.domain.model.ComparisonReport.EventComparison;
import com.counterfactual.engine.domain.model.ComparisonReport.TimeAggregate;
import com.counterfactual.engine.domain.model.DifferenceFilter;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.service.cleaning.SeriesCleaner;
import com.counterfactual.engine.domain.service.detection.SchemaDetector;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.counterfactual.engine.support.SeriesFixtures.hour;
import static com.counterfactual.engine.support.SeriesFixtures.hourlyRows;
import static com.counterfactual.engine.support.SeriesFixtures.row;
import static org.junit.jupiter.api.Assertions.*;

class ComparisonServiceTest {

    private final ComparisonService service = new ComparisonService(new SchemaDetector(), new SeriesCleaner());
    private final ForecastConfig config = ForecastConfig.builder().forecastDays(0).build();

    private RawTable actual() {
        List<Map<String, Object>> rows = new ArrayList<>(hourlyRows("A", 48, i -> 10.0));
        rows.addAll(hourlyRows("B", 48, i -> 20.0));
        return RawTable.of(rows);
    }

    private RawTable counterfactual() {
        return RawTable.of(List.of(
                row("timestamp", hour(30).toString(), "store", "A", "counterfactual_promo", 8.0),
                row("timestamp", hour(30).toString(), "store", "B", "counterfactual_promo", 20.0),
                row("timestamp", hour(31).toString(), "store", "A", "counterfactual_promo", 12.0),
                row("timestamp", hour(31).toString(), "store", "B", "counterfactual_promo", 25.0),
                row("timestamp", hour(32).toString(), "store", "A", "counterfactual_promo", 0.0),
                row("timestamp", hour(31).toString(), "store", "C", "counterfactual_promo", 1.0),
                row("timestamp", hour(29).toString(), "store", "A", "counterfactual_promo", null)));
    }

    // --- Summary statistics ---

    @Test
    void testDifferenceSummary() {
        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), config);

        assertEquals("store", report.getColumns().entityColumn());
        assertEquals(1, report.getEvents().size());
        EventComparison comparison = report.getEvents().get(0);
        assertEquals("counterfactual_promo", comparison.getColumn());
        assertEquals(4, comparison.getDifferences().size());

        // differences: A +2, -2; B 0, -5
        DifferenceSummary summary = comparison.getSummary();
        assertEquals(4, summary.getCount());
        assertEquals(-1.25, summary.getMean(), 1e-12);
        assertEquals(-1.0, summary.getMedian(), 1e-12);
        assertEquals(-2.75, summary.getQ25(), 1e-12);
        assertEquals(0.5, summary.getQ75(), 1e-12);
        assertEquals(-5.0, summary.getMin());
        assertEquals(2.0, summary.getMax());
        assertEquals(Math.sqrt(((3.25 * 3.25) + (0.75 * 0.75) + (1.25 * 1.25) + (3.75 * 3.75)) / 3),
                summary.getStd(), 1e-12);
        assertEquals(1, summary.getNumPositive());
        assertEquals(2, summary.getNumNegative());
        assertEquals(1, summary.getNumZero());
        assertEquals(25.0, summary.getPctPositive(), 1e-12);
        assertEquals(50.0, summary.getPctNegative(), 1e-12);
    }

    @Test
    void testTimeAggregation() {
        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), config);

        List<TimeAggregate> aggregates = report.getEvents().get(0).getTimeAggregated();
        assertEquals(2, aggregates.size());

        assertEquals(hour(30), aggregates.get(0).getTimestamp());
        assertEquals(2, aggregates.get(0).getCount());
        assertEquals(1.0, aggregates.get(0).getMean(), 1e-12);
        assertEquals(1, aggregates.get(0).getNumZero());

        assertEquals(hour(31), aggregates.get(1).getTimestamp());
        assertEquals(-3.5, aggregates.get(1).getMean(), 1e-12);
        assertEquals(2, aggregates.get(1).getNumNegative());
    }

    @Test
    void testWindowIncludesTrailingHorizon() {
        ForecastConfig oneDay = config.toBuilder().forecastDays(1).build();

        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), oneDay);

        // hour 32 falls inside the horizon now
        assertEquals(5, report.getEvents().get(0).getSummary().getCount());
    }

    // --- Filters ---

    @Test
    void testEntityFilterNarrowsSummary() {
        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), config,
                new DifferenceFilter("b", null, null));

        // B only: 0 and -5
        DifferenceSummary summary = report.getEvents().get(0).getSummary();
        assertEquals(2, summary.getCount());
        assertEquals(-2.5, summary.getMean(), 1e-12);
        assertTrue(report.getEvents().get(0).getDifferences().stream().allMatch(d -> "B".equals(d.entityId())));
        assertEquals("b", report.getFilter().entity());
    }

    @Test
    void testTimeFilterIsInclusive() {
        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), config,
                new DifferenceFilter(null, hour(31), hour(31)));

        EventComparison comparison = report.getEvents().get(0);
        assertEquals(2, comparison.getSummary().getCount());
        assertEquals(-3.5, comparison.getSummary().getMean(), 1e-12);
        assertEquals(1, comparison.getTimeAggregated().size());
    }

    @Test
    void testFilterMatchingNothingSkipsEvent() {
        ComparisonReport report = service.compare(actual(), counterfactual(),
                List.of(new Event("promo", hour(30), hour(31))), config,
                new DifferenceFilter("Z", null, null));

        assertTrue(report.getEvents().isEmpty());
        assertEquals(1, report.getSkipped().size());
        assertTrue(report.getSkipped().get(0).reason().contains("entity=Z"));
    }

    @Test
    void testInvertedFilterRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DifferenceFilter(null, hour(5), hour(4)));
    }

    // --- Skipped events ---

    @Test
    void testMissingColumnAndEmptyWindowAreSkipped() {
        ComparisonReport report = service.compare(actual(), counterfactual(), List.of(
                new Event("promo", hour(40), hour(41)),
                new Event("outage", hour(30), hour(31))), config);

        assertTrue(report.getEvents().isEmpty());
        assertEquals(2, report.getSkipped().size());
        assertEquals("promo", report.getSkipped().get(0).eventName());
        assertTrue(report.getSkipped().get(1).reason().contains("counterfactual_outage"));
    }

    @Test
    void testRequiresEvents() {
        assertThrows(IllegalArgumentException.class,
                () -> service.compare(actual(), counterfactual(), List.of(), config));
    }

    // --- DescriptiveStats ---

    @Test
    void testSingleValueStats() {
        DescriptiveStats stats = new DescriptiveStats(new double[]{4.0});

        assertEquals(4.0, stats.median());
        assertEquals(4.0, stats.percentile(75));
        assertTrue(Double.isNaN(stats.std()));
    }
}
