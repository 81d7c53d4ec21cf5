package com.counterfactual.engine.domain.service;

import com.counterfactual.engine.api.dto.CompareRequest;
import com.counterfactual.engine.api.dto.ForecastOptions;
import com.counterfactual.engine.api.dto.GenerateRequest;
import com.counterfactual.engine.domain.exception.SchemaException;
import com.counterfactual.engine.domain.model.ComparisonReport;
import com.counterfactual.engine.domain.model.CounterfactualRunReport;
import com.counterfactual.engine.domain.model.CyclePeriod;
import com.counterfactual.engine.domain.model.DifferenceFilter;
import com.counterfactual.engine.domain.model.Event;
import com.counterfactual.engine.domain.model.RawTable;
import com.counterfactual.engine.domain.repository.CounterfactualRunRepository;
import com.counterfactual.engine.domain.service.comparison.ComparisonService;
import com.counterfactual.engine.domain.service.event.EventDefinition;
import com.counterfactual.engine.domain.service.event.EventParser;
import com.counterfactual.engine.domain.service.forecast.ForecastConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static com.counterfactual.engine.support.SeriesFixtures.hourlyRows;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CounterfactualRunServiceTest {

    @Mock
    private CounterfactualEngine engine;

    @Mock
    private ComparisonService comparisonService;

    @Mock
    private CounterfactualRunLogger runLogger;

    @Mock
    private CounterfactualRunRepository runRepository;

    private CounterfactualProperties properties;
    private CounterfactualRunService service;

    @BeforeEach
    void setUp() {
        properties = new CounterfactualProperties();
        service = new CounterfactualRunService(engine, comparisonService, new EventParser(new ObjectMapper()),
                properties, runLogger, runRepository);
    }

    private static ForecastOptions options(Integer arOrder, String cyclePeriod, Double noiseFactor, String zone) {
        return new ForecastOptions(null, null, null, null, arOrder, cyclePeriod, null,
                null, null, noiseFactor, null, null, null, zone, null);
    }

    // --- Config merging ---

    @Test
    void testDefaultsComeFromProperties() {
        properties.setForecastDays(9);
        properties.setCyclePeriod("week");

        ForecastConfig config = service.configFor(null);

        assertEquals(9, config.getForecastDays());
        assertEquals(CyclePeriod.WEEK, config.getCyclePeriod());
        assertEquals(1, config.getArOrder());
        assertEquals(ZoneId.of("UTC"), config.getZone());
    }

    @Test
    void testRequestOverridesWin() {
        ForecastConfig config = service.configFor(options(3, "day", 0.1, "Asia/Seoul"));

        assertEquals(3, config.getArOrder());
        assertEquals(CyclePeriod.DAY, config.getCyclePeriod());
        assertEquals(0.1, config.getNoiseFactor());
        assertEquals(ZoneId.of("Asia/Seoul"), config.getZone());
        assertEquals(5, config.getForecastDays());
    }

    @Test
    void testInvalidOverridesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.configFor(options(null, null, null, "Mars/Base")));
        assertThrows(IllegalArgumentException.class, () -> service.configFor(options(null, "fortnight", null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.configFor(options(-1, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.configFor(options(null, null, 2.0, null)));
    }

    // --- Generate ---

    @Test
    @SuppressWarnings("unchecked")
    void testGenerateRunsEngineAndKeepsLatest() {
        CounterfactualRunReport report = CounterfactualRunReport.builder().runId("r1").build();
        when(engine.run(any(RawTable.class), anyList(), any(ForecastConfig.class))).thenReturn(report);

        GenerateRequest request = new GenerateRequest(hourlyRows("A", 10, i -> i), null,
                "promo:2024-01-01 05:00:2024-01-01 06:00", null);

        assertTrue(service.getLatest().isEmpty());
        assertSame(report, service.generate(request));
        assertSame(report, service.getLatest().orElseThrow());

        ArgumentCaptor<List<Event>> events = ArgumentCaptor.forClass(List.class);
        verify(engine).run(any(RawTable.class), events.capture(), any(ForecastConfig.class));
        assertEquals("promo", events.getValue().get(0).name());
        verify(runLogger).logRun(report);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testEventObjectsTakePrecedenceOverSpec() {
        when(engine.run(any(RawTable.class), anyList(), any(ForecastConfig.class)))
                .thenReturn(CounterfactualRunReport.builder().build());

        service.generate(new GenerateRequest(hourlyRows("A", 10, i -> i),
                List.of(new EventDefinition("obj", "2024-01-01 05:00", "2024-01-01 06:00", Map.of())),
                "not even parsed", null));

        ArgumentCaptor<List<Event>> events = ArgumentCaptor.forClass(List.class);
        verify(engine).run(any(RawTable.class), events.capture(), any(ForecastConfig.class));
        assertEquals(1, events.getValue().size());
        assertEquals("obj", events.getValue().get(0).name());
    }

    @Test
    void testGenerateRequiresEvents() {
        GenerateRequest request = new GenerateRequest(hourlyRows("A", 10, i -> i), List.of(), " ", null);

        assertThrows(IllegalArgumentException.class, () -> service.generate(request));
        verifyNoInteractions(engine, runLogger);
    }

    @Test
    void testEmptyRowsAreASchemaError() {
        GenerateRequest request = new GenerateRequest(List.of(), null, "e:2024-01-01:2024-01-02", null);

        SchemaException ex = assertThrows(SchemaException.class, () -> service.generate(request));
        assertEquals(SchemaException.Reason.EMPTY_TABLE, ex.getReason());
    }

    // --- Compare / history ---

    @Test
    void testCompareDelegatesWithoutFilter() {
        ComparisonReport expected = ComparisonReport.builder().build();
        when(comparisonService.compare(any(RawTable.class), any(RawTable.class), anyList(),
                any(ForecastConfig.class), eq(DifferenceFilter.NONE)))
                .thenReturn(expected);

        CompareRequest request = new CompareRequest(hourlyRows("A", 10, i -> i), hourlyRows("A", 2, i -> i),
                null, "e:2024-01-01:2024-01-02", null, null, null, null);

        assertSame(expected, service.compare(request));
    }

    @Test
    void testCompareFilterBoundsParsedInZone() {
        CompareRequest request = new CompareRequest(hourlyRows("A", 10, i -> i), hourlyRows("A", 2, i -> i),
                null, "e:2024-01-01:2024-01-02", options(null, null, null, "Asia/Karachi"),
                " north ", "2024-01-01 06:00", "2024-01-03");
        when(comparisonService.compare(any(RawTable.class), any(RawTable.class), anyList(),
                any(ForecastConfig.class), any(DifferenceFilter.class)))
                .thenReturn(ComparisonReport.builder().build());

        service.compare(request);

        ArgumentCaptor<DifferenceFilter> captor = ArgumentCaptor.forClass(DifferenceFilter.class);
        verify(comparisonService).compare(any(RawTable.class), any(RawTable.class), anyList(),
                any(ForecastConfig.class), captor.capture());
        DifferenceFilter filter = captor.getValue();
        assertEquals("north", filter.entity());
        assertEquals(Instant.parse("2024-01-01T01:00:00Z"), filter.from());
        // a date-only upper bound covers the whole local day
        assertEquals(Instant.parse("2024-01-03T18:59:59Z"), filter.to());
    }

    @Test
    void testInvertedFilterRangeIsRejected() {
        CompareRequest request = new CompareRequest(hourlyRows("A", 10, i -> i), hourlyRows("A", 2, i -> i),
                null, "e:2024-01-01:2024-01-02", null, null, "2024-01-05", "2024-01-02");

        assertThrows(IllegalArgumentException.class, () -> service.compare(request));
        verifyNoInteractions(comparisonService);
    }

    @Test
    void testRecentRunsReadRepository() {
        when(runRepository.findTop20ByOrderByCreatedEpochMsDesc()).thenReturn(List.of());

        assertTrue(service.recentRuns().isEmpty());
        verify(runRepository).findTop20ByOrderByCreatedEpochMsDesc();
    }
}
