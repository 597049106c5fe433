package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.*;
import com.railwise.backend.repository.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.railwise.backend.service.TestSchedules.*;
import static org.junit.jupiter.api.Assertions.*;

class DelaySimulationServiceTest {

    // Wednesday mid morning: time of day and day of week factors are both 1.0
    private static final LocalDateTime WEDNESDAY_1030 = LocalDateTime.of(2026, 10, 21, 10, 30);
    private static final LocalDateTime FRIDAY_1730 = LocalDateTime.of(2026, 10, 23, 17, 30);

    @Mock
    private ScheduleStore scheduleStore;

    private ScriptedRandomSource random;
    private DelaySimulationService delayService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        random = new ScriptedRandomSource();
        delayService = new DelaySimulationService(random, clockAt(WEDNESDAY_1030), scheduleStore);
    }

    @Test
    void testSynthesizeDelay_AppliesBaseAndJitter() {
        random.delay(10);

        DelayResult result = delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030,
                WeatherCondition.CLEAR);

        assertEquals(10, result.getDelayMinutes());
        assertEquals(WEDNESDAY_1030.plusMinutes(10), result.getActualTime());
        assertEquals(WeatherCondition.CLEAR, result.getWeatherCondition());
        assertEquals(1.0, result.getFactorsApplied().getWeather());
        assertEquals(1.0, result.getFactorsApplied().getTimeOfDay());
        assertEquals(1.0, result.getFactorsApplied().getDayOfWeek());
        assertEquals(1.0, result.getFactorsApplied().getStation());
    }

    @Test
    void testSynthesizeDelay_NoBaseDelayMeansOnTime() {
        random.noDelay();

        DelayResult result = delayService.synthesizeDelay("100", "Dhaka", WEDNESDAY_1030, WEDNESDAY_1030,
                WeatherCondition.STORMY);

        assertEquals(0, result.getDelayMinutes());
        assertEquals(WEDNESDAY_1030, result.getActualTime());
    }

    @Test
    void testSynthesizeDelay_ClampedToTwoHours() {
        random.delay(25);

        DelayResult result = delayService.synthesizeDelay("100", "Dhaka", FRIDAY_1730, FRIDAY_1730,
                WeatherCondition.STORMY);

        assertEquals(DelaySimulationService.MAX_DELAY_MINUTES, result.getDelayMinutes());
        assertEquals(1.6, result.getFactorsApplied().getTimeOfDay());
        assertEquals(1.4, result.getFactorsApplied().getDayOfWeek());
        assertEquals(1.5, result.getFactorsApplied().getStation());
    }

    @Test
    void testSynthesizeDelay_AlwaysWithinBounds() {
        DelaySimulationService withRealRandom = new DelaySimulationService(new ThreadLocalRandomSource(),
                clockAt(WEDNESDAY_1030), scheduleStore);
        for (int i = 0; i < 1000; i++) {
            int delay = withRealRandom.synthesizeDelay("100", "Dhaka", FRIDAY_1730, FRIDAY_1730,
                    WeatherCondition.STORMY).getDelayMinutes();
            assertTrue(delay >= 0 && delay <= 120, "delay out of range: " + delay);
        }
        assertEquals(DelaySimulationService.HISTORY_CAPACITY, withRealRandom.getHistory("100", "Dhaka").size());
    }

    @Test
    void testSynthesizeDelay_ConcurrentAppendsStayCapped() throws Exception {
        DelaySimulationService shared = new DelaySimulationService(new ThreadLocalRandomSource(),
                clockAt(WEDNESDAY_1030), scheduleStore);
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> results = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            results.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    shared.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.RAINY);
                    shared.getHistoricalStats("100", "Alpha");
                }
                return null;
            }));
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        for (Future<Object> result : results) {
            result.get();
        }

        assertEquals(DelaySimulationService.HISTORY_CAPACITY, shared.getHistory("100", "Alpha").size());
    }

    @Test
    void testHistory_EvictsOldestBeyondCapacity() {
        random.delay(10);
        for (int i = 0; i <= DelaySimulationService.HISTORY_CAPACITY; i++) {
            delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        }

        List<DelayObservation> history = delayService.getHistory("100", "Alpha");

        assertEquals(100, history.size());
        assertTrue(history.stream().allMatch(o -> o.getDelayMinutes() == 0), "first observation was not evicted");
    }

    @Test
    void testHistoricalStats_NoDataIsEmpty() {
        assertTrue(delayService.getHistoricalStats("100", "Alpha").isEmpty());
        assertTrue(delayService.getHistoricalStats("100", null).isEmpty());

        random.delay(10);
        delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        assertTrue(delayService.getHistoricalStats("100", "Bravo").isEmpty());
    }

    @Test
    void testHistoricalStats_PoolsStationsOfTrain() {
        random.delay(10).delay(16);
        delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        delayService.synthesizeDelay("100", "Bravo", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);

        DelayStatistics alpha = delayService.getHistoricalStats("100", "Alpha").orElseThrow();
        DelayStatistics pooled = delayService.getHistoricalStats("100", null).orElseThrow();

        assertEquals(1, alpha.getTotalDelays());
        assertEquals(2, pooled.getTotalDelays());
        assertEquals(16, pooled.getMaxDelay());
        assertEquals(10, pooled.getMinDelay());
        assertEquals(13.0, pooled.getAverageDelay());
    }

    @Test
    void testSummarize_DistributionCoversEveryDelay() {
        DelayStatistics stats = DelaySimulationService.summarize(List.of(0, 15, 16, 30, 31, 60, 61, 120));

        assertEquals(8, stats.getTotalDelays());
        assertEquals(41.6, stats.getAverageDelay());
        assertEquals(120, stats.getMaxDelay());
        assertEquals(0, stats.getMinDelay());
        assertEquals(List.of("0-15 min", "16-30 min", "31-60 min", "60+ min"),
                List.copyOf(stats.getDelayDistribution().keySet()));
        stats.getDelayDistribution().values().forEach(count -> assertEquals(2, count));
        assertEquals(8, stats.getDelayDistribution().values().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void testPredict_NoHistoryFallsBack() {
        DelayPrediction prediction = delayService.predictDelayProbability("100", "Alpha", WEDNESDAY_1030);

        assertEquals(0.3, prediction.getDelayProbability());
        assertEquals(Confidence.LOW, prediction.getConfidence());
        assertEquals(0, prediction.getHistoricalDataPoints());
    }

    @Test
    void testPredict_ClampedAndConfidenceFromHistorySize() {
        for (int i = 0; i < 20; i++) {
            random.delay(10);
            delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        }

        DelayPrediction prediction = delayService.predictDelayProbability("100", "Alpha", WEDNESDAY_1030);

        assertEquals(0.9, prediction.getDelayProbability());
        assertEquals(Confidence.MEDIUM, prediction.getConfidence());
        assertEquals(20, prediction.getHistoricalDataPoints());
    }

    @Test
    void testPredict_ScalesByScheduledTime() {
        for (int i = 0; i < 10; i++) {
            random.delay(10).noDelay();
            delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
            delayService.synthesizeDelay("100", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        }

        // Sunday night: 0.5 * 0.9 * 0.8
        DelayPrediction prediction = delayService.predictDelayProbability("100", "Alpha",
                LocalDateTime.of(2026, 10, 25, 23, 0));

        assertEquals(0.36, prediction.getDelayProbability());
        assertEquals(Confidence.MEDIUM, prediction.getConfidence());
    }

    @Test
    void testWeather_DaytimeDistribution() {
        random.doubles(0.1, 0.7, 0.95);

        assertEquals(WeatherCondition.CLEAR, delayService.getWeatherCondition("Dhaka"));
        assertEquals(WeatherCondition.CLOUDY, delayService.getWeatherCondition("Dhaka"));
        assertEquals(WeatherCondition.RAINY, delayService.getWeatherCondition(null));
    }

    @Test
    void testWeather_NightCanBeFoggyNeverRainy() {
        DelaySimulationService night = new DelaySimulationService(random,
                clockAt(LocalDateTime.of(2026, 10, 21, 23, 0)), scheduleStore);
        random.doubles(0.65, 0.8, 0.95);

        assertEquals(WeatherCondition.CLEAR, night.getWeatherCondition("Sylhet"));
        assertEquals(WeatherCondition.CLOUDY, night.getWeatherCondition("Sylhet"));
        assertEquals(WeatherCondition.FOGGY, night.getWeatherCondition("Sylhet"));
    }

    @Test
    void testFactorTables() {
        assertEquals(0.8, DelaySimulationService.getTimeOfDayFactor(5));
        assertEquals(1.4, DelaySimulationService.getTimeOfDayFactor(9));
        assertEquals(1.2, DelaySimulationService.getTimeOfDayFactor(21));
        assertEquals(0.9, DelaySimulationService.getTimeOfDayFactor(2));
        assertEquals(1.3, DelaySimulationService.getDayOfWeekFactor(DayOfWeek.MONDAY));
        assertEquals(0.8, DelaySimulationService.getDayOfWeekFactor(DayOfWeek.SUNDAY));
    }

    @Test
    void testSimulateRoute_CarriesDelayForward() {
        stubSchedule(scheduleStore, threeStopSchedule());
        random.doubles(0.1).delay(10).doubles(0.1).noDelay();

        RouteSimulation simulation = delayService.simulateRouteDelays("100", WEDNESDAY_1030);

        assertEquals(3, simulation.getStops().size());
        SimulatedStop alpha = simulation.getStops().get(0);
        assertEquals(10, alpha.getSimulatedDelay().getDelayMinutes());
        assertEquals(LocalDateTime.of(2026, 10, 21, 9, 10), alpha.getSimulatedDelay().getActualTime());
        assertEquals(WeatherCondition.CLEAR, alpha.getWeatherCondition());
        assertEquals(0, simulation.getStops().get(1).getSimulatedDelay().getDelayMinutes());
        assertNull(simulation.getStops().get(2).getSimulatedDelay());
        assertEquals("Charlie", simulation.getStops().get(2).getStop().getCity());
        assertEquals(1, delayService.getHistory(DelaySimulationService.ROUTE_SIMULATION_KEY, "Alpha").size());
    }

    @Test
    void testSimulateRoute_UnknownTrain() {
        assertThrows(TrainNotFoundException.class,
                () -> delayService.simulateRouteDelays("999", WEDNESDAY_1030));
    }

    @Test
    void testOverallStats() {
        random.delay(10).noDelay();
        delayService.synthesizeDelay("1", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);
        delayService.synthesizeDelay("2", "Alpha", WEDNESDAY_1030, WEDNESDAY_1030, WeatherCondition.CLEAR);

        OverallDelayStats stats = delayService.getOverallStats(List.of("1", "2", "3"));

        assertEquals(3, stats.getTotalTrains());
        assertEquals(1, stats.getTrainsWithDelays());
        assertEquals(5.0, stats.getAverageDelay());
    }
}
