package com.railwise.backend.service;

import com.railwise.backend.exception.TrainNotFoundException;
import com.railwise.backend.model.*;
import com.railwise.backend.repository.ScheduleStore;
import com.railwise.backend.util.RailwayUtils;
import com.railwise.backend.util.ScheduleTimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Synthetic delay model. Delays are generated, not measured: a random base
 * delay scaled by weather, time of day, day of week and station factors.
 * Every generated delay is kept in a bounded per-(train, station) history
 * that feeds the statistics and the delay-probability estimate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DelaySimulationService {

    public static final int HISTORY_CAPACITY = 100;
    public static final int MAX_DELAY_MINUTES = 120;
    public static final String ROUTE_SIMULATION_KEY = "ROUTE_SIMULATION";

    private static final double BASE_DELAY_PROBABILITY = 0.3;
    private static final int BASE_DELAY_MIN = 5;
    private static final int BASE_DELAY_MAX = 25;

    private static final Map<DayOfWeek, Double> DAY_FACTORS = Map.of(
            DayOfWeek.MONDAY, 1.3,
            DayOfWeek.TUESDAY, 1.1,
            DayOfWeek.WEDNESDAY, 1.0,
            DayOfWeek.THURSDAY, 1.1,
            DayOfWeek.FRIDAY, 1.4,
            DayOfWeek.SATURDAY, 0.9,
            DayOfWeek.SUNDAY, 0.8);

    private final RandomSource random;
    private final Clock clock;
    private final ScheduleStore scheduleStore;

    // trainNumber -> station -> bounded history
    private final Map<String, Map<String, DelayHistory>> history = new ConcurrentHashMap<>();

    public DelayResult synthesizeDelay(String trainNumber, String station, LocalDateTime scheduledTime,
            LocalDateTime now, WeatherCondition weather) {
        WeatherCondition condition = weather != null ? weather : WeatherCondition.CLEAR;

        int baseDelay = random.nextDouble() < BASE_DELAY_PROBABILITY
                ? random.nextInt(BASE_DELAY_MIN, BASE_DELAY_MAX)
                : 0;

        double weatherFactor = condition.getDelayFactor();
        double timeFactor = getTimeOfDayFactor(now.getHour());
        double dayFactor = getDayOfWeekFactor(now.getDayOfWeek());
        double stationFactor = RailwayUtils.getStationDelayFactor(station);

        double scaled = baseDelay * weatherFactor * timeFactor * dayFactor * stationFactor;
        int delay = (int) (scaled * random.uniform(0.8, 1.2));
        delay = Math.max(0, Math.min(delay, MAX_DELAY_MINUTES));

        record(trainNumber, station, delay);

        return DelayResult.builder()
                .delayMinutes(delay)
                .scheduledTime(scheduledTime)
                .actualTime(scheduledTime.plusMinutes(delay))
                .weatherCondition(condition)
                .factorsApplied(DelayFactors.builder()
                        .weather(weatherFactor)
                        .timeOfDay(timeFactor)
                        .dayOfWeek(dayFactor)
                        .station(stationFactor)
                        .build())
                .build();
    }

    /**
     * Statistics over the recorded delays of a train, at one station or pooled
     * over all its stations. Empty when nothing has been recorded.
     */
    public Optional<DelayStatistics> getHistoricalStats(String trainNumber, String station) {
        Map<String, DelayHistory> buckets = history.get(trainNumber);
        if (buckets == null) {
            return Optional.empty();
        }

        List<Integer> delays;
        if (station != null) {
            DelayHistory bucket = buckets.get(station);
            if (bucket == null) {
                return Optional.empty();
            }
            delays = bucket.delays();
        } else {
            delays = buckets.values().stream()
                    .flatMap(bucket -> bucket.delays().stream())
                    .collect(Collectors.toList());
        }

        if (delays.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(summarize(delays));
    }

    public static DelayStatistics summarize(List<Integer> delays) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("0-15 min", 0);
        distribution.put("16-30 min", 0);
        distribution.put("31-60 min", 0);
        distribution.put("60+ min", 0);

        for (int delay : delays) {
            String bucket;
            if (delay <= 15) {
                bucket = "0-15 min";
            } else if (delay <= 30) {
                bucket = "16-30 min";
            } else if (delay <= 60) {
                bucket = "31-60 min";
            } else {
                bucket = "60+ min";
            }
            distribution.merge(bucket, 1, Integer::sum);
        }

        IntSummaryStatistics summary = delays.stream().mapToInt(Integer::intValue).summaryStatistics();
        return DelayStatistics.builder()
                .totalDelays((int) summary.getCount())
                .averageDelay(RailwayUtils.round(summary.getAverage(), 1))
                .maxDelay(summary.getMax())
                .minDelay(summary.getMin())
                .delayDistribution(distribution)
                .build();
    }

    public DelayPrediction predictDelayProbability(String trainNumber, String station, LocalDateTime scheduledTime) {
        List<DelayObservation> observations = getHistory(trainNumber, station);
        if (observations.isEmpty()) {
            return DelayPrediction.fallback();
        }

        int total = observations.size();
        long delayed = observations.stream().filter(o -> o.getDelayMinutes() > 0).count();
        double historicalProbability = (double) delayed / total;

        double timeFactor = getTimeOfDayFactor(scheduledTime.getHour());
        double dayFactor = getDayOfWeekFactor(scheduledTime.getDayOfWeek());
        double adjusted = Math.max(0.1, Math.min(historicalProbability * timeFactor * dayFactor, 0.9));

        return DelayPrediction.builder()
                .delayProbability(RailwayUtils.round(adjusted, 3))
                .confidence(Confidence.fromHistorySize(total))
                .historicalDataPoints(total)
                .factorsApplied(DelayFactors.builder()
                        .timeOfDay(timeFactor)
                        .dayOfWeek(dayFactor)
                        .build())
                .build();
    }

    /**
     * Simulated weather. Only the current hour shapes the distribution; the
     * location is accepted for a future weather feed and ignored for now.
     */
    public WeatherCondition getWeatherCondition(String location) {
        int hour = LocalTime.now(clock).getHour();
        double roll = random.nextDouble();

        if (hour >= 6 && hour <= 18) {
            if (roll < 0.6) {
                return WeatherCondition.CLEAR;
            }
            return roll < 0.9 ? WeatherCondition.CLOUDY : WeatherCondition.RAINY;
        }
        if (roll < 0.7) {
            return WeatherCondition.CLEAR;
        }
        return roll < 0.9 ? WeatherCondition.CLOUDY : WeatherCondition.FOGGY;
    }

    /**
     * Walks a train's route from {@code startTime}, carrying each stop's
     * simulated departure forward as the clock for the next stop.
     */
    public RouteSimulation simulateRouteDelays(String trainNumber, LocalDateTime startTime) {
        TrainSchedule schedule = scheduleStore.getSchedule(trainNumber)
                .orElseThrow(() -> new TrainNotFoundException(trainNumber));

        List<SimulatedStop> simulated = new ArrayList<>();
        LocalDateTime currentTime = startTime;

        for (Stop stop : schedule.getRoutes()) {
            Optional<LocalDateTime> departure = ScheduleTimeUtils.parseOn(stop.getDepartureTime(),
                    startTime.toLocalDate());
            if (departure.isEmpty()) {
                simulated.add(SimulatedStop.builder().stop(stop).build());
                continue;
            }

            WeatherCondition weather = getWeatherCondition(stop.getCity());
            DelayResult delay = synthesizeDelay(ROUTE_SIMULATION_KEY, stop.getCity(), departure.get(),
                    currentTime, weather);
            simulated.add(SimulatedStop.builder()
                    .stop(stop)
                    .simulatedDelay(delay)
                    .weatherCondition(weather)
                    .build());
            currentTime = delay.getActualTime();
        }

        log.info("🎲 Simulated {} stops for train {}", simulated.size(), trainNumber);
        return RouteSimulation.builder()
                .trainNumber(trainNumber)
                .trainName(schedule.getTrainName())
                .startTime(startTime)
                .stops(simulated)
                .build();
    }

    public OverallDelayStats getOverallStats(List<String> trainNumbers) {
        int trainsWithDelays = 0;
        long sum = 0;
        long count = 0;

        for (String trainNumber : trainNumbers) {
            Map<String, DelayHistory> buckets = history.get(trainNumber);
            if (buckets == null) {
                continue;
            }
            boolean delayed = false;
            for (DelayHistory bucket : buckets.values()) {
                for (int delay : bucket.delays()) {
                    sum += delay;
                    count++;
                    delayed |= delay > 0;
                }
            }
            if (delayed) {
                trainsWithDelays++;
            }
        }

        return OverallDelayStats.builder()
                .totalTrains(trainNumbers.size())
                .trainsWithDelays(trainsWithDelays)
                .averageDelay(count == 0 ? 0.0 : RailwayUtils.round((double) sum / count, 1))
                .build();
    }

    /**
     * Copy of the recorded observations, oldest first.
     */
    public List<DelayObservation> getHistory(String trainNumber, String station) {
        Map<String, DelayHistory> buckets = history.get(trainNumber);
        if (buckets == null || station == null) {
            return Collections.emptyList();
        }
        DelayHistory bucket = buckets.get(station);
        return bucket == null ? Collections.emptyList() : bucket.snapshot();
    }

    public static double getTimeOfDayFactor(int hour) {
        if (hour >= 5 && hour < 8) {
            return 0.8; // early morning
        } else if (hour >= 8 && hour < 10) {
            return 1.4; // morning rush
        } else if (hour >= 10 && hour < 12) {
            return 1.0; // mid morning
        } else if (hour >= 12 && hour < 17) {
            return 1.1; // afternoon
        } else if (hour >= 17 && hour < 20) {
            return 1.6; // evening rush
        } else if (hour >= 20 && hour < 22) {
            return 1.2; // late evening
        }
        return 0.9; // night
    }

    public static double getDayOfWeekFactor(DayOfWeek day) {
        return DAY_FACTORS.getOrDefault(day, 1.0);
    }

    private void record(String trainNumber, String station, int delay) {
        history.computeIfAbsent(trainNumber, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(station, k -> new DelayHistory(HISTORY_CAPACITY))
                .add(new DelayObservation(delay, Instant.now(clock)));
    }

    /**
     * Fixed-capacity FIFO; the oldest observation is evicted on overflow.
     */
    private static final class DelayHistory {
        private final int capacity;
        private final Deque<DelayObservation> observations;

        DelayHistory(int capacity) {
            this.capacity = capacity;
            this.observations = new ArrayDeque<>(capacity);
        }

        synchronized void add(DelayObservation observation) {
            if (observations.size() == capacity) {
                observations.removeFirst();
            }
            observations.addLast(observation);
        }

        synchronized List<DelayObservation> snapshot() {
            return new ArrayList<>(observations);
        }

        synchronized List<Integer> delays() {
            return observations.stream()
                    .map(DelayObservation::getDelayMinutes)
                    .collect(Collectors.toList());
        }
    }
}
