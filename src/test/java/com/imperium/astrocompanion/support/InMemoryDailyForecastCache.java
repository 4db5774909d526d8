package com.imperium.astrocompanion.support;

import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.store.DailyForecastCache;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryDailyForecastCache implements DailyForecastCache {

    private final Map<String, DailyForecast> entries = new ConcurrentHashMap<>();
    private final AtomicInteger puts = new AtomicInteger();

    @Override
    public Optional<DailyForecast> get(ZodiacSign sign, LocalDate referenceDate) {
        return Optional.ofNullable(entries.get(key(sign, referenceDate)));
    }

    @Override
    public void put(ZodiacSign sign, LocalDate referenceDate, DailyForecast forecast) {
        puts.incrementAndGet();
        entries.put(key(sign, referenceDate), forecast);
    }

    public int putCount() {
        return puts.get();
    }

    public int size() {
        return entries.size();
    }

    private static String key(ZodiacSign sign, LocalDate date) {
        return sign.name() + ":" + date;
    }
}
