package com.imperium.astrocompanion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.astrocompanion.mapper.DailyHoroscopeCacheMapper;
import com.imperium.astrocompanion.model.domain.DailyForecast;
import com.imperium.astrocompanion.model.domain.ZodiacSign;
import com.imperium.astrocompanion.model.entity.DailyHoroscopeCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * daily_horoscope_cache 表上的共享缓存。写入为 upsert，无锁。
 */
@Component
public class MybatisDailyForecastCache implements DailyForecastCache {

    private static final Logger log = LoggerFactory.getLogger(MybatisDailyForecastCache.class);

    private final DailyHoroscopeCacheMapper cacheMapper;
    private final ObjectMapper objectMapper;

    public MybatisDailyForecastCache(DailyHoroscopeCacheMapper cacheMapper, ObjectMapper objectMapper) {
        this.cacheMapper = cacheMapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<DailyForecast> get(ZodiacSign sign, LocalDate referenceDate) {
        DailyHoroscopeCache row = cacheMapper.selectById(cacheKey(sign, referenceDate));
        if (row == null || row.getPayloadJson() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(row.getPayloadJson(), DailyForecast.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable horoscope cache entry {}: {}", row.getCacheKey(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(ZodiacSign sign, LocalDate referenceDate, DailyForecast forecast) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(forecast);
        } catch (JsonProcessingException e) {
            throw new ProfilePersistenceException("Failed to serialize forecast for " + sign, e);
        }
        DailyHoroscopeCache row = new DailyHoroscopeCache(
                cacheKey(sign, referenceDate), sign.name(), referenceDate, payload, LocalDateTime.now());
        cacheMapper.upsert(row);
        log.info("Shared horoscope cached for {} on {}", sign, referenceDate);
    }

    static String cacheKey(ZodiacSign sign, LocalDate referenceDate) {
        return sign.name() + ":" + referenceDate;
    }
}
