package com.imperium.astrocompanion.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.astrocompanion.model.entity.DailyHoroscopeCache;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

public interface DailyHoroscopeCacheMapper extends BaseMapper<DailyHoroscopeCache> {

    /**
     * 插入或覆盖（last write wins）。
     */
    @Insert("INSERT INTO daily_horoscope_cache (cache_key, zodiac_sign, reference_date, payload_json, updated_at) "
            + "VALUES (#{e.cacheKey}, #{e.zodiacSign}, #{e.referenceDate}, #{e.payloadJson}, #{e.updatedAt}) "
            + "ON DUPLICATE KEY UPDATE payload_json = VALUES(payload_json), updated_at = VALUES(updated_at)")
    int upsert(@Param("e") DailyHoroscopeCache entry);
}
