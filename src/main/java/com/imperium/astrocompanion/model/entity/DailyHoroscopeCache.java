package com.imperium.astrocompanion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 按 (星座, 参考日) 共享的每日运势缓存，对应 daily_horoscope_cache 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("daily_horoscope_cache")
public class DailyHoroscopeCache {

    /** 缓存键：sign:yyyy-MM-dd */
    @TableId("cache_key")
    private String cacheKey;

    @TableField("zodiac_sign")
    private String zodiacSign;

    @TableField("reference_date")
    private LocalDate referenceDate;

    /** 运势内容（JSON） */
    @TableField("payload_json")
    private String payloadJson;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
