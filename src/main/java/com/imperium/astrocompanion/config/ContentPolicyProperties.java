package com.imperium.astrocompanion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内容刷新与重新生成策略的配置，前缀 app.content。
 */
@Data
@ConfigurationProperties(prefix = "app.content")
public class ContentPolicyProperties {

    /** 参考日所在时区 */
    private String referenceZone = "Europe/Moscow";

    /** 午夜后的宽限期，宽限期内仍算前一天 */
    private Duration dayGrace = Duration.ofMinutes(1);

    /** 所有可重新生成类别的默认额度 */
    private Allowance regeneration = new Allowance();

    /** 按类别 key（如 natal_intro）覆盖默认额度 */
    private Map<String, Allowance> regenerationOverrides = new LinkedHashMap<>();

    /** 周期类别（weekly_horoscope、monthly_horoscope）的刷新周期，未配置时用默认值 */
    private Map<String, Duration> refreshPeriods = new LinkedHashMap<>();

    /** 首次生成 fan-out 的线程数 */
    private int generationThreads = 8;

    @Data
    public static class Allowance {

        private int freeQuota = 1;

        private Duration window = Duration.ofDays(1);

        /** 单次付费价格（星星） */
        private int price = 50;
    }
}
