package com.imperium.astrocompanion.config;

import com.imperium.astrocompanion.chart.ApproximateChartEngine;
import com.imperium.astrocompanion.chart.ChartEngine;
import com.imperium.astrocompanion.chart.HttpChartEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 配置了 app.chart-engine.base-url 时使用远程星盘服务，否则使用按日期近似的本地实现。
 */
@Configuration
public class ChartEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ChartEngineConfig.class);

    @Bean
    public ChartEngine chartEngine(RestTemplateBuilder restTemplateBuilder,
                                   @Value("${app.chart-engine.base-url:}") String baseUrl,
                                   @Value("${app.chart-engine.timeout:PT20S}") Duration timeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("app.chart-engine.base-url not set, using approximate sun-sign chart engine");
            return new ApproximateChartEngine();
        }
        log.info("Using remote chart engine at {}", baseUrl);
        return new HttpChartEngine(restTemplateBuilder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build(), baseUrl);
    }
}
