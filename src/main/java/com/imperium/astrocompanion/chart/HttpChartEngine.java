package com.imperium.astrocompanion.chart;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * 远程星盘服务：POST {baseUrl}/natal-chart，请求体为出生信息，响应体为 {@link ChartFacts} JSON。
 */
public class HttpChartEngine implements ChartEngine {

    private static final Logger log = LoggerFactory.getLogger(HttpChartEngine.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpChartEngine(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public ChartFacts computeChart(BirthFacts birth, Language language) {
        Map<String, Object> body = new HashMap<>();
        body.put("name", birth.getName());
        body.put("birthDate", String.valueOf(birth.getBirthDate()));
        body.put("birthTime", birth.getBirthTime());
        body.put("birthPlace", birth.getBirthPlace());
        body.put("language", language != null ? language.tag() : Language.EN.tag());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        long startMs = System.currentTimeMillis();
        try {
            ResponseEntity<ChartFacts> response = restTemplate.postForEntity(
                    baseUrl + "/natal-chart", new HttpEntity<>(body, headers), ChartFacts.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new ChartEngineException("Chart engine returned " + response.getStatusCode());
            }
            log.info("Chart computed in {} ms", System.currentTimeMillis() - startMs);
            return response.getBody();
        } catch (RestClientException e) {
            throw new ChartEngineException("Chart engine call failed: " + e.getMessage(), e);
        }
    }
}
