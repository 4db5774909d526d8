package com.imperium.astrocompanion.config;

import com.imperium.astrocompanion.model.domain.ContentCategory;
import com.imperium.astrocompanion.policy.CategoryPolicyTable;
import com.imperium.astrocompanion.policy.FreshnessPolicyEvaluator;
import com.imperium.astrocompanion.policy.ReferenceDayCalculator;
import com.imperium.astrocompanion.policy.RegenerationAllowance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(ContentPolicyProperties.class)
public class PolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CategoryPolicyTable categoryPolicyTable(ContentPolicyProperties properties) {
        CategoryPolicyTable table = CategoryPolicyTable.defaults(toAllowance(properties.getRegeneration()));
        for (Map.Entry<String, ContentPolicyProperties.Allowance> e : properties.getRegenerationOverrides().entrySet()) {
            ContentCategory category = ContentCategory.fromKey(e.getKey());
            if (!table.policyOf(category).regenerable()) {
                throw new IllegalStateException("Category " + e.getKey() + " cannot be regenerated");
            }
            table = table.withAllowance(category, toAllowance(e.getValue()));
            log.info("Regeneration allowance for {}: {} free per {}, price {}", category.key(),
                    e.getValue().getFreeQuota(), e.getValue().getWindow(), e.getValue().getPrice());
        }
        for (Map.Entry<String, Duration> e : properties.getRefreshPeriods().entrySet()) {
            ContentCategory category = ContentCategory.fromKey(e.getKey());
            try {
                table = table.withPeriod(category, e.getValue());
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Invalid refresh period for " + e.getKey() + ": " + ex.getMessage(), ex);
            }
            log.info("Refresh period for {}: {}", category.key(), e.getValue());
        }
        return table;
    }

    @Bean
    public ReferenceDayCalculator referenceDayCalculator(ContentPolicyProperties properties) {
        return new ReferenceDayCalculator(ZoneId.of(properties.getReferenceZone()), properties.getDayGrace());
    }

    @Bean
    public FreshnessPolicyEvaluator freshnessPolicyEvaluator(CategoryPolicyTable table,
                                                             ReferenceDayCalculator referenceDayCalculator) {
        return new FreshnessPolicyEvaluator(table, referenceDayCalculator);
    }

    private static RegenerationAllowance toAllowance(ContentPolicyProperties.Allowance a) {
        return new RegenerationAllowance(a.getFreeQuota(), a.getWindow(), a.getPrice());
    }
}
