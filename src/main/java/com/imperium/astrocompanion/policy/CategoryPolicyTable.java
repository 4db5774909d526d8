package com.imperium.astrocompanion.policy;

import com.imperium.astrocompanion.model.domain.ContentCategory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * category -> {kind, allowance, period} 的唯一策略表。生成、缓存与重新生成都从这里读取规则。
 */
public class CategoryPolicyTable {

    private final Map<ContentCategory, CategoryPolicy> policies;

    public CategoryPolicyTable(Map<ContentCategory, CategoryPolicy> policies) {
        EnumMap<ContentCategory, CategoryPolicy> copy = new EnumMap<>(ContentCategory.class);
        copy.putAll(policies);
        for (ContentCategory category : ContentCategory.values()) {
            if (!copy.containsKey(category)) {
                throw new IllegalArgumentException("Missing policy for category " + category.key());
            }
        }
        this.policies = Collections.unmodifiableMap(copy);
    }

    public static final Duration DEFAULT_WEEKLY_PERIOD = Duration.ofDays(7);
    public static final Duration DEFAULT_MONTHLY_PERIOD = Duration.ofDays(30);

    /**
     * 默认策略：
     * <ul>
     *     <li>natal_intro、three_keys 与 deep_dive_* 只生成一次</li>
     *     <li>daily_horoscope 每个参考日刷新</li>
     *     <li>weekly_horoscope 每 7 天、monthly_horoscope 每 30 天刷新</li>
     *     <li>transit_forecast 仅付费</li>
     * </ul>
     * 所有可重新生成的类别使用同一个 allowance；按计划刷新的类别不可重新生成。
     */
    public static CategoryPolicyTable defaults(RegenerationAllowance allowance) {
        Map<ContentCategory, CategoryPolicy> map = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.values()) {
            map.put(category, switch (category) {
                case DAILY_HOROSCOPE -> new CategoryPolicy(CategoryKind.DAILY_SCHEDULED, null);
                case WEEKLY_HOROSCOPE -> new CategoryPolicy(CategoryKind.PERIODIC, null, DEFAULT_WEEKLY_PERIOD);
                case MONTHLY_HOROSCOPE -> new CategoryPolicy(CategoryKind.PERIODIC, null, DEFAULT_MONTHLY_PERIOD);
                case TRANSIT_FORECAST -> new CategoryPolicy(CategoryKind.PAID_ONLY, allowance);
                default -> new CategoryPolicy(CategoryKind.ONE_TIME, allowance);
            });
        }
        return new CategoryPolicyTable(map);
    }

    public CategoryPolicy policyOf(ContentCategory category) {
        return policies.get(category);
    }

    public CategoryKind kindOf(ContentCategory category) {
        return policies.get(category).kind();
    }

    /**
     * 首次生成时需要填充的类别（排除 PAID_ONLY）。
     */
    public boolean generatedOnSetup(ContentCategory category) {
        return kindOf(category) != CategoryKind.PAID_ONLY;
    }

    public CategoryPolicyTable withAllowance(ContentCategory category, RegenerationAllowance allowance) {
        CategoryPolicy current = policyOf(category);
        Map<ContentCategory, CategoryPolicy> map = new EnumMap<>(policies);
        map.put(category, new CategoryPolicy(current.kind(), allowance, current.period()));
        return new CategoryPolicyTable(map);
    }

    /**
     * 调整 PERIODIC 类别的刷新周期。
     *
     * @throws IllegalArgumentException 类别不是按周期刷新
     */
    public CategoryPolicyTable withPeriod(ContentCategory category, Duration period) {
        CategoryPolicy current = policyOf(category);
        if (current.kind() != CategoryKind.PERIODIC) {
            throw new IllegalArgumentException(category.key() + " is not refreshed periodically");
        }
        Map<ContentCategory, CategoryPolicy> map = new EnumMap<>(policies);
        map.put(category, new CategoryPolicy(CategoryKind.PERIODIC, current.allowance(), period));
        return new CategoryPolicyTable(map);
    }

    /**
     * 访问时按周期惰性刷新的类别。
     */
    public List<ContentCategory> periodicCategories() {
        List<ContentCategory> result = new ArrayList<>();
        policies.forEach((category, policy) -> {
            if (policy.kind() == CategoryKind.PERIODIC) {
                result.add(category);
            }
        });
        return result;
    }
}
