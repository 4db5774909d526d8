package com.imperium.astrocompanion.policy;

import com.imperium.astrocompanion.model.domain.ContentCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * 纯函数：判断某个类别的缓存内容是否需要（重新）生成。
 * <ul>
 *     <li>ONE_TIME：仅在从未生成过时为 true</li>
 *     <li>DAILY_SCHEDULED：从未生成、参考日变化、或距上次生成已满 24 小时</li>
 *     <li>PERIODIC：从未生成，或距上次生成已满该类别的周期</li>
 *     <li>PAID_ONLY：自动路径永远为 false</li>
 * </ul>
 */
public class FreshnessPolicyEvaluator {

    static final Duration DAILY_SAFETY_WINDOW = Duration.ofHours(24);

    private final CategoryPolicyTable policyTable;
    private final ReferenceDayCalculator referenceDays;

    public FreshnessPolicyEvaluator(CategoryPolicyTable policyTable, ReferenceDayCalculator referenceDays) {
        this.policyTable = policyTable;
        this.referenceDays = referenceDays;
    }

    public boolean isDue(ContentCategory category, OptionalLong lastTimestamp, Instant now) {
        return switch (policyTable.kindOf(category)) {
            case ONE_TIME -> lastTimestamp.isEmpty();
            case PAID_ONLY -> false;
            case DAILY_SCHEDULED -> isDailyDue(lastTimestamp, now);
            case PERIODIC -> lastTimestamp.isEmpty()
                    || elapsed(lastTimestamp, now).compareTo(policyTable.policyOf(category).period()) >= 0;
        };
    }

    private static Duration elapsed(OptionalLong lastTimestamp, Instant now) {
        return Duration.between(Instant.ofEpochMilli(lastTimestamp.getAsLong()), now);
    }

    private boolean isDailyDue(OptionalLong lastTimestamp, Instant now) {
        if (lastTimestamp.isEmpty()) {
            return true;
        }
        Instant last = Instant.ofEpochMilli(lastTimestamp.getAsLong());
        if (!referenceDays.referenceDay(now).equals(referenceDays.referenceDay(last))) {
            return true;
        }
        // 时钟或时区异常时的兜底
        return Duration.between(last, now).compareTo(DAILY_SAFETY_WINDOW) >= 0;
    }

    public ReferenceDayCalculator referenceDays() {
        return referenceDays;
    }

    public CategoryPolicyTable policyTable() {
        return policyTable;
    }
}
