package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个类别的重新生成用量。windowStart 为当前免费额度窗口的起点。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RegenerationUsage {

    private Long lastRegenAt;

    private Long windowStart;

    /** 当前窗口内已使用的免费次数 */
    private int freeUsed;

    /** 累计付费次数 */
    private int paidCount;
}
