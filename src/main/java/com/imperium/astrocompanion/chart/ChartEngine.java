package com.imperium.astrocompanion.chart;

import com.imperium.astrocompanion.model.domain.BirthFacts;
import com.imperium.astrocompanion.model.domain.ChartFacts;
import com.imperium.astrocompanion.model.domain.Language;

/**
 * 外部星盘计算服务。结果对本服务不透明，只在首次建档时调用一次。
 */
public interface ChartEngine {

    ChartFacts computeChart(BirthFacts birth, Language language);
}
