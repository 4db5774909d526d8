package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chart Engine 计算结果。本服务只读取、存储，不会重新计算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChartFacts {

    private PlanetPosition sun;

    private PlanetPosition moon;

    private PlanetPosition rising;

    private PlanetPosition mercury;

    private PlanetPosition venus;

    private PlanetPosition mars;

    /** 主导元素：Fire | Earth | Air | Water */
    private String dominantElement;

    private String rulingPlanet;

    private String summary;
}
