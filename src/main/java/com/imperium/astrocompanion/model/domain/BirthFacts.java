package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 出生信息：用户本人或合盘对象共用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BirthFacts {

    private String name;

    private LocalDate birthDate;

    /** HH:mm，可为空 */
    private String birthTime;

    private String birthPlace;
}
