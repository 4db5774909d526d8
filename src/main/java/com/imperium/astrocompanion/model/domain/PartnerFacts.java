package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 合盘对象信息。除 name / birthDate 外均为可选。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartnerFacts {

    private String name;

    /** yyyy-MM-dd，原样参与 partnerKey 计算 */
    private String birthDate;

    private String birthTime;

    private String birthPlace;

    /** 关系类型，如 romantic / friendship / business */
    private String relationshipType;

    public PartnerKey key() {
        return PartnerKey.of(name, birthDate);
    }
}
