package com.imperium.astrocompanion.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class PartnerMemo {

    private String text;

    /** 生成时间（epoch 毫秒） */
    private long generatedAt;
}
