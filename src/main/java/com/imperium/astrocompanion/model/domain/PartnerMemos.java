package com.imperium.astrocompanion.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 同一 partnerKey 下的两个独立槽位：brief 与 full。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PartnerMemos {

    private String partnerName;

    private String partnerDate;

    private PartnerMemo brief;

    private PartnerMemo full;

    public PartnerMemos(String partnerName, String partnerDate) {
        this.partnerName = partnerName;
        this.partnerDate = partnerDate;
    }

    public PartnerMemo get(MemoMode mode) {
        return mode == MemoMode.FULL ? full : brief;
    }

    public void put(MemoMode mode, PartnerMemo memo) {
        if (mode == MemoMode.FULL) {
            this.full = memo;
        } else {
            this.brief = memo;
        }
    }
}
