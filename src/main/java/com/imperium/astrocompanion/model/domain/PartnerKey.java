package com.imperium.astrocompanion.model.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * 合盘对象的确定性标识：normalize(name) + "_" + birthDate，normalize = trim + 小写。
 */
public final class PartnerKey {

    private final String value;

    private PartnerKey(String value) {
        this.value = value;
    }

    public static PartnerKey of(String partnerName, String partnerDate) {
        Objects.requireNonNull(partnerName, "partnerName");
        Objects.requireNonNull(partnerDate, "partnerDate");
        return new PartnerKey(partnerName.trim().toLowerCase(Locale.ROOT) + "_" + partnerDate.trim());
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PartnerKey other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
