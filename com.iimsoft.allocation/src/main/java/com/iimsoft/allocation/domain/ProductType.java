package com.iimsoft.allocation.domain;

import java.util.Locale;

/**
 * 受约束的两种子件
 */
public enum ProductType {
    SUBCOMPONENT_A("A", "SUBCOMPONENT_1"),
    SUBCOMPONENT_B("B", "SUBCOMPONENT_2");

    private final String shortCode;
    private final String legacyCode;

    ProductType(String shortCode, String legacyCode) {
        this.shortCode = shortCode;
        this.legacyCode = legacyCode;
    }

    public static ProductType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("product type is missing");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (ProductType type : values()) {
            if (type.name().equals(normalized) || type.shortCode.equals(normalized)
                    || type.legacyCode.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidInputException("unknown product type: " + code);
    }
}
