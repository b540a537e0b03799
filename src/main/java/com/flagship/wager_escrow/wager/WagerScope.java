package com.flagship.wager_escrow.wager;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Listing filter for {@code GET /api/wagers}.
 */
public enum WagerScope {
    ACTIVE,
    CLOSED;

    /**
     * Accepts the lowercase query values.
     */
    @Component
    static class FromString implements Converter<String, WagerScope> {
        @Override
        public WagerScope convert(String source) {
            return WagerScope.valueOf(source.trim().toUpperCase(Locale.ROOT));
        }
    }
}
