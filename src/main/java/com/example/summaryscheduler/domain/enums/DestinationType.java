package com.example.summaryscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Where a produced summary is delivered.
 */
@Getter
@RequiredArgsConstructor
public enum DestinationType {

    CHANNEL("channel", "Chat Channel"),
    WEBHOOK("webhook", "Webhook"),
    EMAIL("email", "Email"),
    FILE("file", "File");

    private final String code;
    private final String displayName;

    public static DestinationType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown destination type code: " + code);
    }
}
