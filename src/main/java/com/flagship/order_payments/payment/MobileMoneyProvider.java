package com.flagship.order_payments.payment;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Mobile money networks accepted by the gateway, with the names the gateway expects on the wire.
 */
@Getter
@RequiredArgsConstructor
public enum MobileMoneyProvider {
    AIRTEL("Airtel"),
    TIGO("Tigo"),
    HALOPESA("Halopesa"),
    AZAMPESA("Azampesa"),
    MPESA("Mpesa");

    private final String gatewayName;

    /**
     * Case-insensitive lookup by gateway name or constant name.
     */
    public static Optional<MobileMoneyProvider> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
            .filter(p -> p.gatewayName.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
