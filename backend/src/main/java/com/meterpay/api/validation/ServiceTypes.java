package com.meterpay.api.validation;

import com.meterpay.domain.ServiceType;

import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive service type lookup for path segments ("api", "web_service", "web-service").
 */
public final class ServiceTypes {

    private ServiceTypes() {
    }

    public static Optional<ServiceType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ServiceType type : ServiceType.values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
