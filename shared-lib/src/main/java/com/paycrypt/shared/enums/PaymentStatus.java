package com.paycrypt.shared.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum PaymentStatus {

    PENDING("pending"),
    APPROVED("approved"),
    COMPLETED("completed"),
    FAILED("failed"),
    REJECTED("rejected"),
    CANCELLED("cancelled");

    private static final Map<String, PaymentStatus> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PaymentStatus::value, Function.identity()));

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        PaymentStatus status = value == null ? null : BY_VALUE.get(value);
        if (status == null) {
            throw new IllegalArgumentException("Unknown payment status: " + value);
        }
        return status;
    }
}
