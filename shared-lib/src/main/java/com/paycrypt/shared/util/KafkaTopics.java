package com.paycrypt.shared.util;

public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String PAYMENT_CHANGED = "payment.changed";
}
