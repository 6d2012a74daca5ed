package com.paycrypt.webhook.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class WebhookEventStatusConverter implements AttributeConverter<WebhookEventStatus, String> {

    @Override
    public String convertToDatabaseColumn(WebhookEventStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public WebhookEventStatus convertToEntityAttribute(String value) {
        return value == null ? null : WebhookEventStatus.fromValue(value);
    }
}
