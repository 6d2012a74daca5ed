package com.paycrypt.webhook.entity;

import com.paycrypt.shared.enums.WebhookEventType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class WebhookEventTypeConverter implements AttributeConverter<WebhookEventType, String> {

    @Override
    public String convertToDatabaseColumn(WebhookEventType type) {
        return type == null ? null : type.value();
    }

    @Override
    public WebhookEventType convertToEntityAttribute(String value) {
        return value == null ? null : WebhookEventType.fromValue(value);
    }
}
