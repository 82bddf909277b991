package com.fintech.checkout.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link PaymentDetail} as a JSON document tagged with its variant.
 */
@Converter
public class PaymentDetailConverter implements AttributeConverter<PaymentDetail, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(PaymentDetail attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize payment detail", e);
        }
    }

    @Override
    public PaymentDetail convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, PaymentDetail.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot read stored payment detail", e);
        }
    }
}
