package com.example.organizationservice.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores phone numbers as a JSON array of strings.
 */
@Converter
public class PhoneNumberListConverter implements AttributeConverter<List<PhoneNumber>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<PhoneNumber> phoneNumbers) {
        List<String> values = new ArrayList<>();
        if (phoneNumbers != null) {
            phoneNumbers.forEach(phone -> values.add(phone.getValue()));
        }
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize phone numbers", e);
        }
    }

    @Override
    public List<PhoneNumber> convertToEntityAttribute(String json) {
        List<PhoneNumber> phoneNumbers = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return phoneNumbers;
        }
        try {
            for (String value : MAPPER.readValue(json, STRING_LIST)) {
                phoneNumbers.add(PhoneNumber.of(value));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize phone numbers", e);
        }
        return phoneNumbers;
    }
}
