package com.example.healthcoach.persistence.converter;

import com.example.healthcoach.model.BackendId;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Attempted backends as a comma separated column, in attempt order. */
@Converter
public class BackendListConverter implements AttributeConverter<List<BackendId>, String> {

    @Override
    public String convertToDatabaseColumn(List<BackendId> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return attribute.stream().map(Enum::name).collect(Collectors.joining(","));
    }

    @Override
    public List<BackendId> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return List.of();
        }
        return Arrays.stream(dbData.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(BackendId::valueOf)
                .toList();
    }
}
