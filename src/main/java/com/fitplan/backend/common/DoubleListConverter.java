package com.fitplan.backend.common;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** [60.0, 62.5] ↔ "60.0,62.5" */
@Converter(autoApply = false)
public class DoubleListConverter implements AttributeConverter<List<Double>, String> {
    @Override public String convertToDatabaseColumn(List<Double> v) {
        return v == null ? "" : v.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    @Override public List<Double> convertToEntityAttribute(String s) {
        List<Double> out = new ArrayList<>();
        if (s == null || s.isBlank()) return out;
        for (String t : s.split(",")) if (!t.isBlank()) out.add(Double.valueOf(t.trim()));
        return out;
    }
}
