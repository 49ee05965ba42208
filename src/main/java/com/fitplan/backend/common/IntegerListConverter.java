package com.fitplan.backend.common;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** [10, 8, 6] ↔ "10,8,6"；空 list 存空字串 */
@Converter(autoApply = false)
public class IntegerListConverter implements AttributeConverter<List<Integer>, String> {
    @Override public String convertToDatabaseColumn(List<Integer> v) {
        return v == null ? "" : v.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    @Override public List<Integer> convertToEntityAttribute(String s) {
        List<Integer> out = new ArrayList<>();
        if (s == null || s.isBlank()) return out;
        for (String t : s.split(",")) if (!t.isBlank()) out.add(Integer.valueOf(t.trim()));
        return out;
    }
}
