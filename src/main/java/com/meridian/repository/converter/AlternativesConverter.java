package com.meridian.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meridian.model.Alternative;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class AlternativesConverter extends JsonAttributeConverter<List<Alternative>> {

    public AlternativesConverter() {
        super(new TypeReference<>() {
        });
    }
}
