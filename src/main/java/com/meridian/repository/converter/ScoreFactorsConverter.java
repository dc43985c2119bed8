package com.meridian.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meridian.model.ScoreFactors;
import jakarta.persistence.Converter;

@Converter
public class ScoreFactorsConverter extends JsonAttributeConverter<ScoreFactors> {

    public ScoreFactorsConverter() {
        super(new TypeReference<>() {
        });
    }
}
