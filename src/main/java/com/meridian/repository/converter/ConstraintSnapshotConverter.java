package com.meridian.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meridian.model.ConstraintSnapshot;
import jakarta.persistence.Converter;

@Converter
public class ConstraintSnapshotConverter extends JsonAttributeConverter<ConstraintSnapshot> {

    public ConstraintSnapshotConverter() {
        super(new TypeReference<>() {
        });
    }
}
