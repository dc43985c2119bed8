package com.meridian.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meridian.model.TelemetrySnapshot;
import jakarta.persistence.Converter;

@Converter
public class TelemetrySnapshotConverter extends JsonAttributeConverter<TelemetrySnapshot> {

    public TelemetrySnapshotConverter() {
        super(new TypeReference<>() {
        });
    }
}
