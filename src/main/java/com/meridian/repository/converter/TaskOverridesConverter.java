package com.meridian.repository.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.meridian.model.TaskOverride;
import jakarta.persistence.Converter;

import java.util.Map;

@Converter
public class TaskOverridesConverter extends JsonAttributeConverter<Map<String, TaskOverride>> {

    public TaskOverridesConverter() {
        super(new TypeReference<>() {
        });
    }
}
