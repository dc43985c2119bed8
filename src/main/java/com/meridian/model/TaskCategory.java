package com.meridian.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of work a routing request can carry. Each category has a default minimum
 * quality used when the organization has no override for it.
 */
public enum TaskCategory {
    DRAFTING_SHORT("drafting-short", 0.5),
    DRAFTING_LONG("drafting-long", 0.7),
    SUMMARIZATION("summarization", 0.6),
    CLASSIFICATION("classification", 0.5),
    EXTRACTION("extraction", 0.6),
    ANALYSIS("analysis", 0.75),
    RESEARCH("research", 0.8),
    CHAT("chat", 0.5),
    CODE("code", 0.75);

    private final String id;
    private final double defaultMinPerf;

    TaskCategory(String id, double defaultMinPerf) {
        this.id = id;
        this.defaultMinPerf = defaultMinPerf;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public double getDefaultMinPerf() {
        return defaultMinPerf;
    }

    @JsonCreator
    public static TaskCategory fromId(String id) {
        if (id != null) {
            for (TaskCategory category : values()) {
                if (category.id.equalsIgnoreCase(id.trim()) || category.name().equalsIgnoreCase(id.trim())) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown task category: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
