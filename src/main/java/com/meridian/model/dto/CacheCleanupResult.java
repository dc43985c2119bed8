package com.meridian.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheCleanupResult {

    private int expiredRemoved;

    private int evicted;

    private long remaining;
}
