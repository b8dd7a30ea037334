package com.sprintreport.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Written next to a refresh-eligible value in the same multi-set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshMetadata {

    private String cacheKey;
    private long createdAt;
    private long ttlMillis;
}
