package com.sprintreport.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hits;
    private long misses;
    private long sets;
    private long deletes;
    private long errors;
    private double hitRate;
    private long localKeys;
    private boolean redisEnabled;
}
