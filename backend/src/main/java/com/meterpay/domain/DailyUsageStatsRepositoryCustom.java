package com.meterpay.domain;

/**
 * Overwriting upsert for daily_usage_stats so reruns for the same day never double count.
 */
public interface DailyUsageStatsRepositoryCustom {

    DailyUsageStats upsert(DailyUsageStats stats);
}
