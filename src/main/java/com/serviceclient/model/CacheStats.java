package com.serviceclient.model;

public class CacheStats {
    private final long totalEntries;
    private final double usedMemoryMb;
    private final double hitRate;
    private final boolean enabled;

    public CacheStats(long totalEntries, double usedMemoryMb, double hitRate, boolean enabled) {
        this.totalEntries = totalEntries;
        this.usedMemoryMb = usedMemoryMb;
        this.hitRate = hitRate;
        this.enabled = enabled;
    }

    public static CacheStats disabled() {
        return new CacheStats(0, 0, 0, false);
    }

    public long getTotalEntries() {
        return totalEntries;
    }

    public double getUsedMemoryMb() {
        return usedMemoryMb;
    }

    public double getHitRate() {
        return hitRate;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
