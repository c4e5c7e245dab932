package com.wordduel.progression;

/**
 * Cumulative XP thresholds: reaching level L costs {@code 100 + (l - 1) * 50} for every level l below L.
 */
public final class LevelCurve {
    static final int BASE_LEVEL_XP = 100;
    static final int LEVEL_XP_STEP = 50;

    private LevelCurve() {}

    /**
     * Closed form of the threshold sum, in {@code long} so high levels never wrap around.
     */
    public static long xpForLevel(int level) {
        if (level <= 1) return 0L;
        long n = level - 1L;
        return BASE_LEVEL_XP * n + LEVEL_XP_STEP * n * (n - 1) / 2;
    }

    /**
     * Highest level whose threshold {@code xp} meets, never below {@code fromLevel}.
     */
    public static int levelFor(int xp, int fromLevel) {
        int level = Math.max(1, fromLevel);
        while (xp >= xpForLevel(level + 1)) {
            level++;
        }
        return level;
    }

    public static int xpToNextLevel(int level) {
        return (int) (xpForLevel(level + 1) - xpForLevel(level));
    }

    public static double progressPercent(int level, int xp) {
        int needed = xpToNextLevel(level);
        if (needed <= 0) return 100.0;
        double pct = (xp - xpForLevel(level)) * 100.0 / needed;
        return Math.max(0.0, Math.min(pct, 100.0));
    }
}
