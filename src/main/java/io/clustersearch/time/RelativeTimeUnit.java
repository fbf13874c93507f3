package io.clustersearch.time;

/**
 * Units accepted in relative time offsets such as {@code now-4h}.
 * Months and years have fixed lengths (30 and 360 days) so offsets never depend on the calendar.
 */
public enum RelativeTimeUnit {
    SECOND("s", 1L),
    MINUTE("m", 60L),
    HOUR("h", 3_600L),
    DAY("d", 86_400L),
    WEEK("w", 604_800L),
    MONTH("mon", 2_592_000L),
    YEAR("y", 31_104_000L);

    private final String suffix;
    private final long seconds;

    RelativeTimeUnit(String suffix, long seconds) {
        this.suffix = suffix;
        this.seconds = seconds;
    }

    public String getSuffix() {
        return suffix;
    }

    public long getSeconds() {
        return seconds;
    }

    /**
     * @return the unit for a suffix, {@code M} is accepted as a month alias; null when unknown
     */
    public static RelativeTimeUnit fromSuffix(String suffix) {
        if (suffix == null) return null;
        if ("M".equals(suffix)) {
            return MONTH;
        }
        for (RelativeTimeUnit unit : values()) {
            if (unit.suffix.equals(suffix)) {
                return unit;
            }
        }
        return null;
    }
}
