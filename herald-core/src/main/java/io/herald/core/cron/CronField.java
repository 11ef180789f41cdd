package io.herald.core.cron;

public enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public int valueCount() {
        return max - min + 1;
    }

    // Sunday may be written as 7; it is folded to 0 after parsing.
    int parseMax() {
        return this == DAY_OF_WEEK ? 7 : max;
    }
}
