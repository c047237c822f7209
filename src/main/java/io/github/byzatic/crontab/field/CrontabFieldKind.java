package io.github.byzatic.crontab.field;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

/**
 * The six positions of a crontab expression, with their inclusive value ranges and
 * optional name tables.
 */
public enum CrontabFieldKind {
    SECOND("second", 0, 59),
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY("day-of-month", 1, 31),
    MONTH("month", 1, 12,
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"),
    DAY_OF_WEEK("day-of-week", 0, 6,
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday");

    /**
     * Shortest prefix of a name accepted as an alias ("Jan", "Mon").
     */
    public static final int MIN_NAME_PREFIX = 3;

    private final String displayName;
    private final int minValue;
    private final int maxValue;
    private final ImmutableList<String> names;

    CrontabFieldKind(String displayName, int minValue, int maxValue, String... names) {
        this.displayName = displayName;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.names = ImmutableList.copyOf(names);
    }

    public @NotNull String getDisplayName() {
        return displayName;
    }

    public int getMinValue() {
        return minValue;
    }

    public int getMaxValue() {
        return maxValue;
    }

    public int maxValueCount() {
        return maxValue - minValue + 1;
    }

    public boolean hasNames() {
        return !names.isEmpty();
    }

    public boolean contains(int value) {
        return value >= minValue && value <= maxValue;
    }

    /**
     * Resolves a textual alias, case-insensitively. The token must be the full name or
     * a prefix of it at least {@link #MIN_NAME_PREFIX} characters long.
     *
     * @return the numeric value, or {@code -1} if the token names nothing in this field
     */
    public int parseName(@NotNull String token) {
        if (token.length() < MIN_NAME_PREFIX) {
            return -1;
        }
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (token.length() <= name.length()
                    && Ascii.equalsIgnoreCase(name.substring(0, token.length()), token)) {
                return minValue + i;
            }
        }
        return -1;
    }
}
