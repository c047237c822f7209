package io.github.byzatic.crontab;

import com.google.errorprone.annotations.Immutable;

/**
 * Options for {@link CrontabSchedule#parse(String, ParseOptions)}.
 */
@Immutable
public final class ParseOptions {
    /**
     * Five-field expressions: {@code min hour dom mon dow}.
     */
    public static final ParseOptions DEFAULT = new Builder().build();

    private final boolean includingSeconds;

    private ParseOptions(boolean includingSeconds) {
        this.includingSeconds = includingSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * When true the expression carries a leading seconds field (six fields in total).
     */
    public boolean isIncludingSeconds() {
        return includingSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseOptions)) return false;
        return includingSeconds == ((ParseOptions) o).includingSeconds;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(includingSeconds);
    }

    @Override
    public String toString() {
        return "ParseOptions{includingSeconds=" + includingSeconds + '}';
    }

    public static final class Builder {
        private boolean includingSeconds = false;

        /**
         * Expect six fields, the first being seconds.
         */
        public Builder includingSeconds(boolean includingSeconds) {
            this.includingSeconds = includingSeconds;
            return this;
        }

        public ParseOptions build() {
            return new ParseOptions(includingSeconds);
        }
    }
}
