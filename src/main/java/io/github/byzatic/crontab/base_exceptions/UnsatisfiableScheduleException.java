package io.github.byzatic.crontab.base_exceptions;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;

/**
 * Raised by the occurrence search when a syntactically valid schedule can never fire,
 * e.g. {@code * * 31 2 *}.
 */
public class UnsatisfiableScheduleException extends CrontabException {
    private final String expression;
    private final LocalDateTime searchStart;

    public UnsatisfiableScheduleException(@NotNull String expression, @NotNull LocalDateTime searchStart, int searchedYears) {
        super("Crontab '" + expression + "' has no occurrence within " + searchedYears + " years after " + searchStart);
        this.expression = expression;
        this.searchStart = searchStart;
    }

    public @NotNull String getExpression() {
        return expression;
    }

    public @NotNull LocalDateTime getSearchStart() {
        return searchStart;
    }
}
