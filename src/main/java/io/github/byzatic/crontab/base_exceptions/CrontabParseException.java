package io.github.byzatic.crontab.base_exceptions;

import io.github.byzatic.crontab.field.CrontabFieldKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Raised when an expression or one of its fields cannot be parsed.
 * <p>
 * Carries the failure {@link Reason}, the field kind (absent for structural errors
 * such as a wrong field count), the text of the failing field and the offending token,
 * so callers can build their own diagnostics.
 */
public class CrontabParseException extends CrontabException {

    public enum Reason {
        WRONG_FIELD_COUNT,
        EMPTY_FIELD,
        INVALID_TOKEN,
        VALUE_OUT_OF_RANGE,
        INVALID_RANGE,
        INVALID_STEP
    }

    private final Reason reason;
    private final CrontabFieldKind kind;
    private final String fieldText;
    private final String token;

    public CrontabParseException(@NotNull Reason reason, @Nullable CrontabFieldKind kind,
                                 @NotNull String fieldText, @NotNull String token, String message) {
        super(message);
        this.reason = reason;
        this.kind = kind;
        this.fieldText = fieldText;
        this.token = token;
    }

    public CrontabParseException(@NotNull Reason reason, @Nullable CrontabFieldKind kind,
                                 @NotNull String fieldText, @NotNull String token, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.kind = kind;
        this.fieldText = fieldText;
        this.token = token;
    }

    public static CrontabParseException wrongFieldCount(@NotNull String expression, int expected, int actual) {
        return new CrontabParseException(Reason.WRONG_FIELD_COUNT, null, expression, expression,
                "Crontab expression must have " + expected + " fields but has " + actual + ": '" + expression + "'");
    }

    public static CrontabParseException forField(@NotNull Reason reason, @NotNull CrontabFieldKind kind,
                                                 @NotNull String fieldText, @NotNull String token) {
        return new CrontabParseException(reason, kind, fieldText, token, describe(reason, kind, fieldText, token));
    }

    private static String describe(Reason reason, CrontabFieldKind kind, String fieldText, String token) {
        String what;
        switch (reason) {
            case EMPTY_FIELD:
                what = "empty field or list item";
                break;
            case VALUE_OUT_OF_RANGE:
                what = "value '" + token + "' is outside " + kind.getMinValue() + "-" + kind.getMaxValue();
                break;
            case INVALID_RANGE:
                what = "range '" + token + "' has its start after its end";
                break;
            case INVALID_STEP:
                what = "step '" + token + "' is not a positive number";
                break;
            case INVALID_TOKEN:
            default:
                what = "'" + token + "' is not a valid value";
                break;
        }
        return "Invalid " + kind.getDisplayName() + " field '" + fieldText + "': " + what;
    }

    public @NotNull Reason getReason() {
        return reason;
    }

    /**
     * @return the failing field kind, or {@code null} for errors concerning the whole expression
     */
    public @Nullable CrontabFieldKind getKind() {
        return kind;
    }

    public @NotNull String getFieldText() {
        return fieldText;
    }

    public @NotNull String getToken() {
        return token;
    }
}
