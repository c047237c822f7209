package io.github.byzatic.crontab.field;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.github.byzatic.crontab.base_exceptions.CrontabParseException;
import io.github.byzatic.crontab.base_exceptions.CrontabParseException.Reason;
import org.jetbrains.annotations.NotNull;

import java.util.BitSet;

/**
 * Grammar of a single crontab field.
 * <pre>
 *   field := item ("," item)*
 *   item  := ("*" | value | value "-" value) ["/" step]
 *   value := digits | name
 * </pre>
 * A bare value followed by a step runs from that value to the end of the range.
 */
final class CrontabFieldParser {
    private static final Splitter LIST_SPLITTER = Splitter.on(',');
    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
    // anything longer cannot fit any field and might overflow an int
    private static final int MAX_NUMBER_LENGTH = 9;

    private final CrontabFieldKind kind;
    private final String text;

    private CrontabFieldParser(CrontabFieldKind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    static @NotNull BitSet parse(@NotNull CrontabFieldKind kind, @NotNull String text) {
        return new CrontabFieldParser(kind, text).parse();
    }

    private BitSet parse() {
        if (text.isEmpty()) {
            throw error(Reason.EMPTY_FIELD, text);
        }
        BitSet bits = new BitSet(kind.getMaxValue() + 1);
        for (String item : LIST_SPLITTER.split(text)) {
            if (item.isEmpty()) {
                throw error(Reason.EMPTY_FIELD, item);
            }
            parseItem(item, bits);
        }
        if (bits.isEmpty()) {
            throw error(Reason.EMPTY_FIELD, text);
        }
        return bits;
    }

    private void parseItem(String item, BitSet bits) {
        String rangePart = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            rangePart = item.substring(0, slash);
            step = parseStep(item.substring(slash + 1));
        }

        int low;
        int high;
        if (rangePart.equals("*")) {
            low = kind.getMinValue();
            high = kind.getMaxValue();
        } else {
            int dash = rangePart.indexOf('-');
            if (dash >= 0) {
                low = parseValue(rangePart.substring(0, dash));
                high = parseValue(rangePart.substring(dash + 1));
                if (low > high) {
                    throw error(Reason.INVALID_RANGE, rangePart);
                }
            } else {
                low = parseValue(rangePart);
                high = slash >= 0 ? kind.getMaxValue() : low;
            }
        }

        for (int v = low; v <= high; v += step) {
            bits.set(v);
        }
    }

    private int parseStep(String token) {
        if (token.isEmpty() || token.length() > MAX_NUMBER_LENGTH || !DIGITS.matchesAllOf(token)) {
            throw error(Reason.INVALID_STEP, token);
        }
        int step = Integer.parseInt(token);
        if (step <= 0) {
            throw error(Reason.INVALID_STEP, token);
        }
        return step;
    }

    private int parseValue(String token) {
        if (!token.isEmpty() && DIGITS.matchesAllOf(token)) {
            if (token.length() > MAX_NUMBER_LENGTH) {
                throw error(Reason.VALUE_OUT_OF_RANGE, token);
            }
            int value = Integer.parseInt(token);
            if (!kind.contains(value)) {
                throw error(Reason.VALUE_OUT_OF_RANGE, token);
            }
            return value;
        }
        if (kind.hasNames()) {
            int value = kind.parseName(token);
            if (value >= 0) {
                return value;
            }
        }
        throw error(Reason.INVALID_TOKEN, token);
    }

    private CrontabParseException error(Reason reason, String token) {
        return CrontabParseException.forField(reason, kind, text, token);
    }
}
