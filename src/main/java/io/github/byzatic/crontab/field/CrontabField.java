package io.github.byzatic.crontab.field;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;

import java.util.BitSet;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Parsed membership set of one crontab field.
 * <p>
 * Bit {@code v} is set when value {@code v} satisfies the field. Instances are
 * immutable: the underlying {@link BitSet} is never handed out.
 */
@ThreadSafe
public final class CrontabField {
    private final CrontabFieldKind kind;
    private final BitSet bits;

    private CrontabField(CrontabFieldKind kind, BitSet bits) {
        this.kind = kind;
        this.bits = bits;
    }

    /**
     * Parses the textual form of a field.
     *
     * @throws io.github.byzatic.crontab.base_exceptions.CrontabParseException if the text is malformed,
     *         names an unknown token or a value outside the field's range
     */
    public static @NotNull CrontabField parse(@NotNull CrontabFieldKind kind, @NotNull String text) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        return new CrontabField(kind, CrontabFieldParser.parse(kind, text));
    }

    /**
     * A field matching every value of its range, as parsed from {@code *}.
     */
    public static @NotNull CrontabField all(@NotNull CrontabFieldKind kind) {
        BitSet bits = new BitSet(kind.getMaxValue() + 1);
        bits.set(kind.getMinValue(), kind.getMaxValue() + 1);
        return new CrontabField(kind, bits);
    }

    /**
     * A field matching exactly one value.
     */
    public static @NotNull CrontabField of(@NotNull CrontabFieldKind kind, int value) {
        if (!kind.contains(value)) {
            throw new IllegalArgumentException("Value " + value + " is outside the " + kind.getDisplayName() + " range");
        }
        BitSet bits = new BitSet(kind.getMaxValue() + 1);
        bits.set(value);
        return new CrontabField(kind, bits);
    }

    public @NotNull CrontabFieldKind getKind() {
        return kind;
    }

    public boolean contains(int value) {
        return kind.contains(value) && bits.get(value);
    }

    public int first() {
        return bits.nextSetBit(kind.getMinValue());
    }

    /**
     * @return the smallest member greater than or equal to {@code value}, or {@code -1} if there is none
     */
    public int next(int value) {
        if (value > kind.getMaxValue()) {
            return -1;
        }
        return bits.nextSetBit(Math.max(value, kind.getMinValue()));
    }

    /**
     * True when every value of the complete range is a member, i.e. the field does not
     * restrict anything.
     */
    public boolean isFull() {
        return bits.cardinality() == kind.maxValueCount();
    }

    public int size() {
        return bits.cardinality();
    }

    public int[] values() {
        return bits.stream().toArray();
    }

    /**
     * Canonical rendering: {@code *} for a full field, otherwise ascending runs of
     * consecutive members, e.g. {@code 1-3,7,10-12}.
     */
    @Override
    public String toString() {
        if (isFull()) {
            return "*";
        }
        StringJoiner out = new StringJoiner(",");
        int start = bits.nextSetBit(0);
        while (start >= 0) {
            int end = bits.nextClearBit(start) - 1;
            out.add(start == end ? Integer.toString(start) : start + "-" + end);
            start = bits.nextSetBit(end + 1);
        }
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CrontabField)) return false;
        CrontabField that = (CrontabField) o;
        return kind == that.kind && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bits);
    }
}
