/*
MIT License

Copyright (c) 2024 Philipp Grasboeck

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.
*/

package philippag.lib.common.math.tolerance;

import java.nio.ByteOrder;

/**
 * Exact length, counted in ticks of 1/10 µ:
 * <ul>
 * <li>{@code 10} = 1 µ</li>
 * <li>{@code 10_000} = 1 mm</li>
 * <li>{@code 10_000_000} = 1 m</li>
 * </ul>
 *
 * The concrete types only differ in the backing {@link Width}, the math
 * is done here in {@code long} and truncated to the width afterwards.
 *
 * Instances are immutable.
 *
 * Overflow policy:
 * <ul>
 * <li>Everything that creates a value from foreign input (strings, doubles,
 * tick counts of a wider type, other widths) is checked and throws
 * {@link ToleranceException} of kind {@code OVERFLOW}.</li>
 * <li>The operator style arithmetic between two values of the same width
 * ({@link #add(FixedPoint)}, {@link #multiply(long)} et al.) wraps around,
 * exactly like Java's own {@code short}, {@code int} and {@code long} math.</li>
 * <li>Integer operands that don't even fit into the width are a programming
 * error and throw {@link ArithmeticException}, so are results of
 * {@link #round(Unit)} and {@link #floor(Unit)} beyond the range.</li>
 * </ul>
 */
public abstract class FixedPoint<T extends FixedPoint<T>> implements Comparable<T> {

    final long ticks;

    FixedPoint(long ticks) {
        assert width().contains(ticks) : ticks;
        this.ticks = ticks;
    }

    public abstract Width width();

    // ticks must be in range
    abstract T create(long ticks);

    public String typeName() {
        return getClass().getSimpleName();
    }

    T wrapped(long ticks) {
        return create(width().wrap(ticks));
    }

    T checked(long ticks) {
        return create(width().checked(ticks, typeName()));
    }

    static long parseTicks(CharSequence str, Width width, String typeName) {
        long ticks = TickFormat.parse(str, typeName);
        if (!width.contains(ticks)) {
            throw ToleranceException.overflow(str.toString().strip() + " is too big for a " + typeName);
        }
        return ticks;
    }

    static long doubleTicks(double mm, Width width, String typeName) {
        double scaled = mm * TickFormat.TICKS_PER_MM;
        // min - 1.0 rounds to min itself for 64 bits, where the range starts exactly at -0x1p63
        boolean below = width == Width.BITS_64 ? scaled < -0x1p63 : scaled <= width.min() - 1.0;
        if (Double.isNaN(scaled) || below || scaled >= width.max() + 1.0) {
            throw ToleranceException.overflow(typeName + " overflow, the double " + mm + " is beyond the limits of this type");
        }
        return (long) scaled; // truncates towards zero
    }

    static long unitTicks(Unit unit, Width width, String typeName) {
        long factor = unit.multiply();
        if (!width.contains(factor)) {
            throw ToleranceException.overflow(unit + " is out of range for a " + typeName);
        }
        return factor;
    }

    public long ticks() {
        return ticks;
    }

    public double toDouble() {
        return ticks / (double) TickFormat.TICKS_PER_MM;
    }

    public double toUnit(Unit unit) {
        return ticks / (double) unit.multiply();
    }

    /* ==========
     * arithmetic
     * ==========
     */

    public T add(T other) {
        return wrapped(ticks + other.ticks);
    }

    public T subtract(T other) {
        return wrapped(ticks - other.ticks);
    }

    public T multiply(T other) {
        return wrapped(ticks * other.ticks);
    }

    public T divide(T other) {
        return wrapped(ticks / other.ticks);
    }

    /**
     * Adds raw ticks. The operand must fit into this width.
     */
    public T add(long ticks) {
        return wrapped(this.ticks + width().operand(ticks, typeName()));
    }

    /**
     * Subtracts raw ticks. The operand must fit into this width.
     */
    public T subtract(long ticks) {
        return wrapped(this.ticks - width().operand(ticks, typeName()));
    }

    public T multiply(long factor) {
        return wrapped(ticks * factor);
    }

    public T divide(long divisor) {
        return wrapped(ticks / divisor);
    }

    public T negate() {
        return wrapped(-ticks);
    }

    /**
     * Rounds to the nearest multiple of the unit, ties away from zero.
     * A unit of zero leaves the value unchanged.
     */
    public T round(Unit unit) {
        long m = unit.multiply();
        if (m == 0) {
            return self();
        }
        long clip = ticks % m;
        if (clip == 0) {
            return self();
        }
        long down = ticks - clip; // towards zero
        long distance = Math.abs(clip);
        if (distance >= m - distance) {
            long away = clip < 0 ? Math.subtractExact(down, m) : Math.addExact(down, m);
            return exact(away, "round");
        }
        return create(down);
    }

    /**
     * Finds the nearest multiple of the unit less than or equal to this value.
     * A unit of zero leaves the value unchanged.
     */
    public T floor(Unit unit) {
        long m = unit.multiply();
        if (m == 0) {
            return self();
        }
        return exact(Math.subtractExact(ticks, Math.floorMod(ticks, m)), "floor");
    }

    // for results that must not wrap
    T exact(long ticks, String operation) {
        if (!width().contains(ticks)) {
            throw new ArithmeticException("Result of " + operation + " out of range for a " + typeName() + ": " + ticks);
        }
        return create(ticks);
    }

    @SuppressWarnings("unchecked")
    private T self() {
        return (T) this;
    }

    public T abs() {
        return ticks < 0 ? negate() : self();
    }

    public T absDiff(T other) {
        return subtract(other).abs();
    }

    /**
     * -1, 0 or 1 (in ticks) representing the sign of this value.
     */
    public T signum() {
        return create(Long.signum(ticks));
    }

    public boolean isNegative() {
        return ticks < 0;
    }

    public boolean isPositive() {
        return ticks > 0;
    }

    public boolean isZero() {
        return ticks == 0;
    }

    /* =====
     * bytes
     * =====
     */

    public byte[] toBytes(ByteOrder order) {
        return width().toBytes(ticks, order);
    }

    public byte[] toBigEndianBytes() {
        return toBytes(ByteOrder.BIG_ENDIAN);
    }

    public byte[] toLittleEndianBytes() {
        return toBytes(ByteOrder.LITTLE_ENDIAN);
    }

    public byte[] toNativeEndianBytes() {
        return toBytes(ByteOrder.nativeOrder());
    }

    /* ==========
     * formatting
     * ==========
     */

    /**
     * Millimeters with the given number of fractional digits, 4 at most.
     */
    public String format(int precision) {
        return TickFormat.format(ticks, precision, false);
    }

    public String format(int precision, boolean signPlus) {
        return TickFormat.format(ticks, precision, signPlus);
    }

    /**
     * Millimeters with as many fractional digits as needed (1 to 4).
     */
    @Override
    public String toString() {
        return format(TickFormat.autoPrecision(ticks));
    }

    public String toAlternateString() {
        return Long.toString(ticks);
    }

    public String toDebugString() {
        return typeName() + "(" + format(TickFormat.MAX_PRECISION) + ")";
    }

    @Override
    public int compareTo(T o) {
        return Long.compare(ticks, o.ticks);
    }

    @Override
    public boolean equals(Object obj) {
        return obj != null && obj.getClass() == getClass() && ((FixedPoint<?>) obj).ticks == ticks;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(ticks);
    }
}
