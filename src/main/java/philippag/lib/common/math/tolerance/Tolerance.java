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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * A nominal length with an asymmetric permissible deviation.
 *
 * The deviations {@code plus} and {@code minus} are in the same scale as the value,
 * but half as wide. {@code plus} is normally positive and {@code minus} normally negative,
 * the only hard rule is {@code plus >= minus}. Every public factory enforces it and
 * throws {@link IllegalArgumentException} otherwise, which is a programming error.
 *
 * The value wraps around like the underlying {@link FixedPoint} types. The deviations
 * and the limits never do, a result beyond their range throws {@link ArithmeticException}.
 *
 * Instances are immutable, the natural order is by value, then minus, then plus.
 *
 * @param <T> the concrete tolerance type
 * @param <V> the value type
 * @param <D> the deviation type
 */
public abstract class Tolerance<T extends Tolerance<T, V, D>, V extends FixedPoint<V>, D extends FixedPoint<D>>
        implements Comparable<T>, ToleranceString {

    final V value;
    final D plus;
    final D minus;

    Tolerance(V value, D plus, D minus) {
        this.value = Objects.requireNonNull(value, "value");
        this.plus = Objects.requireNonNull(plus, "plus");
        this.minus = Objects.requireNonNull(minus, "minus");
    }

    // no checks, exact deviation arithmetic keeps plus >= minus
    abstract T create(V value, D plus, D minus);

    static <D extends FixedPoint<D>> void checkDeviations(D plus, D minus) {
        if (plus.compareTo(minus) < 0) {
            throw new IllegalArgumentException("Plus has to be bigger than minus: " + plus + " < " + minus);
        }
    }

    public String typeName() {
        return getClass().getSimpleName();
    }

    public V value() {
        return value;
    }

    public D plus() {
        return plus;
    }

    public D minus() {
        return minus;
    }

    public V upperLimit() {
        return value.exact(upper(), "upperLimit");
    }

    public V lowerLimit() {
        return value.exact(lower(), "lowerLimit");
    }

    long upper() {
        return Math.addExact(value.ticks, plus.ticks);
    }

    long lower() {
        return Math.addExact(value.ticks, minus.ticks);
    }

    public boolean isSymmetric() {
        return plus.ticks == -minus.ticks;
    }

    public T narrow(D plus, D minus) {
        checkDeviations(plus, minus);
        return create(value, plus, minus);
    }

    public T narrowSym(D tolerance) {
        return narrow(tolerance, tolerance.negate());
    }

    /**
     * Returns true if the range of this tolerance lies within the range of the other one.
     */
    public boolean isInsideOf(T other) {
        return lower() >= other.lower() && upper() <= other.upper();
    }

    /**
     * Returns true if the range of this tolerance covers the range of the other one.
     */
    public boolean enfold(T other) {
        return lower() <= other.lower() && upper() >= other.upper();
    }

    /**
     * Returns true if the value lies within this tolerance.
     */
    public boolean enfold(V value) {
        return lower() <= value.ticks && upper() >= value.ticks;
    }

    /**
     * Negates the value and interchanges the negated deviations.
     * Required when measuring back in the opposite direction.
     */
    public T invert() {
        return create(value.negate(), minus.exact(-minus.ticks, "invert"), plus.exact(-plus.ticks, "invert"));
    }

    /* ==========
     * arithmetic
     * ==========
     */

    /**
     * Stacks the tolerances: all three components are added.
     */
    public T add(T other) {
        return create(value.add(other.value),
                plus.exact(plus.ticks + other.plus.ticks, "add"),
                minus.exact(minus.ticks + other.minus.ticks, "add"));
    }

    public T add(V value) {
        return create(this.value.add(value), plus, minus);
    }

    /**
     * Subtracting a tolerance widens the deviations by its opposite deviations:
     * {@code plus - other.minus} and {@code minus - other.plus}.
     */
    public T subtract(T other) {
        return create(value.subtract(other.value),
                plus.exact(plus.ticks - other.minus.ticks, "subtract"),
                minus.exact(minus.ticks - other.plus.ticks, "subtract"));
    }

    public T subtract(V value) {
        return create(this.value.subtract(value), plus, minus);
    }

    /**
     * Scales all components. A negative factor interchanges the deviations.
     */
    public T multiply(long factor) {
        D p = plus.exact(Math.multiplyExact(plus.ticks, factor), "multiply");
        D m = minus.exact(Math.multiplyExact(minus.ticks, factor), "multiply");
        return factor < 0 ? create(value.multiply(factor), m, p) : create(value.multiply(factor), p, m);
    }

    /* ===========
     * conversions
     * ===========
     */

    public double toDouble() {
        return value.toDouble();
    }

    public double[] toDoubleArray() {
        return new double[] { value.toDouble(), plus.toDouble(), minus.toDouble() };
    }

    public byte[] toBytes(ByteOrder order) {
        var buffer = ByteBuffer.allocate(value.width().bytes() + 2 * plus.width().bytes()).order(order);
        value.width().put(buffer, value.ticks);
        plus.width().put(buffer, plus.ticks);
        minus.width().put(buffer, minus.ticks);
        return buffer.array();
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

    static long[] readTicks(byte[] bytes, ByteOrder order, Width valueWidth, Width deviationWidth) {
        int expected = valueWidth.bytes() + 2 * deviationWidth.bytes();
        if (bytes.length != expected) {
            throw new IllegalArgumentException("Expecting " + expected + " bytes, got " + bytes.length);
        }
        var buffer = ByteBuffer.wrap(bytes).order(order);
        return new long[] { valueWidth.get(buffer), deviationWidth.get(buffer), deviationWidth.get(buffer) };
    }

    /* ==========
     * formatting
     * ==========
     */

    @Override
    public String toToleranceString() {
        return ToleranceFormat.format(value, plus, minus);
    }

    @Override
    public String toToleranceString(int precision) {
        return ToleranceFormat.format(value, plus, minus, precision);
    }

    public String format(int precision) {
        return toToleranceString(precision);
    }

    /**
     * Raw ticks: {@code "-3500 +100/-140"}.
     */
    public String toAlternateString() {
        return ToleranceFormat.formatAlternate(value, plus, minus);
    }

    public String toDebugString() {
        return ToleranceFormat.formatDebug(typeName(), value, plus, minus);
    }

    @Override
    public String toString() {
        return toToleranceString();
    }

    @Override
    public int compareTo(T o) {
        int cmp = value.compareTo(o.value);
        if (cmp != 0) {
            return cmp;
        }
        cmp = minus.compareTo(o.minus);
        return cmp != 0 ? cmp : plus.compareTo(o.plus);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        var o = (Tolerance<?, ?, ?>) obj;
        return value.equals(o.value) && plus.equals(o.plus) && minus.equals(o.minus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, plus, minus);
    }
}
