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
 * 64-bit fixed-point length in 1/10 µ.
 *
 * Covers about {@code +/- 922 million km}, the value type of a {@link Tolerance128}.
 */
public final class Fixed64 extends FixedPoint<Fixed64> {

    /** The neutral element in relation to multiplication and division, 1 mm. */
    public static final Fixed64 ONE  = new Fixed64(TickFormat.TICKS_PER_MM);
    /** The neutral element in relation to addition and subtraction. */
    public static final Fixed64 ZERO = new Fixed64(0);
    public static final Fixed64 MIN  = new Fixed64(Long.MIN_VALUE);
    public static final Fixed64 MAX  = new Fixed64(Long.MAX_VALUE);

    private static final String TYPE = "Fixed64";

    private Fixed64(long ticks) {
        super(ticks);
    }

    @Override
    public Width width() {
        return Width.BITS_64;
    }

    @Override
    Fixed64 create(long ticks) {
        return new Fixed64(ticks);
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Fixed64 fromShort(short ticks) {
        return new Fixed64(ticks);
    }

    public static Fixed64 fromInt(int ticks) {
        return new Fixed64(ticks);
    }

    public static Fixed64 fromLong(long ticks) {
        return new Fixed64(ticks);
    }

    // same as fromLong(), kept for symmetry with the narrower types
    public static Fixed64 fromTicks(long ticks) {
        return new Fixed64(ticks);
    }

    /**
     * Interprets the value as mm, truncating anything below a tick.
     */
    public static Fixed64 fromDouble(double mm) {
        return new Fixed64(doubleTicks(mm, Width.BITS_64, TYPE));
    }

    public static Fixed64 fromString(CharSequence str) {
        return new Fixed64(parseTicks(str, Width.BITS_64, TYPE));
    }

    public static Fixed64 fromUnit(Unit unit) {
        return new Fixed64(unit.multiply());
    }

    /**
     * Widening conversion, never fails.
     */
    public static Fixed64 valueOf(FixedPoint<?> other) {
        return other instanceof Fixed64 f ? f : new Fixed64(other.ticks);
    }

    public static Fixed64 fromBytes(byte[] bytes, ByteOrder order) {
        return new Fixed64(Width.BITS_64.fromBytes(bytes, order));
    }

    public static Fixed64 fromBigEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.BIG_ENDIAN);
    }

    public static Fixed64 fromLittleEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.LITTLE_ENDIAN);
    }

    public static Fixed64 fromNativeEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.nativeOrder());
    }

    public static Fixed64 sum(Iterable<Fixed64> values) {
        var result = ZERO;
        for (var value : values) {
            result = result.add(value);
        }
        return result;
    }

    /* ==================
     * cross width math
     * ==================
     */

    public Fixed64 add(Fixed32 other) {
        return add(other.ticks);
    }

    public Fixed64 add(Fixed16 other) {
        return add(other.ticks);
    }

    public Fixed64 subtract(Fixed32 other) {
        return subtract(other.ticks);
    }

    public Fixed64 subtract(Fixed16 other) {
        return subtract(other.ticks);
    }

    public long toLong() {
        return ticks;
    }

    public Fixed32 toFixed32() {
        return Fixed32.valueOf(this);
    }

    public Fixed16 toFixed16() {
        return Fixed16.valueOf(this);
    }
}
