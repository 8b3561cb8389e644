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
 * 32-bit fixed-point length in 1/10 µ.
 *
 * <pre>
 *   var m = Fixed32.fromDouble(12.5);
 *   m.toString();             // "12.5"
 *   m.format(2);              // "12.50"
 *   m.format(4);              // "12.5000"
 *   m.toAlternateString();    // "125000"
 * </pre>
 *
 * Don't try to store more than {@code +/- 214 m} in a {@code Fixed32}.
 */
public final class Fixed32 extends FixedPoint<Fixed32> {

    /** The neutral element in relation to multiplication and division, 1 mm. */
    public static final Fixed32 ONE  = new Fixed32(TickFormat.TICKS_PER_MM);
    /** The neutral element in relation to addition and subtraction. */
    public static final Fixed32 ZERO = new Fixed32(0);
    public static final Fixed32 MIN  = new Fixed32(Integer.MIN_VALUE);
    public static final Fixed32 MAX  = new Fixed32(Integer.MAX_VALUE);

    private static final String TYPE = "Fixed32";

    private Fixed32(long ticks) {
        super(ticks);
    }

    @Override
    public Width width() {
        return Width.BITS_32;
    }

    @Override
    Fixed32 create(long ticks) {
        return new Fixed32(ticks);
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Fixed32 fromShort(short ticks) {
        return new Fixed32(ticks);
    }

    public static Fixed32 fromInt(int ticks) {
        return new Fixed32(ticks);
    }

    public static Fixed32 fromTicks(long ticks) {
        return new Fixed32(Width.BITS_32.checked(ticks, TYPE));
    }

    /**
     * Interprets the value as mm, truncating anything below a tick.
     */
    public static Fixed32 fromDouble(double mm) {
        return new Fixed32(doubleTicks(mm, Width.BITS_32, TYPE));
    }

    public static Fixed32 fromString(CharSequence str) {
        return new Fixed32(parseTicks(str, Width.BITS_32, TYPE));
    }

    public static Fixed32 fromUnit(Unit unit) {
        return new Fixed32(unitTicks(unit, Width.BITS_32, TYPE));
    }

    /**
     * Widens a {@link Fixed16}, narrows a {@link Fixed64} (throws if out of range).
     */
    public static Fixed32 valueOf(FixedPoint<?> other) {
        return other instanceof Fixed32 f ? f : fromTicks(other.ticks);
    }

    public static Fixed32 fromBytes(byte[] bytes, ByteOrder order) {
        return new Fixed32(Width.BITS_32.fromBytes(bytes, order));
    }

    public static Fixed32 fromBigEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.BIG_ENDIAN);
    }

    public static Fixed32 fromLittleEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.LITTLE_ENDIAN);
    }

    public static Fixed32 fromNativeEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.nativeOrder());
    }

    public static Fixed32 sum(Iterable<Fixed32> values) {
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

    public Fixed32 add(Fixed16 other) {
        return add(other.ticks);
    }

    public Fixed32 subtract(Fixed16 other) {
        return subtract(other.ticks);
    }

    public int toInt() {
        return (int) ticks;
    }

    public Fixed16 toFixed16() {
        return Fixed16.valueOf(this);
    }

    public Fixed64 toFixed64() {
        return Fixed64.fromLong(ticks);
    }
}
