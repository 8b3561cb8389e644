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
 * 16-bit fixed-point length in 1/10 µ.
 *
 * Mostly used as the deviation of a {@link Tolerance64}.
 * Don't try to store more than {@code +/- 3.2767 mm} in a {@code Fixed16}.
 */
public final class Fixed16 extends FixedPoint<Fixed16> {

    /** The neutral element in relation to multiplication and division, 1 mm. */
    public static final Fixed16 ONE  = new Fixed16(TickFormat.TICKS_PER_MM);
    /** The neutral element in relation to addition and subtraction. */
    public static final Fixed16 ZERO = new Fixed16(0);
    public static final Fixed16 MIN  = new Fixed16(Short.MIN_VALUE);
    public static final Fixed16 MAX  = new Fixed16(Short.MAX_VALUE);

    private static final String TYPE = "Fixed16";

    private Fixed16(long ticks) {
        super(ticks);
    }

    @Override
    public Width width() {
        return Width.BITS_16;
    }

    @Override
    Fixed16 create(long ticks) {
        return new Fixed16(ticks);
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Fixed16 fromShort(short ticks) {
        return new Fixed16(ticks);
    }

    public static Fixed16 fromTicks(long ticks) {
        return new Fixed16(Width.BITS_16.checked(ticks, TYPE));
    }

    /**
     * Interprets the value as mm, truncating anything below a tick.
     */
    public static Fixed16 fromDouble(double mm) {
        return new Fixed16(doubleTicks(mm, Width.BITS_16, TYPE));
    }

    public static Fixed16 fromString(CharSequence str) {
        return new Fixed16(parseTicks(str, Width.BITS_16, TYPE));
    }

    public static Fixed16 fromUnit(Unit unit) {
        return new Fixed16(unitTicks(unit, Width.BITS_16, TYPE));
    }

    /**
     * Narrowing conversion, throws if the other value is out of range.
     */
    public static Fixed16 valueOf(FixedPoint<?> other) {
        return other instanceof Fixed16 f ? f : fromTicks(other.ticks);
    }

    public static Fixed16 fromBytes(byte[] bytes, ByteOrder order) {
        return new Fixed16(Width.BITS_16.fromBytes(bytes, order));
    }

    public static Fixed16 fromBigEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.BIG_ENDIAN);
    }

    public static Fixed16 fromLittleEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.LITTLE_ENDIAN);
    }

    public static Fixed16 fromNativeEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.nativeOrder());
    }

    public static Fixed16 sum(Iterable<Fixed16> values) {
        var result = ZERO;
        for (var value : values) {
            result = result.add(value);
        }
        return result;
    }

    public short toShort() {
        return (short) ticks;
    }

    public Fixed32 toFixed32() {
        return Fixed32.fromInt((int) ticks);
    }

    public Fixed64 toFixed64() {
        return Fixed64.fromLong(ticks);
    }
}
