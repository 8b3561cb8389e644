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
 * 128-bit wide tolerance: a {@link Fixed64} value with {@link Fixed32} deviations.
 *
 * <pre>
 *   var width = Tolerance128.fromDouble(100.0, 0.05, -0.2);
 *   width.toString();        // "100.0 +0.05/-0.2"
 *   width.format(2);         // "100.00 +0.05/-0.20"
 *   width.toDebugString();   // "Tolerance128(100.0000 +0.0500 -0.2000)"
 * </pre>
 *
 * Ways to parse one:
 * <pre>
 *   Tolerance128.fromString("12 .4 -1");     // 12.0 +0.4/-1.0
 *   Tolerance128.fromString("12/.4/-1");     // same
 *   Tolerance128.fromString("12;0.4; -1");   // same
 *   Tolerance128.fromString("12.0 +-0.4");   // 12.0 +/-0.4
 *   Tolerance128.fromString("12.0");         // 12.0 +/-0.0
 * </pre>
 */
public final class Tolerance128 extends Tolerance<Tolerance128, Fixed64, Fixed32> {

    /** The neutral element in relation to addition and subtraction. */
    public static final Tolerance128 ZERO = new Tolerance128(Fixed64.ZERO, Fixed32.ZERO, Fixed32.ZERO);

    public static final int BYTES = Long.BYTES + 2 * Integer.BYTES;

    private static final String TYPE = "Tolerance128";

    private Tolerance128(Fixed64 value, Fixed32 plus, Fixed32 minus) {
        super(value, plus, minus);
    }

    @Override
    Tolerance128 create(Fixed64 value, Fixed32 plus, Fixed32 minus) {
        return new Tolerance128(value, plus, minus);
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Tolerance128 of(Fixed64 value, Fixed32 plus, Fixed32 minus) {
        checkDeviations(plus, minus);
        return new Tolerance128(value, plus, minus);
    }

    public static Tolerance128 withSym(Fixed64 value, Fixed32 tolerance) {
        return of(value, tolerance, tolerance.negate());
    }

    /**
     * No deviations.
     */
    public static Tolerance128 valueOf(Fixed64 value) {
        return new Tolerance128(value, Fixed32.ZERO, Fixed32.ZERO);
    }

    /**
     * All parts in ticks, range checked.
     */
    public static Tolerance128 fromTicks(long value, long plus, long minus) {
        return of(Fixed64.fromTicks(value), Fixed32.fromTicks(plus), Fixed32.fromTicks(minus));
    }

    public static Tolerance128 fromTicks(long value, long tolerance) {
        return withSym(Fixed64.fromTicks(value), Fixed32.fromTicks(tolerance));
    }

    /**
     * All parts in mm.
     */
    public static Tolerance128 fromDouble(double value, double plus, double minus) {
        return of(Fixed64.fromDouble(value), Fixed32.fromDouble(plus), Fixed32.fromDouble(minus));
    }

    public static Tolerance128 fromDouble(double value, double tolerance) {
        return withSym(Fixed64.fromDouble(value), Fixed32.fromDouble(tolerance));
    }

    public static Tolerance128 fromDouble(double value) {
        return valueOf(Fixed64.fromDouble(value));
    }

    public static Tolerance128 fromString(CharSequence text) {
        long[] ticks = ToleranceFormat.parse(text, TYPE, Width.BITS_64, Width.BITS_32);
        return new Tolerance128(
                Fixed64.fromTicks(ticks[ToleranceFormat.VALUE]),
                Fixed32.fromTicks(ticks[ToleranceFormat.PLUS]),
                Fixed32.fromTicks(ticks[ToleranceFormat.MINUS]));
    }

    public static Tolerance128 fromBytes(byte[] bytes, ByteOrder order) {
        long[] ticks = readTicks(bytes, order, Width.BITS_64, Width.BITS_32);
        return fromTicks(ticks[0], ticks[1], ticks[2]);
    }

    public static Tolerance128 fromBigEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.BIG_ENDIAN);
    }

    public static Tolerance128 fromLittleEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.LITTLE_ENDIAN);
    }

    public static Tolerance128 fromNativeEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.nativeOrder());
    }

    public static Tolerance128 sum(Iterable<Tolerance128> values) {
        var result = ZERO;
        for (var value : values) {
            result = result.add(value);
        }
        return result;
    }

    /**
     * Widens a narrow tolerance.
     */
    public static Tolerance128 valueOf(Tolerance64 other) {
        return new Tolerance128(other.value.toFixed64(), other.plus.toFixed32(), other.minus.toFixed32());
    }

    /**
     * Narrows to a {@link Tolerance64}, throws if any part is out of range.
     */
    public Tolerance64 toTolerance64() {
        return Tolerance64.of(value.toFixed32(), plus.toFixed16(), minus.toFixed16());
    }
}
