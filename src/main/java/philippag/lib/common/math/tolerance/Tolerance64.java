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
 * 64-bit wide tolerance: a {@link Fixed32} value with {@link Fixed16} deviations.
 *
 * <pre>
 *   var width = Tolerance64.fromDouble(100.0, 0.05, -0.2);
 *   width.toString();        // "100.0 +0.05/-0.2"
 *   width.toDebugString();   // "Tolerance64(100.0000 +0.0500 -0.2000)"
 * </pre>
 *
 * Deviations are limited to {@code +/- 3.2767 mm}.
 */
public final class Tolerance64 extends Tolerance<Tolerance64, Fixed32, Fixed16> {

    /** The neutral element in relation to addition and subtraction. */
    public static final Tolerance64 ZERO = new Tolerance64(Fixed32.ZERO, Fixed16.ZERO, Fixed16.ZERO);

    public static final int BYTES = Integer.BYTES + 2 * Short.BYTES;

    private static final String TYPE = "Tolerance64";

    private Tolerance64(Fixed32 value, Fixed16 plus, Fixed16 minus) {
        super(value, plus, minus);
    }

    @Override
    Tolerance64 create(Fixed32 value, Fixed16 plus, Fixed16 minus) {
        return new Tolerance64(value, plus, minus);
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Tolerance64 of(Fixed32 value, Fixed16 plus, Fixed16 minus) {
        checkDeviations(plus, minus);
        return new Tolerance64(value, plus, minus);
    }

    public static Tolerance64 withSym(Fixed32 value, Fixed16 tolerance) {
        return of(value, tolerance, tolerance.negate());
    }

    /**
     * No deviations.
     */
    public static Tolerance64 valueOf(Fixed32 value) {
        return new Tolerance64(value, Fixed16.ZERO, Fixed16.ZERO);
    }

    /**
     * All parts in ticks, range checked.
     */
    public static Tolerance64 fromTicks(long value, long plus, long minus) {
        return of(Fixed32.fromTicks(value), Fixed16.fromTicks(plus), Fixed16.fromTicks(minus));
    }

    public static Tolerance64 fromTicks(long value, long tolerance) {
        return withSym(Fixed32.fromTicks(value), Fixed16.fromTicks(tolerance));
    }

    /**
     * All parts in mm.
     */
    public static Tolerance64 fromDouble(double value, double plus, double minus) {
        return of(Fixed32.fromDouble(value), Fixed16.fromDouble(plus), Fixed16.fromDouble(minus));
    }

    public static Tolerance64 fromDouble(double value, double tolerance) {
        return withSym(Fixed32.fromDouble(value), Fixed16.fromDouble(tolerance));
    }

    public static Tolerance64 fromDouble(double value) {
        return valueOf(Fixed32.fromDouble(value));
    }

    public static Tolerance64 fromString(CharSequence text) {
        long[] ticks = ToleranceFormat.parse(text, TYPE, Width.BITS_32, Width.BITS_16);
        return new Tolerance64(
                Fixed32.fromTicks(ticks[ToleranceFormat.VALUE]),
                Fixed16.fromTicks(ticks[ToleranceFormat.PLUS]),
                Fixed16.fromTicks(ticks[ToleranceFormat.MINUS]));
    }

    public static Tolerance64 fromBytes(byte[] bytes, ByteOrder order) {
        long[] ticks = readTicks(bytes, order, Width.BITS_32, Width.BITS_16);
        return fromTicks(ticks[0], ticks[1], ticks[2]);
    }

    public static Tolerance64 fromBigEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.BIG_ENDIAN);
    }

    public static Tolerance64 fromLittleEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.LITTLE_ENDIAN);
    }

    public static Tolerance64 fromNativeEndian(byte[] bytes) {
        return fromBytes(bytes, ByteOrder.nativeOrder());
    }

    public static Tolerance64 sum(Iterable<Tolerance64> values) {
        var result = ZERO;
        for (var value : values) {
            result = result.add(value);
        }
        return result;
    }

    public Tolerance128 toTolerance128() {
        return Tolerance128.valueOf(this);
    }
}
