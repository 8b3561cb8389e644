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

/**
 * Length unit, expressed as a conversion factor into ticks (1/10 µ).
 *
 * Used to round, floor and convert the fixed-point types:
 * <pre>
 *   Fixed32.fromInt(1_234_567).round(Unit.CM)   // 120.0000 mm
 *   Fixed64.fromDouble(12456.832).toUnit(Unit.METER)   // 12.456832
 * </pre>
 */
public final class Unit implements Comparable<Unit> {

    private static final long[] POWERS_OF_TEN = {
            1L,
            10L,
            100L,
            1_000L,
            10_000L,
            100_000L,
            1_000_000L,
            10_000_000L,
            100_000_000L,
            1_000_000_000L,
            10_000_000_000L,
            100_000_000_000L,
            1_000_000_000_000L,
            10_000_000_000_000L,
            100_000_000_000_000L,
            1_000_000_000_000_000L,
            10_000_000_000_000_000L,
            100_000_000_000_000_000L,
            1_000_000_000_000_000_000L,
    };

    /** Micrometer, {@code 1 µ = 10 ticks}, same as {@code potency(1)}. */
    public static final Unit MY = new Unit(10);

    /** Millimeter, {@code 1 mm = 1_000 µ}, same as {@code potency(4)}. */
    public static final Unit MM = new Unit(1_000 * MY.factor);

    /** Centimeter, {@code 1 cm = 10 mm}, same as {@code potency(5)}. */
    public static final Unit CM = new Unit(10 * MM.factor);

    /** Inch, {@code 1 in = 25.4 mm}. */
    public static final Unit INCH = new Unit(25_400 * MY.factor);

    /** Foot, {@code 1 ft = 12 in = 304.8 mm}. */
    public static final Unit FT = new Unit(12 * INCH.factor);

    /** Yard, {@code 1 yd = 3 ft = 914.4 mm}. */
    public static final Unit YD = new Unit(3 * FT.factor);

    /** Meter, {@code 1 m = 1_000 mm}, same as {@code potency(7)}. */
    public static final Unit METER = new Unit(1_000 * MM.factor);

    /** Kilometer, {@code 1 km = 1_000 m}, same as {@code potency(10)}. */
    public static final Unit KM = new Unit(1_000 * METER.factor);

    /** Mile, {@code 1 mi = 1760 yd = 1609.344 m}. */
    public static final Unit MILE = new Unit(1760 * YD.factor);

    private final long factor;

    private Unit(long factor) {
        this.factor = factor;
    }

    public static Unit of(long factor) {
        if (factor < 0) {
            throw new IllegalArgumentException("negative unit factor: " + factor);
        }
        return new Unit(factor);
    }

    /**
     * Ten to the power of {@code p}.
     */
    public static Unit potency(int p) {
        if (p < 0 || p >= POWERS_OF_TEN.length) {
            throw new IllegalArgumentException("potency out of range: " + p);
        }
        return new Unit(POWERS_OF_TEN[p]);
    }

    static long powerOfTen(int p) {
        return POWERS_OF_TEN[p];
    }

    /**
     * The number of ticks in one of this unit.
     */
    public long multiply() {
        return factor;
    }

    /**
     * Converts {@code count} of this unit into ticks.
     */
    public long times(long count) {
        return Math.multiplyExact(factor, count);
    }

    public Unit scale(long by) {
        return of(Math.multiplyExact(factor, by));
    }

    @Override
    public int compareTo(Unit o) {
        return Long.compare(factor, o.factor);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Unit o && factor == o.factor;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(factor);
    }

    @Override
    public String toString() {
        return "Unit(" + factor + ")";
    }
}
