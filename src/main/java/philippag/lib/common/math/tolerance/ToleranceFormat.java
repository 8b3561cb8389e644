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
 * Text form of the tolerance types.
 *
 * Input: up to 3 numbers in mm, separated by blanks, {@code /}, {@code ;},
 * {@code +/-} or {@code +-}:
 * <ul>
 * <li>3 parts: value, plus, minus</li>
 * <li>2 parts: value, plus, -plus</li>
 * <li>1 part: value, 0, 0</li>
 * </ul>
 * A leading zero can be omitted ({@code .04}), so can the point ({@code 140}).
 *
 * Output: {@code "100.0 +0.05/-0.2"} or {@code "2.0 +/-0.005"} for symmetric deviations.
 */
final class ToleranceFormat {

    static final int VALUE = 0;
    static final int PLUS  = 1;
    static final int MINUS = 2;

    private ToleranceFormat() {
    }

    /**
     * Returns {value, plus, minus} in ticks, range checked and ordered.
     */
    static long[] parse(CharSequence text, String typeName, Width valueWidth, Width deviationWidth) {
        String str = text.toString();
        String[] parts = str
                .replace("+/-", " ")
                .replace("+-", " ")
                .replace('/', ' ')
                .replace(';', ' ')
                .strip()
                .split("\\s+");

        if (parts.length == 1 && parts[0].isEmpty()) {
            throw ToleranceException.parseError("Cannot parse an empty string into a " + typeName + "!");
        }
        if (parts.length > 3) {
            throw ToleranceException.parseError(typeName + " not parsable from '" + str + "', expecting at most 3 parts, got " + parts.length + "!");
        }

        long[] ticks = new long[3];
        for (int i = 0; i < parts.length; i++) {
            try {
                ticks[i] = TickFormat.parse(parts[i], typeName);
            } catch (ToleranceException e) {
                if (e.isOverflow()) {
                    throw e;
                }
                throw new ToleranceException(ToleranceException.Kind.PARSE, typeName + " not parsable from '" + str + "'!", e);
            }
        }

        if (!valueWidth.contains(ticks[VALUE])) {
            throw ToleranceException.overflow(parts[VALUE] + " is too big for the value of a " + typeName);
        }
        for (int i = PLUS; i < parts.length; i++) {
            if (!deviationWidth.contains(ticks[i])) {
                throw ToleranceException.overflow(parts[i] + " is too big for the deviation of a " + typeName);
            }
        }

        if (parts.length == 2) {
            ticks[MINUS] = -ticks[PLUS];
            if (!deviationWidth.contains(ticks[MINUS])) {
                throw ToleranceException.overflow("-" + parts[PLUS] + " is too big for the deviation of a " + typeName);
            }
        }
        if (ticks[PLUS] < ticks[MINUS]) {
            throw ToleranceException.parseError(typeName + " not parsable from '" + str + "', plus has to be bigger than minus!");
        }
        return ticks;
    }

    /**
     * Each component with its own minimal precision.
     */
    static String format(FixedPoint<?> value, FixedPoint<?> plus, FixedPoint<?> minus) {
        var sb = new StringBuilder(32);
        TickFormat.format(sb, value.ticks, TickFormat.autoPrecision(value.ticks), false);
        appendDeviations(sb, plus.ticks, TickFormat.autoPrecision(plus.ticks), minus.ticks, TickFormat.autoPrecision(minus.ticks));
        return sb.toString();
    }

    /**
     * Every component with the same precision, deviations rounded before
     * deciding on the symmetric form.
     */
    static String format(FixedPoint<?> value, FixedPoint<?> plus, FixedPoint<?> minus, int precision) {
        precision = TickFormat.checkPrecision(precision);
        var sb = new StringBuilder(32);
        TickFormat.format(sb, value.ticks, precision, false);
        // deviations are at most 32 bits wide, rounding can't overflow
        appendDeviations(sb, TickFormat.round(plus.ticks, precision), precision, TickFormat.round(minus.ticks, precision), precision);
        return sb.toString();
    }

    private static void appendDeviations(StringBuilder sb, long plus, int plusPrecision, long minus, int minusPrecision) {
        sb.append(' ');
        if (plus == -minus && plus >= 0) {
            sb.append("+/-");
            TickFormat.format(sb, plus, plusPrecision, false);
        } else {
            TickFormat.format(sb, plus, plusPrecision, true);
            sb.append('/');
            if (minus <= 0) {
                sb.append('-');
                TickFormat.format(sb, -minus, minusPrecision, false);
            } else {
                TickFormat.format(sb, minus, minusPrecision, true);
            }
        }
    }

    /**
     * Raw ticks, always the asymmetric form: {@code "-3500 +100/-140"}.
     */
    static String formatAlternate(FixedPoint<?> value, FixedPoint<?> plus, FixedPoint<?> minus) {
        var sb = new StringBuilder(32);
        sb.append(value.ticks).append(' ');
        if (plus.ticks >= 0) {
            sb.append('+');
        }
        sb.append(plus.ticks).append('/');
        if (minus.ticks <= 0) {
            sb.append('-').append(-minus.ticks);
        } else {
            sb.append('+').append(minus.ticks);
        }
        return sb.toString();
    }

    static String formatDebug(String typeName, FixedPoint<?> value, FixedPoint<?> plus, FixedPoint<?> minus) {
        return typeName + "(" + value.format(TickFormat.MAX_PRECISION)
                + " " + plus.format(TickFormat.MAX_PRECISION, true)
                + " " + minus.format(TickFormat.MAX_PRECISION, true) + ")";
    }
}
