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
 * Decimal parsing and formatting of tick counts, shared by all
 * fixed-point and tolerance types.
 *
 * The textual unit is always millimeters, with at most 4 fractional digits
 * (1 tick = 0.0001 mm).
 */
final class TickFormat {

    static final int MAX_PRECISION = 4;
    static final long TICKS_PER_MM = 10_000;

    private TickFormat() {
    }

    /**
     * Grammar: {@code [sign] [integer] ['.' fraction]}, surrounding whitespace ignored.
     * The fraction is truncated or zero padded to 4 digits.
     * The result is not range checked against any width.
     */
    static long parse(CharSequence input, String typeName) {
        String str = input.toString().strip();
        if (str.isEmpty()) {
            throw ToleranceException.parseError("Cannot parse an empty string into a " + typeName + "!");
        }

        int from = 0;
        boolean negative = false;
        char c = str.charAt(0);
        if (c == '-') {
            negative = true;
            from++;
        } else if (c == '+') {
            from++;
        }

        int len = str.length();
        int dot = str.indexOf('.', from);
        int integerEnd = dot < 0 ? len : dot;
        int fractionStart = dot < 0 ? len : dot + 1;
        if (integerEnd == from && fractionStart == len) {
            throw ToleranceException.parseError("No digits in input '" + str + "', can't parse input into a " + typeName + "!");
        }

        // accumulated negatively, the negative range reaches one tick further
        long integer = parseDigits(str, from, integerEnd, typeName);
        long fraction = parseFraction(str, fractionStart, len, typeName);
        try {
            long ticks = Math.subtractExact(Math.multiplyExact(integer, TICKS_PER_MM), fraction);
            return negative ? ticks : Math.negateExact(ticks);
        } catch (ArithmeticException e) {
            throw tooBig(str, typeName, e);
        }
    }

    // the negated value of the digits
    private static long parseDigits(String str, int fromIndex, int toIndex, String typeName) {
        long result = 0;
        for (int i = fromIndex; i < toIndex; i++) {
            int digit = digit(str, i, typeName);
            try {
                result = Math.subtractExact(Math.multiplyExact(result, 10), digit);
            } catch (ArithmeticException e) {
                throw tooBig(str, typeName, e);
            }
        }
        return result;
    }

    private static ToleranceException tooBig(String str, String typeName, ArithmeticException cause) {
        return new ToleranceException(ToleranceException.Kind.OVERFLOW, str + " is too big for a " + typeName, cause);
    }

    // all digits are validated, only the first 4 count
    private static long parseFraction(String str, int fromIndex, int toIndex, String typeName) {
        long result = 0;
        for (int i = 0; i < MAX_PRECISION; i++) {
            int index = fromIndex + i;
            result = 10 * result + (index < toIndex ? digit(str, index, typeName) : 0);
        }
        for (int i = fromIndex + MAX_PRECISION; i < toIndex; i++) {
            digit(str, i, typeName);
        }
        return result;
    }

    private static int digit(String str, int index, String typeName) {
        char c = str.charAt(index);
        if (!('0' <= c && c <= '9')) {
            throw ToleranceException.parseError("Found non-numerical character '" + c + "' at index " + index
                    + " in input '" + str + "', can't parse input into a " + typeName + "!");
        }
        return c - '0';
    }

    // 1 to 4
    static int autoPrecision(long ticks) {
        return ticks % 1000 == 0 ? 1
             : ticks % 100 == 0 ? 2
             : ticks % 10 == 0 ? 3
             : 4;
    }

    static int checkPrecision(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("negative precision: " + precision);
        }
        return Math.min(precision, MAX_PRECISION);
    }

    static String format(long ticks, int precision, boolean signPlus) {
        var sb = new StringBuilder(24);
        format(sb, ticks, precision, signPlus);
        return sb.toString();
    }

    /**
     * Appends the ticks as millimeters, rounded half away from zero to the precision.
     */
    static void format(StringBuilder sb, long ticks, int precision, boolean signPlus) {
        precision = checkPrecision(precision);
        long scaled = scale(ticks, precision);

        if (scaled < 0) {
            sb.append('-');
        } else if (signPlus) {
            sb.append('+');
        }

        String digits = Long.toString(scaled);
        if (scaled < 0) {
            digits = digits.substring(1); // works for MIN_VALUE, too
        }
        if (digits.length() <= precision) {
            digits = "0".repeat(precision + 1 - digits.length()) + digits;
        }

        int point = digits.length() - precision;
        sb.append(digits, 0, point);
        if (precision > 0) {
            sb.append('.').append(digits, point, digits.length());
        }
    }

    /**
     * Ticks rounded half away from zero to the given number of fractional mm digits,
     * still expressed in ticks. Overflows for values within 5000 ticks of the long range.
     */
    static long round(long ticks, int precision) {
        precision = checkPrecision(precision);
        return Math.multiplyExact(scale(ticks, precision), Unit.powerOfTen(MAX_PRECISION - precision));
    }

    // never overflows: with a divisor >= 10 there is room for the carry
    private static long scale(long ticks, int precision) {
        long divisor = Unit.powerOfTen(MAX_PRECISION - precision);
        long scaled = ticks / divisor;
        long rest = Math.abs(ticks % divisor);
        if (rest >= divisor - rest && rest != 0) {
            scaled += Long.signum(ticks);
        }
        return scaled;
    }
}
