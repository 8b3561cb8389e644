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

package philippag.lib.common.math.tolerance.json;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.Function;
import java.util.function.LongFunction;

import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import philippag.lib.common.math.tolerance.Fixed16;
import philippag.lib.common.math.tolerance.Fixed32;
import philippag.lib.common.math.tolerance.Fixed64;
import philippag.lib.common.math.tolerance.FixedPoint;

/**
 * Writes a fixed-point value as its raw tick count.
 *
 * Reads, in this order:
 * <ol>
 * <li>an integral JSON number as ticks: {@code 230040}</li>
 * <li>a fractional JSON number as mm, exactly and truncated to ticks: {@code 23.004}</li>
 * <li>a JSON string in the usual grammar: {@code "23.004"}, {@code ".004"}</li>
 * </ol>
 */
public final class FixedPointTypeAdapter<T extends FixedPoint<T>> extends TypeAdapter<T> {

    static final FixedPointTypeAdapter<Fixed16> FIXED_16 = new FixedPointTypeAdapter<>(Fixed16::fromTicks, Fixed16::fromString);
    static final FixedPointTypeAdapter<Fixed32> FIXED_32 = new FixedPointTypeAdapter<>(Fixed32::fromTicks, Fixed32::fromString);
    static final FixedPointTypeAdapter<Fixed64> FIXED_64 = new FixedPointTypeAdapter<>(Fixed64::fromTicks, Fixed64::fromString);

    private final LongFunction<T> fromTicks;
    private final Function<String, T> parser;

    private FixedPointTypeAdapter(LongFunction<T> fromTicks, Function<String, T> parser) {
        this.fromTicks = fromTicks;
        this.parser = parser;
    }

    @Override
    public void write(JsonWriter out, T value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        out.value(value.ticks());
    }

    @Override
    public T read(JsonReader in) throws IOException {
        return switch (in.peek()) {
            case NULL -> {
                in.nextNull();
                yield null;
            }
            case NUMBER -> fromNumber(in.nextString(), in.getPath());
            case STRING -> fromString(in.nextString(), in.getPath());
            default -> throw new JsonSyntaxException("Expecting a number or string at " + in.getPath() + ", got " + in.peek());
        };
    }

    /**
     * Reads a string field where a blank string counts as missing.
     */
    T readField(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.STRING) {
            String path = in.getPath();
            return ToleranceFields.emptyAsAbsent(in.nextString(), s -> fromString(s, path));
        }
        return read(in);
    }

    T fromNumber(String literal, String path) {
        try {
            if (isIntegral(literal)) {
                return fromTicks.apply(Long.parseLong(literal));
            }
            return fromTicks.apply(millimetersToTicks(new BigDecimal(literal)));
        } catch (IllegalArgumentException | ArithmeticException e) { // includes NumberFormatException and ToleranceException
            throw new JsonSyntaxException("Invalid number " + literal + " at " + path + ": " + e.getMessage(), e);
        }
    }

    static long millimetersToTicks(BigDecimal mm) {
        // more integer digits than a long has, don't expand 1e999999999
        if (mm.signum() != 0 && mm.precision() - mm.scale() > 16) {
            throw new ArithmeticException(mm + " mm is out of range");
        }
        return mm.movePointRight(4).setScale(0, RoundingMode.DOWN).longValueExact();
    }

    /**
     * The exact decimal mm of a value, with at least one fractional digit
     * so it never reads back as ticks.
     */
    static BigDecimal millimeters(FixedPoint<?> value) {
        var mm = BigDecimal.valueOf(value.ticks(), 4).stripTrailingZeros();
        return mm.scale() < 1 ? mm.setScale(1) : mm;
    }

    T fromString(String text, String path) {
        try {
            return parser.apply(text);
        } catch (IllegalArgumentException e) {
            throw new JsonSyntaxException("Invalid string '" + text + "' at " + path + ": " + e.getMessage(), e);
        }
    }

    private static boolean isIntegral(String literal) {
        for (int i = 0, len = literal.length(); i < len; i++) {
            char c = literal.charAt(i);
            if (c == '.' || c == 'e' || c == 'E') {
                return false;
            }
        }
        return true;
    }
}
