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
import java.util.function.Function;

import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import philippag.lib.common.math.tolerance.FixedPoint;
import philippag.lib.common.math.tolerance.Fixed16;
import philippag.lib.common.math.tolerance.Fixed32;
import philippag.lib.common.math.tolerance.Fixed64;
import philippag.lib.common.math.tolerance.Tolerance;
import philippag.lib.common.math.tolerance.Tolerance128;
import philippag.lib.common.math.tolerance.Tolerance64;
import philippag.lib.common.math.tolerance.ToleranceString;

/**
 * Reads a tolerance from any of these shapes, tried in this order:
 * <ol>
 * <li>an object: {@code {"value": 125000, "plus": 3000, "minus": -2000}},
 *     field names may be abbreviated to {@code v}, {@code p} and {@code m},
 *     each field is a number or a string like for {@link FixedPointTypeAdapter};
 *     a missing (or blank) minus defaults to {@code -plus}, missing plus and minus
 *     default to zero, the value is mandatory</li>
 * <li>an array of 1 to 3 numbers or strings: value, plus, minus;
 *     two elements mean a symmetric tolerance</li>
 * <li>a string: {@code "12.5 +0.3/-0.2"}, a blank string means zero</li>
 * <li>a number: the value only</li>
 * </ol>
 * Writes in the configured {@link ToleranceGson.Style}.
 */
public final class ToleranceTypeAdapter<T extends Tolerance<T, V, D>, V extends FixedPoint<V>, D extends FixedPoint<D>> extends TypeAdapter<T> {

    @FunctionalInterface
    interface Factory<T, V, D> {

        T of(V value, D plus, D minus);
    }

    private final String typeName;
    private final ToleranceGson.Style style;
    private final FixedPointTypeAdapter<V> valueAdapter;
    private final FixedPointTypeAdapter<D> deviationAdapter;
    private final Factory<T, V, D> factory;
    private final Function<V, T> valueOf;
    private final Function<String, T> parser;
    private final T zero;

    private ToleranceTypeAdapter(
            String typeName,
            ToleranceGson.Style style,
            FixedPointTypeAdapter<V> valueAdapter,
            FixedPointTypeAdapter<D> deviationAdapter,
            Factory<T, V, D> factory,
            Function<V, T> valueOf,
            Function<String, T> parser,
            T zero) {
        this.typeName = typeName;
        this.style = style;
        this.valueAdapter = valueAdapter;
        this.deviationAdapter = deviationAdapter;
        this.factory = factory;
        this.valueOf = valueOf;
        this.parser = parser;
        this.zero = zero;
    }

    static ToleranceTypeAdapter<Tolerance64, Fixed32, Fixed16> forTolerance64(ToleranceGson.Style style) {
        return new ToleranceTypeAdapter<>("Tolerance64", style,
                FixedPointTypeAdapter.FIXED_32, FixedPointTypeAdapter.FIXED_16,
                Tolerance64::of, Tolerance64::valueOf, Tolerance64::fromString, Tolerance64.ZERO);
    }

    static ToleranceTypeAdapter<Tolerance128, Fixed64, Fixed32> forTolerance128(ToleranceGson.Style style) {
        return new ToleranceTypeAdapter<>("Tolerance128", style,
                FixedPointTypeAdapter.FIXED_64, FixedPointTypeAdapter.FIXED_32,
                Tolerance128::of, Tolerance128::valueOf, Tolerance128::fromString, Tolerance128.ZERO);
    }

    /* =======
     * writing
     * =======
     */

    @Override
    public void write(JsonWriter out, T value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        switch (style) {
            case STRUCT -> {
                out.beginObject();
                out.name("value").value(value.value().ticks());
                out.name("plus").value(value.plus().ticks());
                out.name("minus").value(value.minus().ticks());
                out.endObject();
            }
            case STRING -> writeString(out, value);
            case FLOAT_STRUCT -> {
                out.beginObject();
                out.name("value").value(FixedPointTypeAdapter.millimeters(value.value()));
                out.name("plus").value(FixedPointTypeAdapter.millimeters(value.plus()));
                out.name("minus").value(FixedPointTypeAdapter.millimeters(value.minus()));
                out.endObject();
            }
            case FLOAT_SEQUENCE -> {
                out.beginArray();
                out.value(FixedPointTypeAdapter.millimeters(value.value()));
                out.value(FixedPointTypeAdapter.millimeters(value.plus()));
                out.value(FixedPointTypeAdapter.millimeters(value.minus()));
                out.endArray();
            }
            default -> throw new Error("UNREACHABLE");
        }
    }

    private static void writeString(JsonWriter out, ToleranceString value) throws IOException {
        out.value(value.toToleranceString());
    }

    /* =======
     * reading
     * =======
     */

    @Override
    public T read(JsonReader in) throws IOException {
        return switch (in.peek()) {
            case NULL -> {
                in.nextNull();
                yield null;
            }
            case BEGIN_OBJECT -> readObject(in);
            case BEGIN_ARRAY -> readArray(in);
            case STRING -> readString(in);
            case NUMBER -> valueOf.apply(valueAdapter.read(in));
            default -> throw new JsonSyntaxException("Expecting a " + typeName + " at " + in.getPath() + ", got " + in.peek());
        };
    }

    private T readObject(JsonReader in) throws IOException {
        String path = in.getPath();
        V value = null;
        D plus = null;
        D minus = null;

        in.beginObject();
        while (in.hasNext()) {
            switch (in.nextName()) {
                case "value", "v" -> value = valueAdapter.readField(in);
                case "plus", "p" -> plus = deviationAdapter.readField(in);
                case "minus", "m" -> minus = deviationAdapter.readField(in);
                default -> in.skipValue();
            }
        }
        in.endObject();

        return assemble(value, plus, minus, path);
    }

    private T readArray(JsonReader in) throws IOException {
        String path = in.getPath();
        V value = null;
        D plus = null;
        D minus = null;
        int count = 0;

        in.beginArray();
        while (in.hasNext()) {
            switch (count++) {
                case 0 -> value = valueAdapter.read(in);
                case 1 -> plus = deviationAdapter.read(in);
                case 2 -> minus = deviationAdapter.read(in);
                default -> throw new JsonSyntaxException("Expecting at most 3 elements for a " + typeName + " at " + path);
            }
        }
        in.endArray();

        if (count == 0) {
            throw new JsonSyntaxException("Expecting at least 1 element for a " + typeName + " at " + path);
        }
        return assemble(value, plus, minus, path);
    }

    private T readString(JsonReader in) throws IOException {
        String path = in.getPath();
        String text = in.nextString();
        try {
            return ToleranceFields.emptyAsZero(text, parser, zero);
        } catch (IllegalArgumentException e) {
            throw new JsonSyntaxException("Invalid " + typeName + " '" + text + "' at " + path + ": " + e.getMessage(), e);
        }
    }

    private T assemble(V value, D plus, D minus, String path) {
        if (value == null) {
            throw new JsonSyntaxException(typeName + " without a value at " + path);
        }
        if (plus == null) {
            if (minus != null) {
                throw new JsonSyntaxException(typeName + " with a minus but without a plus at " + path);
            }
            return valueOf.apply(value);
        }
        try {
            return factory.of(value, plus, minus == null ? plus.negate() : minus);
        } catch (IllegalArgumentException e) {
            throw new JsonSyntaxException("Invalid " + typeName + " at " + path + ": " + e.getMessage(), e);
        }
    }
}
