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

import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;

import philippag.lib.common.math.tolerance.Fixed16;
import philippag.lib.common.math.tolerance.Fixed32;
import philippag.lib.common.math.tolerance.Fixed64;
import philippag.lib.common.math.tolerance.Tolerance128;
import philippag.lib.common.math.tolerance.Tolerance64;

/**
 * Gson factory for the fixed-point and tolerance types.
 *
 * The set of supported types is closed, the adapter is chosen by the
 * declared raw type, never by inspecting values.
 */
public final class ToleranceTypeAdapterFactory implements TypeAdapterFactory {

    private final ToleranceGson.Style style;

    private ToleranceTypeAdapterFactory(ToleranceGson.Style style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public static ToleranceTypeAdapterFactory create() {
        return create(ToleranceGson.Style.STRUCT);
    }

    public static ToleranceTypeAdapterFactory create(ToleranceGson.Style style) {
        return new ToleranceTypeAdapterFactory(style);
    }

    public ToleranceGson.Style getStyle() {
        return style;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        TypeAdapter<?> result;
        if (raw == Fixed16.class) {
            result = FixedPointTypeAdapter.FIXED_16;
        } else if (raw == Fixed32.class) {
            result = FixedPointTypeAdapter.FIXED_32;
        } else if (raw == Fixed64.class) {
            result = FixedPointTypeAdapter.FIXED_64;
        } else if (raw == Tolerance64.class) {
            result = ToleranceTypeAdapter.forTolerance64(style);
        } else if (raw == Tolerance128.class) {
            result = ToleranceTypeAdapter.forTolerance128(style);
        } else {
            return null;
        }
        return (TypeAdapter<T>) result;
    }
}
