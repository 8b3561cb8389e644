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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Ready made {@link Gson} instances that know the fixed-point and tolerance types.
 *
 * <pre>
 *   Gson gson = ToleranceGson.gson(ToleranceGson.Style.STRING);
 *   gson.toJson(Tolerance128.fromDouble(10.0, 0.1));     // "10.0 +/-0.1"
 *   gson.fromJson("[10.0, 0.1]", Tolerance128.class);    // 10.0 +/-0.1
 * </pre>
 *
 * Reading accepts every shape regardless of the style.
 */
public final class ToleranceGson {

    /**
     * How tolerances are written.
     */
    public enum Style {
        /** {@code {"value": 100000, "plus": 1000, "minus": -1000}} in ticks */
        STRUCT,
        /** {@code "10.0 +/-0.1"} */
        STRING,
        /** {@code {"value": 10.0, "plus": 0.1, "minus": -0.1}} in mm */
        FLOAT_STRUCT,
        /** {@code [10.0, 0.1, -0.1]} in mm */
        FLOAT_SEQUENCE,
    }

    private static final Gson INSTANCE = builder(Style.STRUCT).create();

    private ToleranceGson() {
    }

    public static Gson gson() {
        return INSTANCE;
    }

    public static Gson gson(Style style) {
        return style == Style.STRUCT ? INSTANCE : builder(style).create();
    }

    public static GsonBuilder builder(Style style) {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapterFactory(ToleranceTypeAdapterFactory.create(style));
    }
}
