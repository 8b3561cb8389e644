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

import java.util.function.Function;

/**
 * The two ways a blank string can be read.
 *
 * Inside a structured tolerance a blank field counts as missing, so the usual
 * defaults apply ({@code minus = -plus}). A blank scalar standing for a whole
 * tolerance means zero.
 */
public final class ToleranceFields {

    private ToleranceFields() {
    }

    /**
     * Returns null for a null or blank text, the parsed value otherwise.
     */
    public static <T> T emptyAsAbsent(String text, Function<String, T> parser) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return parser.apply(text);
    }

    /**
     * Returns {@code zero} for a null or blank text, the parsed value otherwise.
     */
    public static <T> T emptyAsZero(String text, Function<String, T> parser, T zero) {
        if (text == null || text.isBlank()) {
            return zero;
        }
        return parser.apply(text);
    }
}
