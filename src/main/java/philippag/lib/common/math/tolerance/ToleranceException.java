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

import java.util.Objects;

/**
 * Thrown when a textual, numeric or binary input can't be turned into
 * a fixed-point or tolerance value.
 *
 * The message is meant to be shown to the user as-is.
 */
public class ToleranceException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** malformed textual input */
        PARSE,
        /** the value doesn't fit into the target width */
        OVERFLOW,
    }

    private final Kind kind;

    public ToleranceException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ToleranceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ToleranceException parseError(String message) {
        return new ToleranceException(Kind.PARSE, message);
    }

    public static ToleranceException overflow(String message) {
        return new ToleranceException(Kind.OVERFLOW, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isParseError() {
        return kind == Kind.PARSE;
    }

    public boolean isOverflow() {
        return kind == Kind.OVERFLOW;
    }
}
