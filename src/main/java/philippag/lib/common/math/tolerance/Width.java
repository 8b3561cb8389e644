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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Backing integer width of a fixed-point type.
 * Holds the range and the native two's complement behavior
 * so {@link FixedPoint} can do all its math in {@code long}.
 */
public enum Width {

    BITS_16(Short.MIN_VALUE, Short.MAX_VALUE, Short.BYTES) {

        @Override
        long wrap(long ticks) {
            return (short) ticks;
        }

        @Override
        void put(ByteBuffer buffer, long ticks) {
            buffer.putShort((short) ticks);
        }

        @Override
        long get(ByteBuffer buffer) {
            return buffer.getShort();
        }
    },

    BITS_32(Integer.MIN_VALUE, Integer.MAX_VALUE, Integer.BYTES) {

        @Override
        long wrap(long ticks) {
            return (int) ticks;
        }

        @Override
        void put(ByteBuffer buffer, long ticks) {
            buffer.putInt((int) ticks);
        }

        @Override
        long get(ByteBuffer buffer) {
            return buffer.getInt();
        }
    },

    BITS_64(Long.MIN_VALUE, Long.MAX_VALUE, Long.BYTES) {

        @Override
        long wrap(long ticks) {
            return ticks;
        }

        @Override
        void put(ByteBuffer buffer, long ticks) {
            buffer.putLong(ticks);
        }

        @Override
        long get(ByteBuffer buffer) {
            return buffer.getLong();
        }
    };

    private final long min;
    private final long max;
    private final int bytes;

    Width(long min, long max, int bytes) {
        this.min = min;
        this.max = max;
        this.bytes = bytes;
    }

    public long min() {
        return min;
    }

    public long max() {
        return max;
    }

    public int bytes() {
        return bytes;
    }

    public int bits() {
        return bytes * Byte.SIZE;
    }

    public boolean contains(long ticks) {
        return min <= ticks && ticks <= max;
    }

    public boolean isWiderThan(Width other) {
        return bytes > other.bytes;
    }

    // two's complement truncation, like a primitive cast
    abstract long wrap(long ticks);

    abstract void put(ByteBuffer buffer, long ticks);

    abstract long get(ByteBuffer buffer);

    long checked(long ticks, String typeName) {
        if (!contains(ticks)) {
            throw ToleranceException.overflow(ticks + " ticks are out of range for a " + typeName);
        }
        return ticks;
    }

    // operands of the operator style arithmetic must fit, the result may wrap
    long operand(long ticks, String typeName) {
        if (!contains(ticks)) {
            throw new ArithmeticException("Operand " + ticks + " out of scope for a " + typeName);
        }
        return ticks;
    }

    byte[] toBytes(long ticks, ByteOrder order) {
        var buffer = ByteBuffer.allocate(bytes).order(order);
        put(buffer, ticks);
        return buffer.array();
    }

    long fromBytes(byte[] array, ByteOrder order) {
        if (array.length != bytes) {
            throw new IllegalArgumentException("Expecting " + bytes + " bytes, got " + array.length);
        }
        return get(ByteBuffer.wrap(array).order(order));
    }
}
