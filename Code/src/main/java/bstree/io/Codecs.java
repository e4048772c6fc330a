package bstree.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Codecs for the common key and value types, plus the size-field helpers
 * user codecs are expected to build on.
 *
 * <p>Size fields are 8-byte unsigned little-endian integers; fixed-width
 * payloads are little-endian as well. A fixed-width item always carries its
 * own width as size, a string its UTF-8 byte count.
 */
public final class Codecs {
    public static final int SIZE_FIELD_BYTES = 8;

    private Codecs() {
    }

    /**
     * Codec for a type with a fixed number of payload bytes.
     */
    public abstract static class FixedWidthCodec<T> implements Codec<T> {
        private final int width;

        protected FixedWidthCodec(final int width) {
            this.width = width;
        }

        protected abstract void encode(T item, ByteBuffer buf);

        protected abstract T decode(ByteBuffer buf);

        @Override
        public void write(final T item, final OutputStream out) throws IOException {
            ByteBuffer buf = ByteBuffer.allocate(width).order(ByteOrder.LITTLE_ENDIAN);
            encode(item, buf);
            writeSize(out, width);
            out.write(buf.array());
        }

        @Override
        public T read(final InputStream in) throws IOException {
            long size = readSize(in);
            if (size != width) {
                throw new DataFormatException("size field " + size + " does not match item width " + width);
            }
            return decode(ByteBuffer.wrap(readFully(in, width)).order(ByteOrder.LITTLE_ENDIAN));
        }
    }

    public static final Codec<Boolean> BOOLEAN = new FixedWidthCodec<Boolean>(1) {
        @Override
        protected void encode(Boolean item, ByteBuffer buf) {
            buf.put((byte) (item ? 1 : 0));
        }

        @Override
        protected Boolean decode(ByteBuffer buf) {
            return buf.get() != 0;
        }
    };

    public static final Codec<Byte> BYTE = new FixedWidthCodec<Byte>(Byte.BYTES) {
        @Override
        protected void encode(Byte item, ByteBuffer buf) {
            buf.put(item);
        }

        @Override
        protected Byte decode(ByteBuffer buf) {
            return buf.get();
        }
    };

    public static final Codec<Short> SHORT = new FixedWidthCodec<Short>(Short.BYTES) {
        @Override
        protected void encode(Short item, ByteBuffer buf) {
            buf.putShort(item);
        }

        @Override
        protected Short decode(ByteBuffer buf) {
            return buf.getShort();
        }
    };

    /** UTF-16 code unit, two bytes. */
    public static final Codec<Character> CHARACTER = new FixedWidthCodec<Character>(Character.BYTES) {
        @Override
        protected void encode(Character item, ByteBuffer buf) {
            buf.putChar(item);
        }

        @Override
        protected Character decode(ByteBuffer buf) {
            return buf.getChar();
        }
    };

    public static final Codec<Integer> INTEGER = new FixedWidthCodec<Integer>(Integer.BYTES) {
        @Override
        protected void encode(Integer item, ByteBuffer buf) {
            buf.putInt(item);
        }

        @Override
        protected Integer decode(ByteBuffer buf) {
            return buf.getInt();
        }
    };

    public static final Codec<Long> LONG = new FixedWidthCodec<Long>(Long.BYTES) {
        @Override
        protected void encode(Long item, ByteBuffer buf) {
            buf.putLong(item);
        }

        @Override
        protected Long decode(ByteBuffer buf) {
            return buf.getLong();
        }
    };

    public static final Codec<Float> FLOAT = new FixedWidthCodec<Float>(Float.BYTES) {
        @Override
        protected void encode(Float item, ByteBuffer buf) {
            buf.putFloat(item);
        }

        @Override
        protected Float decode(ByteBuffer buf) {
            return buf.getFloat();
        }
    };

    public static final Codec<Double> DOUBLE = new FixedWidthCodec<Double>(Double.BYTES) {
        @Override
        protected void encode(Double item, ByteBuffer buf) {
            buf.putDouble(item);
        }

        @Override
        protected Double decode(ByteBuffer buf) {
            return buf.getDouble();
        }
    };

    /** Size is the UTF-8 byte count, which is the character count for ASCII text. */
    public static final Codec<String> STRING = new Codec<String>() {
        @Override
        public void write(String item, OutputStream out) throws IOException {
            byte[] bytes = item.getBytes(StandardCharsets.UTF_8);
            writeSize(out, bytes.length);
            out.write(bytes);
        }

        @Override
        public String read(InputStream in) throws IOException {
            long size = readSize(in);
            if (size < 0 || size > Integer.MAX_VALUE - 8) {
                throw new DataFormatException("string size out of range: " + Long.toUnsignedString(size));
            }
            return new String(readFully(in, (int) size), StandardCharsets.UTF_8);
        }
    };

    //--------------------------------------------------------------------------------
    // SIZE FIELD HELPERS
    //--------------------------------------------------------------------------------

    public static void writeSize(final OutputStream out, final long size) throws IOException {
        out.write(ByteBuffer.allocate(SIZE_FIELD_BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(size).array());
    }

    public static long readSize(final InputStream in) throws IOException {
        return ByteBuffer.wrap(readFully(in, SIZE_FIELD_BYTES)).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }

    /** Reads exactly {@code n} bytes or fails with {@link DataFormatException}. */
    public static byte[] readFully(final InputStream in, final int n) throws IOException {
        byte[] bytes = in.readNBytes(n);
        if (bytes.length < n) {
            throw new DataFormatException("stream ended after " + bytes.length + " of " + n + " bytes");
        }
        return bytes;
    }
}
