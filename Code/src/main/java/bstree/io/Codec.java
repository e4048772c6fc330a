package bstree.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Writes and reads one item of the tree file format: an 8-byte size field
 * followed by the item's bytes.
 *
 * @see Codecs
 */
public interface Codec<T> {

    void write(T item, OutputStream out) throws IOException;

    /**
     * Reads one item.
     *
     * @throws DataFormatException if the stream ends inside the item or the
     *         size field does not fit the type
     */
    T read(InputStream in) throws IOException;
}
