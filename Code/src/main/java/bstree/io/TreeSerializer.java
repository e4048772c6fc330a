package bstree.io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bstree.AbstractBinaryTree;
import bstree.Entry;

/**
 * Reads and writes the tree file format:
 *
 * <pre>
 * [size=1][allow-duplicates flag]
 * [key size][key bytes] ([value size][value bytes])   one group per item
 * </pre>
 *
 * Items are written in {@link AbstractBinaryTree#items()} order so that
 * re-inserting them yields the same shape. A key-only tree has no value
 * groups; such a serializer is built with a {@code null} value codec.
 */
public class TreeSerializer<K extends Comparable<? super K>, V> {
    private static final Logger log = LoggerFactory.getLogger(TreeSerializer.class);

    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;

    public TreeSerializer(final Codec<K> keyCodec, final Codec<V> valueCodec) {
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = valueCodec;
    }

    public boolean isKeyOnly() {
        return valueCodec == null;
    }

    public void write(final AbstractBinaryTree<K, V, ?> tree, final OutputStream out) throws IOException {
        if (!tree.isKeyOnly() && valueCodec == null) {
            throw new IllegalArgumentException("a key/value tree needs a value codec");
        }
        Codecs.BOOLEAN.write(tree.allowsDuplicates(), out);
        for (Entry<K, V> e : tree.items()) {
            keyCodec.write(e.getKey(), out);
            if (!tree.isKeyOnly()) {
                valueCodec.write(e.getValue(), out);
            }
        }
    }

    /**
     * Reads a whole stream. The end of the stream is only accepted between two
     * items; a stream ending inside the header or an item is an error.
     *
     * @throws DataFormatException if the data is truncated or malformed
     */
    public TreeImage<K, V> read(final InputStream in) throws IOException {
        PushbackInputStream pin = new PushbackInputStream(in, 1);
        boolean allowDuplicateKeys = Codecs.BOOLEAN.read(pin);
        List<Entry<K, V>> items = new ArrayList<>();
        while (true) {
            int next = pin.read();
            if (next == -1) break;
            pin.unread(next);
            K key = keyCodec.read(pin);
            V value = valueCodec == null ? null : valueCodec.read(pin);
            items.add(new Entry<>(key, value));
        }
        return new TreeImage<>(allowDuplicateKeys, items);
    }

    /**
     * Writes {@code tree} to {@code path}, replacing any existing file.
     *
     * @return false if the file could not be opened or written; a file that
     *         was opened and then only partially written is removed when
     *         {@code deleteOnFailure} is set
     */
    public boolean save(final AbstractBinaryTree<K, V, ?> tree, final Path path, final boolean deleteOnFailure) {
        OutputStream file;
        try {
            file = Files.newOutputStream(path);
        } catch (IOException e) {
            log.error(String.format("Failed to open %s for writing", path), e);
            return false;
        }
        try (OutputStream out = new BufferedOutputStream(file)) {
            write(tree, out);
        } catch (IOException e) {
            log.error(String.format("Failed to write tree to %s", path), e);
            if (deleteOnFailure) {
                deletePartialFile(path);
            }
            return false;
        }
        if (log.isDebugEnabled()) {
            log.debug(String.format("Wrote %d items to %s", tree.count(), path));
        }
        return true;
    }

    public TreeImage<K, V> load(final Path path) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            TreeImage<K, V> image = read(in);
            if (log.isDebugEnabled()) {
                log.debug(String.format("Read %d items from %s", image.getItems().size(), path));
            }
            return image;
        } catch (DataFormatException e) {
            throw new DataFormatException(String.format("%s is corrupted: %s", path, e.getMessage()), e);
        }
    }

    private static void deletePartialFile(final Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.info(String.format("Deleted partial file %s", path));
            }
        } catch (IOException e) {
            log.error(String.format("Could not delete partial file %s", path), e);
        }
    }
}
