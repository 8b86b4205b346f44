package product.sorter.storage;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import product.sorter.model.Product;
import product.sorter.model.SortKey;
import product.sorter.parse.ProductLineCodec;
import product.sorter.sort.SortedBatch;

/**
 * Appends every batch's three orderings to three output files, one per SortKey.
 *
 * Output is a concatenation of per-batch sorted runs: batches are written in arrival order and
 * are not merged with each other. Sinks are flushed after each batch.
 *
 * With atomic publish the sinks write to {@code <name>.tmp} files which {@link #publish()} moves
 * over the final names, so a reader sees either the previous complete file or the new one.
 * Closing without publishing discards the temporary files. Without atomic publish the final files
 * are truncated on open and written in place.
 */
public class MultiSinkWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(MultiSinkWriter.class);

    static final String TMP_SUFFIX = ".tmp";
    private static final char LINE_END = '\n';

    private final Path dataDir;
    private final boolean atomicPublish;
    private final Map<SortKey, Sink> sinks = new EnumMap<>(SortKey.class);
    private long linesPerSink;
    private boolean published;
    private boolean closed;

    private MultiSinkWriter(Path dataDir, boolean atomicPublish) {
        this.dataDir = dataDir;
        this.atomicPublish = atomicPublish;
    }

    /** Create the data directory if needed and open (truncate) one sink per sort key. */
    public static MultiSinkWriter open(Path dataDir, boolean atomicPublish) throws IOException {
        Files.createDirectories(dataDir);
        MultiSinkWriter writer = new MultiSinkWriter(dataDir, atomicPublish);
        try {
            for (SortKey key : SortKey.values()) {
                Path finalPath = dataDir.resolve(key.fileName());
                Path writePath = atomicPublish ? dataDir.resolve(key.fileName() + TMP_SUFFIX) : finalPath;
                BufferedWriter out = Files.newBufferedWriter(writePath, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                writer.sinks.put(key, new Sink(finalPath, writePath, out));
            }
        } catch (IOException e) {
            try {
                writer.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return writer;
    }

    /**
     * Write one batch to all three sinks and flush them. An IOException aborts the batch;
     * lines already handed to other sinks are not rolled back.
     */
    public void writeBatch(SortedBatch batch) throws IOException {
        ensureWritable();
        for (Map.Entry<SortKey, Sink> e : sinks.entrySet()) {
            Sink sink = e.getValue();
            for (Product p : batch.ordering(e.getKey())) {
                sink.out.write(ProductLineCodec.format(p));
                sink.out.write(LINE_END);
            }
            sink.out.flush();
        }
        linesPerSink += batch.size();
    }

    /** Convenience overload taking the three orderings directly. */
    public void writeBatch(List<Product> byId, List<Product> byName, List<Product> byPrice) throws IOException {
        writeBatch(new SortedBatch(byId, byName, byPrice));
    }

    /**
     * Close every sink and make the written files visible under their final names.
     */
    public void publish() throws IOException {
        ensureWritable();
        closeWriters();
        if (atomicPublish) {
            for (Sink sink : sinks.values()) {
                move(sink.writePath, sink.finalPath);
            }
        }
        published = true;
        log.debug("Published {} lines per sink under {}", linesPerSink, dataDir);
    }

    public long linesPerSink() { return linesPerSink; }

    public Path pathFor(SortKey key) { return dataDir.resolve(key.fileName()); }

    @Override
    public void close() throws IOException {
        if (closed) return;
        IOException failure = null;
        try {
            closeWriters();
        } catch (IOException e) {
            failure = e;
        }
        if (atomicPublish && !published) {
            for (Sink sink : sinks.values()) {
                try {
                    Files.deleteIfExists(sink.writePath);
                } catch (IOException e) {
                    if (failure == null) failure = e; else failure.addSuppressed(e);
                }
            }
        }
        closed = true;
        if (failure != null) throw failure;
    }

    private void closeWriters() throws IOException {
        IOException failure = null;
        for (Sink sink : sinks.values()) {
            if (sink.closed) continue;
            try {
                sink.out.close();
            } catch (IOException e) {
                if (failure == null) failure = e; else failure.addSuppressed(e);
            }
            sink.closed = true;
        }
        if (failure != null) throw failure;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void ensureWritable() {
        if (closed || published) throw new IllegalStateException("Writer already closed for " + dataDir);
    }

    private static final class Sink {
        final Path finalPath;
        final Path writePath;
        final BufferedWriter out;
        boolean closed;

        Sink(Path finalPath, Path writePath, BufferedWriter out) {
            this.finalPath = finalPath;
            this.writePath = writePath;
            this.out = out;
        }
    }
}
