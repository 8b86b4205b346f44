package product.sorter.exec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import product.sorter.model.Product;
import product.sorter.parse.ParseResult;
import product.sorter.parse.ProductParser;

/**
 * Streams a sorted output file line by line, yielding only lines the parser accepts.
 * I/O errors surface as UncheckedIOException.
 */
public class SortedFileScan implements ProductScan {
    private final Path file;

    private BufferedReader reader;
    private long skippedLines;
    private boolean opened;

    public SortedFileScan(Path file) {
        this.file = file;
    }

    @Override
    public void open() {
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed opening " + file, e);
        }
        skippedLines = 0;
        opened = true;
    }

    @Override
    public Product next() {
        if (!opened) return null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                ParseResult parsed = ProductParser.parse(line);
                if (parsed.isAccepted()) return parsed.product();
                skippedLines++;
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + file, e);
        }
    }

    /** Lines rejected by the parser so far (blank lines included). */
    public long skippedLines() { return skippedLines; }

    @Override
    public void close() {
        opened = false;
        if (reader == null) return;
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed closing " + file, e);
        } finally {
            reader = null;
        }
    }
}
