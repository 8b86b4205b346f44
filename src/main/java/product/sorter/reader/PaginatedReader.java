package product.sorter.reader;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import product.sorter.config.SorterConfig;
import product.sorter.exec.PageScan;
import product.sorter.exec.SortedFileScan;
import product.sorter.model.Product;
import product.sorter.model.SortKey;

/**
 * Serves pages from the sorted output files without loading them into memory.
 * Each call opens its own read handle, so concurrent calls need no coordination.
 */
public class PaginatedReader {
    private static final Logger log = LoggerFactory.getLogger(PaginatedReader.class);

    private final SorterConfig config;

    public PaginatedReader(SorterConfig config) {
        this.config = config;
    }

    /** Fill absent parameters from the configured defaults, then read the page. */
    public PageResult getPage(PageRequest request) {
        String key = request.sortKey() != null ? request.sortKey() : config.defaultSortKey.name();
        int number = request.pageNumber() != null ? request.pageNumber() : 1;
        int size = request.pageSize() != null ? request.pageSize() : config.defaultPageSize;
        return getPage(key, number, size);
    }

    /**
     * Unknown sort keys read the id-sorted file. Invalid paging is a VALIDATION_ERROR,
     * a missing file NOT_FOUND, and an I/O failure INTERNAL_ERROR; nothing is thrown.
     */
    public PageResult getPage(String sortKey, int pageNumber, int pageSize) {
        if (pageNumber < 1 || pageSize < 1) {
            return PageResult.validationError("Page number and size must be greater than zero.");
        }
        SortKey key = SortKey.fromString(sortKey);
        Path file = config.sortedPath(key);
        if (!Files.isRegularFile(file)) {
            log.error("Sorted file not found: {}", file);
            return PageResult.notFound("Sorted file not found.");
        }

        long skip = (long) (pageNumber - 1) * pageSize;
        List<Product> items = new ArrayList<>(Math.min(pageSize, 1024));
        try (PageScan scan = new PageScan(new SortedFileScan(file), skip, pageSize)) {
            scan.open();
            Product p;
            while ((p = scan.next()) != null) items.add(p);
        } catch (UncheckedIOException e) {
            if (e.getCause() instanceof NoSuchFileException) {
                log.error("Sorted file disappeared before it could be read: {}", file);
                return PageResult.notFound("Sorted file not found.");
            }
            log.error("Error reading products file {}", file, e);
            return PageResult.internalError("An error occurred while retrieving products.");
        }
        return PageResult.ok(new Page(Collections.unmodifiableList(items), pageNumber, pageSize));
    }
}
