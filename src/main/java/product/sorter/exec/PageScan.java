package product.sorter.exec;

import product.sorter.model.Product;

/**
 * Skips {@code offset} products from its child, then yields at most {@code limit} more.
 * Stops pulling from the child once the limit is reached.
 */
public class PageScan implements ProductScan {
    private final ProductScan child;
    private final long offset;
    private final int limit;

    private int produced;
    private boolean exhausted;

    public PageScan(ProductScan child, long offset, int limit) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0, got " + limit);
        this.child = child;
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public void open() {
        child.open();
        produced = 0;
        exhausted = false;
        for (long i = 0; i < offset; i++) {
            if (child.next() == null) {
                exhausted = true;
                break;
            }
        }
    }

    @Override
    public Product next() {
        if (exhausted || produced >= limit) return null;
        Product p = child.next();
        if (p == null) {
            exhausted = true;
            return null;
        }
        produced++;
        return p;
    }

    @Override
    public void close() { child.close(); }
}
