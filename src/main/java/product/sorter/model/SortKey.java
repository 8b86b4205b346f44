package product.sorter.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Sort keys supported by the materialized views. Each key owns the name of its output file
 * and the comparator used to order a batch.
 */
public enum SortKey {
    ID("products_sorted_by_id.txt", Comparator.comparingInt(Product::id)),
    NAME("products_sorted_by_name.txt", Comparator.comparing(Product::name)), // ordinal String compare
    PRICE("products_sorted_by_price.txt", Comparator.comparing(Product::price));

    private final String fileName;
    private final Comparator<Product> comparator;

    SortKey(String fileName, Comparator<Product> comparator) {
        this.fileName = fileName;
        this.comparator = comparator;
    }

    public String fileName() { return fileName; }
    public Comparator<Product> comparator() { return comparator; }

    /**
     * Resolve a caller-supplied key. Unknown, blank or null values fall back to ID.
     */
    public static SortKey fromString(String key) {
        if (key == null) return ID;
        switch (key.trim().toLowerCase(Locale.ROOT)) {
            case "name": return NAME;
            case "price": return PRICE;
            default: return ID;
        }
    }
}
