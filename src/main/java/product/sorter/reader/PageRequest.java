package product.sorter.reader;

/**
 * Raw page parameters as received from a caller; null means "use the configured default".
 */
public record PageRequest(String sortKey, Integer pageNumber, Integer pageSize) {
    public static PageRequest of(String sortKey, int pageNumber, int pageSize) {
        return new PageRequest(sortKey, pageNumber, pageSize);
    }
}
