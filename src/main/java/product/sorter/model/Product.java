package product.sorter.model;

import java.math.BigDecimal;

/**
 * Immutable product row as it appears in the source and in every sorted output file.
 * price keeps the scale it was written with (3.50 stays 3.50).
 */
public record Product(int id, String name, BigDecimal price) {}
