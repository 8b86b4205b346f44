package product.sorter.parse;

import product.sorter.model.Product;

/**
 * Serializes products back to the source line format.
 */
public final class ProductLineCodec {
    private ProductLineCodec() {}

    public static String format(Product p) {
        // toPlainString keeps the parsed scale and never switches to exponent notation
        return p.id() + String.valueOf(ProductParser.DELIMITER) + p.name()
            + ProductParser.DELIMITER + p.price().toPlainString();
    }
}
