package product.sorter.exec;

import product.sorter.model.Product;

/**
 * Pull-based operator over products.
 */
public interface ProductScan extends AutoCloseable {
    void open();
    Product next(); // returns next product or null when exhausted

    @Override
    void close();
}
