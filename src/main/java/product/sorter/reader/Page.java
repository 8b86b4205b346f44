package product.sorter.reader;

import java.util.List;

import product.sorter.model.Product;

public record Page(List<Product> items, int pageNumber, int pageSize) {
    public boolean isEmpty() { return items.isEmpty(); }
}
