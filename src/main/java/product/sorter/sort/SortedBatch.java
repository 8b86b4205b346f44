package product.sorter.sort;

import java.util.List;

import product.sorter.model.Product;
import product.sorter.model.SortKey;

/**
 * The three orderings of one batch. Lists are unmodifiable.
 */
public record SortedBatch(List<Product> byId, List<Product> byName, List<Product> byPrice) {

    public List<Product> ordering(SortKey key) {
        return switch (key) {
            case ID -> byId;
            case NAME -> byName;
            case PRICE -> byPrice;
        };
    }

    public int size() { return byId.size(); }
}
