package product.sorter.parse;

import product.sorter.model.Product;

/**
 * Outcome of parsing one line: either an accepted Product or a reject reason, never both.
 */
public final class ParseResult {
    private final Product product;   // null when rejected
    private final RejectReason reason; // null when accepted

    private ParseResult(Product product, RejectReason reason) {
        this.product = product;
        this.reason = reason;
    }

    public static ParseResult accepted(Product product) {
        if (product == null) throw new IllegalArgumentException("product must not be null");
        return new ParseResult(product, null);
    }

    public static ParseResult rejected(RejectReason reason) {
        if (reason == null) throw new IllegalArgumentException("reason must not be null");
        return new ParseResult(null, reason);
    }

    public boolean isAccepted() { return product != null; }

    public Product product() {
        if (product == null) throw new IllegalStateException("Line was rejected: " + reason);
        return product;
    }

    public RejectReason reason() { return reason; }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted" + product : "Rejected(" + reason + ")";
    }
}
