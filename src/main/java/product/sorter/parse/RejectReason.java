package product.sorter.parse;

/**
 * Why a source line could not be turned into a Product.
 */
public enum RejectReason {
    BLANK,
    TOO_FEW_FIELDS,
    INVALID_ID,
    INVALID_PRICE,
    NEGATIVE_PRICE;
}
