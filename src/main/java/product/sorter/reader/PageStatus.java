package product.sorter.reader;

public enum PageStatus {
    OK,
    VALIDATION_ERROR,
    NOT_FOUND,
    INTERNAL_ERROR;
}
