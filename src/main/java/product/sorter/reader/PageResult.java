package product.sorter.reader;

/**
 * Typed outcome of a page request. {@code page} is present only for OK;
 * {@code message} describes every other status.
 */
public final class PageResult {
    private final PageStatus status;
    private final Page page;
    private final String message;

    private PageResult(PageStatus status, Page page, String message) {
        this.status = status;
        this.page = page;
        this.message = message;
    }

    public static PageResult ok(Page page) { return new PageResult(PageStatus.OK, page, null); }
    public static PageResult validationError(String message) { return new PageResult(PageStatus.VALIDATION_ERROR, null, message); }
    public static PageResult notFound(String message) { return new PageResult(PageStatus.NOT_FOUND, null, message); }
    public static PageResult internalError(String message) { return new PageResult(PageStatus.INTERNAL_ERROR, null, message); }

    public PageStatus status() { return status; }
    public boolean isOk() { return status == PageStatus.OK; }
    public String message() { return message; }

    public Page page() {
        if (page == null) throw new IllegalStateException("No page for status " + status + ": " + message);
        return page;
    }

    @Override
    public String toString() {
        return isOk() ? "PageResult{OK, items=" + page.items().size() + "}" : "PageResult{" + status + ", " + message + "}";
    }
}
