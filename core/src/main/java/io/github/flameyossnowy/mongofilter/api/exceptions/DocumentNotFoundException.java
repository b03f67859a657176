package io.github.flameyossnowy.mongofilter.api.exceptions;

public class DocumentNotFoundException extends RuntimeException {
    private final transient Object filter;

    public DocumentNotFoundException(String message, Object filter) {
        super(message);
        this.filter = filter;
    }

    /**
     * The filter that matched nothing.
     */
    public Object getFilter() {
        return filter;
    }
}
