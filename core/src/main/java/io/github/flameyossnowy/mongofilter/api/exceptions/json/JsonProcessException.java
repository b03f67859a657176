package io.github.flameyossnowy.mongofilter.api.exceptions.json;

/**
 * Raised when an entity cannot be encoded to, or decoded from, its structured form.
 */
public class JsonProcessException extends RuntimeException {
    private final JsonLocation location;

    public JsonProcessException(String message, JsonLocation location) {
        super(message);
        this.location = location;
    }

    public JsonProcessException(String message, Throwable cause, JsonLocation location) {
        super(message, cause);
        this.location = location;
    }

    public JsonLocation getLocation() {
        return location;
    }
}
