package io.github.flameyossnowy.mongofilter.api.exceptions.json;

/**
 * Position of a JSON processing failure. Tree conversions report {@code -1} for unknown parts.
 */
public record JsonLocation(int lineNumber, int columnNumber, long charOffset, long byteOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1, -1);
}
