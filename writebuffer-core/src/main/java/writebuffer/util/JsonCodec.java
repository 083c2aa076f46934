package writebuffer.util;

/**
 * Encodes message payloads that are not already strings into JSON text before they
 * are buffered.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a zero-dependency encoder
 * for maps, collections, arrays, strings, numbers, booleans and {@code null}. Users who
 * already have Jackson, Gson, or another JSON library on the classpath can implement this
 * interface to delegate to their preferred library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON.
     *
     * @param value the value to encode; may be {@code null}
     * @return JSON text (never {@code null}; a null value encodes as {@code "null"})
     * @throws IllegalArgumentException if the value contains an unsupported type
     */
    String encode(Object value);
}
