package agentdesk.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the flat JSON columns of the outbox: string maps (headers) and string
 * arrays (recipients).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and
 * rejects nested values. Applications that already use a JSON library can implement
 * this interface and hand it to the JDBC store.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object with string values. Returns an empty map for {@code null},
     * blank or {@code "null"} input; {@code null} values are dropped.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);

    /**
     * Encodes a list of strings as a JSON array. A null list encodes as {@code []}.
     */
    String toJsonArray(List<String> values);

    /**
     * Parses a JSON array of strings. Returns an empty list for {@code null} or blank input.
     *
     * @throws IllegalArgumentException if the input is not a JSON array of strings
     */
    List<String> parseArray(String json);
}
