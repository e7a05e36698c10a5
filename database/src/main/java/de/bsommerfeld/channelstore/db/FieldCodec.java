package de.bsommerfeld.channelstore.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts structured field values to and from their column representation.
 *
 * <ul>
 * <li>string collections are stored as a JSON array of strings; an empty
 * collection is written as {@code []}, never as NULL</li>
 * <li>booleans are stored as {@code 0}/{@code 1}; any nonzero reads back as
 * {@code true}</li>
 * </ul>
 *
 * A NULL list column (rows written by older tools) decodes to an empty
 * collection.
 */
public final class FieldCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    /** Jackson's {@link ObjectMapper} is thread-safe once configured, one instance serves all repositories. */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FieldCodec() {
    }

    public static String encodeList(Collection<String> values) {
        try {
            return MAPPER.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode string list", e);
        }
    }

    /**
     * @throws IllegalStateException if the column holds something other than a
     *                               JSON array of strings
     */
    public static List<String> decodeList(String json) {
        if (json == null || json.isBlank())
            return new ArrayList<>();
        try {
            List<String> values = MAPPER.readValue(json, STRING_LIST);
            return values != null ? values : new ArrayList<>();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored value is not a JSON string array: " + json, e);
        }
    }

    public static Set<String> decodeSet(String json) {
        return new LinkedHashSet<>(decodeList(json));
    }

    public static int encodeBoolean(boolean value) {
        return value ? 1 : 0;
    }

    public static boolean decodeBoolean(int value) {
        return value != 0;
    }
}
