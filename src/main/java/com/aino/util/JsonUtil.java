package com.aino.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.util.Map;

/**
 * Utility class for working with JSON.
 * Output is compact since it ends up in cookies and response bodies.
 */
public class JsonUtil {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final ObjectWriter cookieWriter = mapper.writer().with(new CookieEscapes());

    private JsonUtil() {
    }

    /**
     * Converts an object to a JSON string.
     *
     * @param obj the object to convert
     * @return the JSON string
     * @throws JsonProcessingException if the conversion fails
     */
    public static String toJson(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsString(obj);
    }

    /**
     * Converts an object to a JSON string that can be used as a cookie value as is.
     * A {@code ;} inside strings is written as a JSON unicode escape, so the cookie parser does not
     * cut the value short. The result is still plain JSON.
     *
     * @param obj the object to convert
     * @return the JSON string
     * @throws JsonProcessingException if the conversion fails
     */
    public static String toCookieJson(Object obj) throws JsonProcessingException {
        return cookieWriter.writeValueAsString(obj);
    }

    /**
     * Parses a JSON document into a generic value tree of maps, lists, strings, numbers,
     * booleans and nulls.
     *
     * @param json the JSON string
     * @return the parsed value
     * @throws JsonProcessingException if the document is malformed
     */
    public static Object parseValue(String json) throws JsonProcessingException {
        return mapper.readValue(json, Object.class);
    }

    /**
     * Parses a JSON object into a map.
     *
     * @param json the JSON string
     * @return the parsed map
     * @throws JsonProcessingException if the document is malformed or not an object
     */
    public static Map<String, Object> fromJsonMap(String json) throws JsonProcessingException {
        return mapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }

    /** Standard JSON escaping plus {@code ;}, the cookie pair delimiter. */
    private static final class CookieEscapes extends CharacterEscapes {
        private final int[] asciiEscapes;

        CookieEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            asciiEscapes[';'] = CharacterEscapes.ESCAPE_STANDARD;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}
