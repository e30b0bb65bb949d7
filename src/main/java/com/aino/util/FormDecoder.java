package com.aino.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes {@code application/x-www-form-urlencoded} data, used for both query strings and form
 * bodies.
 *
 * <p>Keys may use bracket syntax: {@code key[]=a&key[]=b} builds a list and
 * {@code key[a]=1&key[b]=2} builds a nested map. Each key is split into a path of names and
 * list markers, and every (path, value) pair is deep-merged into the result.</p>
 */
public final class FormDecoder {
    /** Marks a {@code []} step in a key path. */
    static final Object LIST_MARKER = new Object() {
        @Override
        public String toString() {
            return "[]";
        }
    };

    private FormDecoder() {
    }

    /**
     * Decodes form-encoded data.
     *
     * @param encoded the raw data, e.g. {@code a[]=1&a[]=2&b[x]=3}
     * @return the decoded map, in key order of first appearance
     */
    public static Map<String, Object> decode(String encoded) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (encoded == null || encoded.isEmpty()) {
            return result;
        }

        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = urlDecode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : urlDecode(pair.substring(eq + 1));
            if (name.isEmpty()) {
                continue;
            }
            merge(result, parseKey(name), value);
        }
        return result;
    }

    /**
     * Splits a key into its path: {@code a[b][]} becomes {@code ["a", "b", LIST_MARKER]}.
     * Keys with unbalanced or trailing text around the brackets are taken literally.
     *
     * @param key the decoded key
     * @return the key path
     */
    static List<Object> parseKey(String key) {
        int open = key.indexOf('[');
        if (open <= 0) {
            return Collections.singletonList(key);
        }

        List<Object> path = new ArrayList<>();
        path.add(key.substring(0, open));
        int i = open;
        while (i < key.length()) {
            if (key.charAt(i) != '[') {
                return Collections.singletonList(key);
            }
            int close = key.indexOf(']', i);
            if (close < 0) {
                return Collections.singletonList(key);
            }
            String inner = key.substring(i + 1, close);
            path.add(inner.isEmpty() ? LIST_MARKER : inner);
            i = close + 1;
        }
        return path;
    }

    static void merge(Map<String, Object> into, List<Object> keyPath, String value) {
        String name = (String) keyPath.get(0);
        into.put(name, assign(into.get(name), keyPath, 1, value));
    }

    @SuppressWarnings("unchecked")
    private static Object assign(Object current, List<Object> keyPath, int index, String value) {
        if (index == keyPath.size()) {
            return value;
        }

        Object step = keyPath.get(index);
        if (step == LIST_MARKER) {
            List<Object> list = current instanceof List ? (List<Object>) current : new ArrayList<>();
            list.add(assign(null, keyPath, index + 1, value));
            return list;
        }

        // a scalar already stored under this key is replaced by a map
        Map<String, Object> map = current instanceof Map
                ? (Map<String, Object>) current
                : new LinkedHashMap<>();
        String key = (String) step;
        map.put(key, assign(map.get(key), keyPath, index + 1, value));
        return map;
    }

    private static String urlDecode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent escape, keep the text as sent
            return raw;
        }
    }
}
