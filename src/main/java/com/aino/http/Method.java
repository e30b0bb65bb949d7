package com.aino.http;

import java.util.Locale;

/** The HTTP verbs the framework recognizes. */
public enum Method {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    TRACE,
    CONNECT;

    /**
     * Canonicalizes a verb case-insensitively.
     *
     * @param method the raw verb, e.g. "POST" or "post"
     * @return the method, or null if the verb is not recognized
     */
    public static Method from(String method) {
        if (method == null) {
            return null;
        }
        try {
            return valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Whether requests with this method conventionally carry a body.
     *
     * @return true for POST, PUT and PATCH
     */
    public boolean hasBody() {
        return this == POST || this == PUT || this == PATCH;
    }

    /**
     * The lower-cased verb, as used in logs and by forms overriding the method.
     *
     * @return the lower-cased name
     */
    public String lowerCase() {
        return name().toLowerCase(Locale.ROOT);
    }
}
