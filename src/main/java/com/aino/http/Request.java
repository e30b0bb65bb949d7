package com.aino.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The inbound request as handed over by the host server.
 * Immutable; the middleware pipeline reads from it and never changes it.
 */
public class Request {
    private final String method;
    private final String path;
    private final List<Header> headers;
    private final String queryString;
    private final String body;
    private final String scheme;
    private final String host;
    private final int port;

    private Request(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.headers = Collections.unmodifiableList(new ArrayList<>(builder.headers));
        this.queryString = builder.queryString;
        this.body = builder.body;
        this.scheme = builder.scheme;
        this.host = builder.host;
        this.port = builder.port;
    }

    /**
     * Creates a new request builder.
     *
     * @param method the raw HTTP method, e.g. "GET"
     * @param path   the request path, e.g. "/orders/10"
     * @return the builder
     */
    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    /**
     * Gets the raw HTTP method of the request.
     *
     * @return the method as sent by the client
     */
    public String getMethod() {
        return method;
    }

    /**
     * Gets the path of the request, without the query string.
     *
     * @return the request path
     */
    public String getPath() {
        return path;
    }

    /**
     * Gets the raw headers in the order they were received.
     *
     * @return the headers
     */
    public List<Header> getHeaders() {
        return headers;
    }

    /**
     * Gets the raw query string.
     *
     * @return the query string, or an empty string if there is none
     */
    public String getQueryString() {
        return queryString;
    }

    /**
     * Gets the request body decoded as UTF-8.
     *
     * @return the body, or an empty string if there is none
     */
    public String getBody() {
        return body;
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public String toString() {
        return method + " " + path + (queryString.isEmpty() ? "" : "?" + queryString);
    }

    /** Builder for {@link Request}. */
    public static class Builder {
        private final String method;
        private final String path;
        private final List<Header> headers = new ArrayList<>();
        private String queryString = "";
        private String body = "";
        private String scheme = "http";
        private String host = "localhost";
        private int port = 80;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path == null ? "/" : path;
        }

        public Builder header(String name, String value) {
            headers.add(new Header(name, value));
            return this;
        }

        public Builder queryString(String queryString) {
            this.queryString = queryString == null ? "" : queryString;
            return this;
        }

        public Builder body(String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Request build() {
            return new Request(this);
        }
    }
}
