package com.aino.middleware;

import com.aino.http.Context;
import com.aino.http.Header;
import com.aino.http.Method;
import com.aino.util.FormDecoder;
import com.aino.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLConnection;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collection of common middleware that turns the raw request into context fields.
 */
public class CommonMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(CommonMiddleware.class);

    private static final String FORM_URLENCODED = "application/x-www-form-urlencoded";
    private static final String JSON = "application/json";
    private static final String METHOD_OVERRIDE_FIELD = "_method";
    private static final Set<Method> METHOD_OVERRIDES = Set.of(Method.DELETE, Method.PATCH, Method.PUT);

    private CommonMiddleware() {
    }

    /**
     * Gets the middleware that processes low level request data, in order: method, path,
     * headers, query parameters, request body, method override and cookies.
     *
     * @return the chain
     */
    public static MiddlewareChain common() {
        return MiddlewareChain.of(
                method(),
                path(),
                headers(),
                queryParams(),
                requestBody(),
                adjustMethod(),
                cookies());
    }

    /**
     * Creates a middleware that stores the canonical request method on the context.
     *
     * @return the middleware
     */
    public static Middleware method() {
        return ctx -> ctx.method(Method.from(ctx.request().getMethod()));
    }

    /**
     * Creates a middleware that stores the request path, split into its non-empty segments.
     *
     * @return the middleware
     */
    public static Middleware path() {
        return ctx -> ctx.path(splitPath(ctx.request().getPath()));
    }

    /**
     * Splits a raw path on {@code /}, dropping empty segments, then percent-decodes each
     * segment as UTF-8. An encoded slash stays inside its segment and {@code +} stays a plus.
     *
     * @param path the path, e.g. "/orders/a%20b%2Fc/"
     * @return the segments, e.g. ["orders", "a b/c"]
     */
    public static List<String> splitPath(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(decodeSegment(segment));
            }
        }
        return segments;
    }

    private static String decodeSegment(String segment) {
        if (segment.indexOf('%') < 0) {
            return segment;
        }
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed percent escape, keep the segment as sent
            return segment;
        }
    }

    /**
     * Creates a middleware that stores the request headers with lower-cased names.
     * Values and order are preserved.
     *
     * @return the middleware
     */
    public static Middleware headers() {
        return ctx -> {
            List<Header> headers = new ArrayList<>();
            for (Header header : ctx.request().getHeaders()) {
                headers.add(new Header(header.getName().toLowerCase(Locale.ROOT), header.getValue()));
            }
            return ctx.headers(headers);
        };
    }

    /**
     * Creates a middleware that decodes the query string, including bracket keys.
     *
     * @return the middleware
     */
    public static Middleware queryParams() {
        return ctx -> ctx.queryParams(FormDecoder.decode(ctx.request().getQueryString()));
    }

    /**
     * Creates a middleware that parses the request body for methods that carry one.
     *
     * <p>Form and JSON bodies are recognized by Content-Type. Other content types, and JSON
     * that does not parse, leave the parsed body unset. Requires method and headers.</p>
     *
     * @return the middleware
     */
    public static Middleware requestBody() {
        return ctx -> {
            if (ctx.method() == null || !ctx.method().hasBody()) {
                return ctx;
            }

            String contentType = ctx.header("content-type");
            if (contentType == null) {
                return ctx;
            }
            int params = contentType.indexOf(';');
            if (params >= 0) {
                contentType = contentType.substring(0, params);
            }
            contentType = contentType.trim().toLowerCase(Locale.ROOT);

            switch (contentType) {
                case FORM_URLENCODED:
                    return ctx.parsedBody(FormDecoder.decode(ctx.request().getBody()));
                case JSON:
                    try {
                        return ctx.parsedBody(JsonUtil.parseValue(ctx.request().getBody()));
                    } catch (JsonProcessingException e) {
                        logger.debug("Ignoring malformed JSON body: {}", e.getOriginalMessage());
                        return ctx;
                    }
                default:
                    return ctx;
            }
        };
    }

    /**
     * Creates a middleware that parses the {@code Cookie} header into a map.
     * An absent header yields an empty map. Requires headers.
     *
     * @return the middleware
     */
    public static Middleware cookies() {
        return ctx -> {
            Map<String, String> cookies = new LinkedHashMap<>();
            for (String header : ctx.requestHeader("cookie")) {
                for (String cookie : header.split(";")) {
                    if (cookie.isBlank()) {
                        continue;
                    }
                    int eq = cookie.indexOf('=');
                    if (eq < 0) {
                        cookies.put(cookie.trim(), "");
                    } else {
                        cookies.put(cookie.substring(0, eq).trim(), cookie.substring(eq + 1).trim());
                    }
                }
            }
            return ctx.cookies(cookies);
        };
    }

    /**
     * Creates a middleware that lets HTML forms simulate DELETE, PATCH and PUT.
     *
     * <p>A POST whose parsed body has {@code _method} set to "delete", "patch" or "put" gets its
     * method replaced. Anything else is left alone. Requires the body to be parsed.</p>
     *
     * @return the middleware
     */
    public static Middleware adjustMethod() {
        return ctx -> {
            if (ctx.method() != Method.POST || !(ctx.parsedBody() instanceof Map)) {
                return ctx;
            }
            Object override = ((Map<?, ?>) ctx.parsedBody()).get(METHOD_OVERRIDE_FIELD);
            if (!(override instanceof String)) {
                return ctx;
            }
            for (Method method : METHOD_OVERRIDES) {
                if (method.lowerCase().equals(override)) {
                    return ctx.method(method);
                }
            }
            return ctx;
        };
    }

    /**
     * Creates a middleware that merges path params, query params and the parsed body into
     * {@code params}. Path params take precedence over query params, which take precedence
     * over the body. Sources that are absent or not maps are skipped.
     *
     * @return the middleware
     */
    public static Middleware params() {
        return ctx -> {
            Map<String, Object> params = new HashMap<>();
            mergeParams(params, ctx.parsedBody());
            mergeParams(params, ctx.queryParams());
            mergeParams(params, ctx.pathParams());
            return ctx.params(params);
        };
    }

    private static void mergeParams(Map<String, Object> into, Object source) {
        if (source instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
                into.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
    }

    /**
     * Creates a middleware that serves static files for paths under {@code /assets}.
     *
     * <p>{@code /assets/js/app.js} is served from {@code root/js/app.js} with status 200. A
     * missing file is a 404. Both halt the context; other paths pass through.</p>
     *
     * @param root the directory holding the assets
     * @return the middleware
     */
    public static Middleware assets(Path root) {
        Path base = root.toAbsolutePath().normalize();
        return ctx -> {
            List<String> path = ctx.path();
            if (path == null || path.isEmpty() || !path.get(0).equals("assets")) {
                return ctx;
            }

            Path file = base;
            for (String segment : path.subList(1, path.size())) {
                file = file.resolve(segment);
            }
            file = file.normalize();

            if (!file.startsWith(base) || !Files.isRegularFile(file)) {
                return ctx.halt()
                        .responseStatus(404)
                        .responseHeader("Content-Type", "text/plain")
                        .responseBody("Not found");
            }

            String contentType = URLConnection.guessContentTypeFromName(file.getFileName().toString());
            ctx.halt().responseStatus(200).responseHeaders(Collections.emptyList());
            if (contentType != null) {
                ctx.responseHeader("Content-Type", contentType);
            }
            return ctx.responseBody(Files.readAllBytes(file));
        };
    }

    /**
     * Creates a development middleware that logs one context field at debug level and
     * passes the context on unchanged.
     *
     * <p>Known field names such as "path", "params" or "session" read the matching
     * context field. Any other key reads the value stored with {@link Context#set}.</p>
     *
     * @param key the field to log
     * @return the middleware
     */
    public static Middleware inspect(String key) {
        return ctx -> {
            if (logger.isDebugEnabled()) {
                logger.debug("{}: {}", key, field(ctx, key));
            }
            return ctx;
        };
    }

    static Object field(Context ctx, String key) {
        switch (key) {
            case "method":
                return ctx.method();
            case "path":
                return ctx.path();
            case "headers":
                return ctx.headers();
            case "cookies":
                return ctx.cookies();
            case "query_params":
                return ctx.queryParams();
            case "parsed_body":
                return ctx.parsedBody();
            case "params":
                return ctx.params();
            case "path_params":
                return ctx.pathParams();
            case "session":
                return ctx.session();
            case "flash":
                return ctx.flash();
            case "response_status":
                return ctx.responseStatus();
            case "response_headers":
                return ctx.responseHeaders();
            case "response_body":
                return ctx.responseBody();
            default:
                return ctx.get(key);
        }
    }
}
