package com.aino.http;

import com.aino.middleware.MiddlewareChain;
import com.aino.routing.Route;
import com.aino.session.SessionStorage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Context for an HTTP request/response cycle.
 *
 * <p>A context is created per request and threaded through the middleware pipeline. The
 * well-known fields are typed and start out unset ({@code null}); middleware fills them in
 * order. Application data goes into the locals bag via {@link #set(String, Object)} and
 * {@link #get(String)}.</p>
 */
public class Context {
    private final Request request;
    private final Map<String, Object> locals = new HashMap<>();

    // application config
    private String urlScheme = "http";
    private String urlHost = "localhost";
    private int urlPort = 80;
    private String environment = "development";
    private Map<String, Object> config = Collections.emptyMap();

    // request normalization
    private Method method;
    private List<String> path;
    private List<Header> headers;
    private Map<String, String> cookies;
    private Map<String, Object> queryParams;
    private Object parsedBody;
    private Map<String, Object> params;

    // routing
    private List<Route> routes;
    private Map<String, String> pathParams;
    private MiddlewareChain routeMiddleware;

    // session
    private SessionStorage sessionConfig;
    private Map<String, Object> session;
    private boolean sessionUpdated;
    private Map<String, String> flash;

    private boolean halt;

    // response
    private Integer responseStatus;
    private List<Header> responseHeaders;
    private Object responseBody;

    /**
     * Creates a new context for the given request.
     *
     * @param request the inbound request
     */
    public Context(Request request) {
        this.request = request;
    }

    /**
     * Gets the raw inbound request.
     *
     * @return the request
     */
    public Request request() {
        return request;
    }

    public String urlScheme() {
        return urlScheme;
    }

    public Context urlScheme(String urlScheme) {
        this.urlScheme = urlScheme;
        return this;
    }

    public String urlHost() {
        return urlHost;
    }

    public Context urlHost(String urlHost) {
        this.urlHost = urlHost;
        return this;
    }

    public int urlPort() {
        return urlPort;
    }

    public Context urlPort(int urlPort) {
        this.urlPort = urlPort;
        return this;
    }

    public String environment() {
        return environment;
    }

    public Context environment(String environment) {
        this.environment = environment;
        return this;
    }

    /**
     * Gets an application config value.
     *
     * @param key the config key
     * @param <T> the type of the value
     * @return the value or null if not configured
     */
    @SuppressWarnings("unchecked")
    public <T> T config(String key) {
        return (T) config.get(key);
    }

    public Context config(Map<String, Object> config) {
        this.config = Collections.unmodifiableMap(new HashMap<>(config));
        return this;
    }

    /**
     * Gets the normalized request method.
     *
     * @return the method, or null before normalization or for unrecognized verbs
     */
    public Method method() {
        return method;
    }

    public Context method(Method method) {
        this.method = method;
        return this;
    }

    /**
     * Gets the request path split into its non-empty segments.
     *
     * @return the path segments, or null before normalization
     */
    public List<String> path() {
        return path;
    }

    public Context path(List<String> path) {
        this.path = path;
        return this;
    }

    /**
     * Gets the request headers with lower-cased names.
     *
     * @return the headers, or null before normalization
     */
    public List<Header> headers() {
        return headers;
    }

    public Context headers(List<Header> headers) {
        this.headers = headers;
        return this;
    }

    /**
     * Gets every value of a request header, in the order they were received.
     * Requires headers to be normalized.
     *
     * @param name the header name, any case
     * @return the values, empty if the header is absent
     */
    public List<String> requestHeader(String name) {
        if (headers == null) {
            throw new IllegalStateException("Request headers have not been processed yet");
        }
        String key = name.toLowerCase(Locale.ROOT);
        List<String> values = new ArrayList<>();
        for (Header header : headers) {
            if (header.getName().equals(key)) {
                values.add(header.getValue());
            }
        }
        return values;
    }

    /**
     * Gets the first value of a request header.
     *
     * @param name the header name, any case
     * @return the value or null if not present
     */
    public String header(String name) {
        List<String> values = requestHeader(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public Map<String, String> cookies() {
        return cookies;
    }

    public Context cookies(Map<String, String> cookies) {
        this.cookies = cookies;
        return this;
    }

    public Map<String, Object> queryParams() {
        return queryParams;
    }

    public Context queryParams(Map<String, Object> queryParams) {
        this.queryParams = queryParams;
        return this;
    }

    /**
     * Gets the decoded request body: a map for form bodies, any JSON value for JSON bodies.
     *
     * @return the parsed body or null if the body was not parsed
     */
    public Object parsedBody() {
        return parsedBody;
    }

    public Context parsedBody(Object parsedBody) {
        this.parsedBody = parsedBody;
        return this;
    }

    public Map<String, Object> params() {
        return params;
    }

    public Context params(Map<String, Object> params) {
        this.params = params;
        return this;
    }

    /**
     * Gets a merged parameter by name.
     *
     * @param name the parameter name
     * @return the value or null if absent or params were not merged
     */
    public Object param(String name) {
        return params == null ? null : params.get(name);
    }

    public List<Route> routes() {
        return routes;
    }

    public Context routes(List<Route> routes) {
        this.routes = routes;
        return this;
    }

    public Map<String, String> pathParams() {
        return pathParams;
    }

    public Context pathParams(Map<String, String> pathParams) {
        this.pathParams = pathParams;
        return this;
    }

    /**
     * Gets the middleware of the matched route, pending execution.
     *
     * @return the route middleware or null if no route matched
     */
    public MiddlewareChain routeMiddleware() {
        return routeMiddleware;
    }

    public Context routeMiddleware(MiddlewareChain routeMiddleware) {
        this.routeMiddleware = routeMiddleware;
        return this;
    }

    public SessionStorage sessionConfig() {
        return sessionConfig;
    }

    public Context sessionConfig(SessionStorage sessionConfig) {
        this.sessionConfig = sessionConfig;
        return this;
    }

    /**
     * Gets the decoded session. Use {@link com.aino.session.Session} to change it.
     *
     * @return the session or null before decoding
     */
    public Map<String, Object> session() {
        return session;
    }

    public Context session(Map<String, Object> session) {
        this.session = session;
        return this;
    }

    public boolean sessionUpdated() {
        return sessionUpdated;
    }

    public Context sessionUpdated(boolean sessionUpdated) {
        this.sessionUpdated = sessionUpdated;
        return this;
    }

    public Map<String, String> flash() {
        return flash;
    }

    public Context flash(Map<String, String> flash) {
        this.flash = flash;
        return this;
    }

    /**
     * Whether remaining middleware should be skipped.
     *
     * @return true if halted
     */
    public boolean isHalted() {
        return halt;
    }

    /**
     * Marks the context as halted.
     *
     * @return this context for method chaining
     */
    public Context halt() {
        return halt(true);
    }

    public Context halt(boolean halt) {
        this.halt = halt;
        return this;
    }

    public Integer responseStatus() {
        return responseStatus;
    }

    public Context responseStatus(int status) {
        this.responseStatus = status;
        return this;
    }

    public List<Header> responseHeaders() {
        return responseHeaders;
    }

    /**
     * Replaces all response headers.
     *
     * @param headers the new headers
     * @return this context for method chaining
     */
    public Context responseHeaders(List<Header> headers) {
        this.responseHeaders = new ArrayList<>(headers);
        return this;
    }

    /**
     * Appends a response header. Existing headers with the same name are kept.
     *
     * @param name  the header name
     * @param value the header value
     * @return this context for method chaining
     */
    public Context responseHeader(String name, String value) {
        if (responseHeaders == null) {
            responseHeaders = new ArrayList<>();
        }
        responseHeaders.add(new Header(name, value));
        return this;
    }

    public Object responseBody() {
        return responseBody;
    }

    /**
     * Sets the response body.
     *
     * @param body a {@link String} or {@code byte[]}
     * @return this context for method chaining
     */
    public Context responseBody(Object body) {
        this.responseBody = body;
        return this;
    }

    /**
     * Sets an HTML body along with its Content-Type.
     *
     * @param html the HTML to send
     * @return this context for method chaining
     */
    public Context html(String html) {
        return responseHeader("Content-Type", "text/html").responseBody(html);
    }

    /**
     * Responds with a 302 redirect.
     *
     * @param url the URL to redirect to
     * @return this context for method chaining
     */
    public Context redirect(String url) {
        return responseStatus(302)
                .responseHeader("Content-Type", "text/html")
                .responseHeader("Location", url)
                .responseBody("Redirecting...");
    }

    /**
     * Stores a value in the context locals for the current request/response cycle.
     *
     * @param key   the key
     * @param value the value
     * @return this context for method chaining
     */
    public Context set(String key, Object value) {
        locals.put(key, value);
        return this;
    }

    /**
     * Gets a value from the context locals.
     *
     * @param key the key
     * @param <T> the type of the value
     * @return the value or null if not present
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) locals.get(key);
    }

    /**
     * Converts the response fields into the outbound response triple.
     *
     * @return the response
     * @throws IncompleteResponseException if the status, headers or body is missing
     */
    public Response toResponse() {
        List<String> missing = new ArrayList<>();
        if (responseStatus == null) {
            missing.add("response_status");
        }
        if (responseHeaders == null) {
            missing.add("response_headers");
        }
        if (responseBody == null) {
            missing.add("response_body");
        }
        if (!missing.isEmpty()) {
            throw new IncompleteResponseException(missing);
        }
        return new Response(responseStatus, responseHeaders, responseBody);
    }
}
