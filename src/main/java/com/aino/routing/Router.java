package com.aino.routing;

import com.aino.http.Context;
import com.aino.http.Method;
import com.aino.middleware.Middleware;
import com.aino.middleware.MiddlewareChain;
import com.aino.middleware.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Holds the route table and provides the middleware that matches and runs routes.
 *
 * <p>Routes are matched by a linear scan in declaration order and the first route whose method
 * and path match wins, so the order routes are added in matters. Routes are meant to be declared
 * once at startup; {@link #bindRoutes()} hands an immutable snapshot to each request.</p>
 *
 * <pre>{@code
 * Router router = new Router();
 * router.get("/orders", Orders::index);
 * router.get("/orders/:id", MiddlewareChain.of(Orders::authorize, Orders::show), "order");
 *
 * MiddlewareChain app = MiddlewareChain.of(CommonMiddleware.common())
 *     .then(router.bindRoutes())
 *     .then(Router.matchRoute())
 *     .then(CommonMiddleware.params())
 *     .then(Router.handleRoute());
 * }</pre>
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private final List<Route> routes = new ArrayList<>();

    /**
     * Adds a route to the router.
     *
     * @param method     the HTTP method
     * @param path       the route path
     * @param middleware the middleware to run for the route
     * @param name       the symbolic name for reverse routing, may be null
     * @return the created route
     */
    public Route addRoute(Method method, String path, MiddlewareChain middleware, String name) {
        Route route = new Route(method, path, middleware, name);
        routes.add(route);
        return route;
    }

    public Route get(String path, Middleware handler) {
        return addRoute(Method.GET, path, MiddlewareChain.of(handler), null);
    }

    public Route get(String path, MiddlewareChain middleware) {
        return addRoute(Method.GET, path, middleware, null);
    }

    public Route get(String path, MiddlewareChain middleware, String name) {
        return addRoute(Method.GET, path, middleware, name);
    }

    public Route post(String path, Middleware handler) {
        return addRoute(Method.POST, path, MiddlewareChain.of(handler), null);
    }

    public Route post(String path, MiddlewareChain middleware) {
        return addRoute(Method.POST, path, middleware, null);
    }

    public Route post(String path, MiddlewareChain middleware, String name) {
        return addRoute(Method.POST, path, middleware, name);
    }

    public Route put(String path, Middleware handler) {
        return addRoute(Method.PUT, path, MiddlewareChain.of(handler), null);
    }

    public Route put(String path, MiddlewareChain middleware) {
        return addRoute(Method.PUT, path, middleware, null);
    }

    public Route put(String path, MiddlewareChain middleware, String name) {
        return addRoute(Method.PUT, path, middleware, name);
    }

    public Route patch(String path, Middleware handler) {
        return addRoute(Method.PATCH, path, MiddlewareChain.of(handler), null);
    }

    public Route patch(String path, MiddlewareChain middleware) {
        return addRoute(Method.PATCH, path, middleware, null);
    }

    public Route patch(String path, MiddlewareChain middleware, String name) {
        return addRoute(Method.PATCH, path, middleware, name);
    }

    public Route delete(String path, Middleware handler) {
        return addRoute(Method.DELETE, path, MiddlewareChain.of(handler), null);
    }

    public Route delete(String path, MiddlewareChain middleware) {
        return addRoute(Method.DELETE, path, middleware, null);
    }

    public Route delete(String path, MiddlewareChain middleware, String name) {
        return addRoute(Method.DELETE, path, middleware, name);
    }

    /**
     * Appends all routes of another router, keeping their order.
     *
     * @param other the router whose routes to include
     * @return this router for method chaining
     */
    public Router include(Router other) {
        routes.addAll(other.routes);
        return this;
    }

    /**
     * Gets all routes in declaration order.
     *
     * @return an immutable snapshot of the route table
     */
    public List<Route> getRoutes() {
        return Collections.unmodifiableList(new ArrayList<>(routes));
    }

    /**
     * Creates a middleware that stores the route table on the context.
     *
     * @return the middleware
     */
    public Middleware bindRoutes() {
        List<Route> table = getRoutes();
        return ctx -> ctx.routes(table);
    }

    /**
     * Creates a middleware that matches the request against the routes on the context.
     *
     * <p>On a match the path params and the route's middleware are stored on the context. Without
     * a match the context gets a 404 response and is halted. Requires the routes to be bound and
     * the method and path to be normalized.</p>
     *
     * @return the middleware
     */
    public static Middleware matchRoute() {
        return ctx -> {
            List<Route> routes = ctx.routes();
            if (routes == null) {
                throw new IllegalStateException("No routes on the context, bind them before matching");
            }
            if (ctx.path() == null) {
                throw new IllegalStateException("Request path has not been processed yet");
            }

            for (Route route : routes) {
                Map<String, String> pathParams = route.match(ctx.method(), ctx.path());
                if (pathParams != null) {
                    logger.debug("Matched route {} with params {}", route, pathParams);
                    return ctx.pathParams(pathParams).routeMiddleware(route.getMiddleware());
                }
            }

            logger.debug("No route for {} /{}", ctx.method(), String.join("/", ctx.path()));
            return notFound(ctx);
        };
    }

    private static Context notFound(Context ctx) {
        return ctx.halt()
                .responseStatus(404)
                .responseHeader("Content-Type", "text/html")
                .responseBody("Not found");
    }

    /**
     * Creates a middleware that runs the middleware of the matched route. Does nothing if no
     * route was matched.
     *
     * @return the middleware
     */
    public static Middleware handleRoute() {
        return ctx -> {
            MiddlewareChain routeMiddleware = ctx.routeMiddleware();
            if (routeMiddleware == null) {
                return ctx;
            }
            return Pipeline.reduce(ctx, routeMiddleware);
        };
    }

    /**
     * Builds the path for a named route.
     *
     * <p>Parameters matching a named segment fill that segment; the remaining parameters are
     * appended as a query string.</p>
     *
     * @param name   the route name
     * @param params the parameters, in the order query parameters should appear
     * @return the path, e.g. "/orders/1?preview=true"
     * @throws IllegalArgumentException if no route has that name or a segment has no value
     */
    public String pathFor(String name, Map<String, ?> params) {
        Route route = findNamedRoute(name);
        Map<String, Object> remaining = new LinkedHashMap<>(params);

        StringBuilder path = new StringBuilder();
        for (PathPattern.Segment segment : route.getPattern().getSegments()) {
            path.append('/');
            if (segment.isParam()) {
                if (!remaining.containsKey(segment.getValue())) {
                    throw new IllegalArgumentException(
                            "Missing parameter '" + segment.getValue() + "' for route " + name);
                }
                path.append(encodeSegment(String.valueOf(remaining.remove(segment.getValue()))));
            } else {
                path.append(segment.getValue());
            }
        }
        if (path.length() == 0) {
            path.append('/');
        }

        if (!remaining.isEmpty()) {
            StringJoiner query = new StringJoiner("&", "?", "");
            for (Map.Entry<String, Object> entry : remaining.entrySet()) {
                query.add(encodeQuery(entry.getKey()) + "=" + encodeQuery(String.valueOf(entry.getValue())));
            }
            path.append(query);
        }
        return path.toString();
    }

    /**
     * Builds the absolute URL for a named route, using the URL scheme, host and port configured
     * on the context.
     *
     * @param ctx    the current context
     * @param name   the route name
     * @param params the parameters
     * @return the URL, e.g. "http://localhost:3000/orders/1"
     */
    public String urlFor(Context ctx, String name, Map<String, ?> params) {
        return ctx.urlScheme() + "://" + ctx.urlHost() + ":" + ctx.urlPort() + pathFor(name, params);
    }

    private Route findNamedRoute(String name) {
        for (Route route : routes) {
            if (name.equals(route.getName())) {
                return route;
            }
        }
        throw new IllegalArgumentException("No route named '" + name + "'");
    }

    private static String encodeSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodeQuery(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
