package com.aino.routing;

import com.aino.http.Method;
import com.aino.middleware.MiddlewareChain;
import java.util.List;
import java.util.Map;

/** Represents a route in the application. Routes are immutable once created. */
public class Route {
  private final Method method;
  private final PathPattern pattern;
  private final MiddlewareChain middleware;
  private final String name;

  /**
   * Creates a new route.
   *
   * @param method the HTTP method
   * @param path the route path, e.g. "/orders/:id"
   * @param middleware the middleware to run when the route matches
   * @param name the symbolic name used for reverse routing, may be null
   */
  public Route(Method method, String path, MiddlewareChain middleware, String name) {
    if (method == null) {
      throw new IllegalArgumentException("Route method must not be null");
    }
    this.method = method;
    this.pattern = PathPattern.compile(path);
    this.middleware = middleware == null ? MiddlewareChain.empty() : middleware;
    this.name = name;
  }

  /**
   * Gets the HTTP method of the route.
   *
   * @return the method
   */
  public Method getMethod() {
    return method;
  }

  /**
   * Gets the path of the route.
   *
   * @return the path
   */
  public String getPath() {
    return pattern.getPath();
  }

  /**
   * Gets the compiled path pattern of the route.
   *
   * @return the pattern
   */
  public PathPattern getPattern() {
    return pattern;
  }

  /**
   * Gets the middleware bound to this route.
   *
   * @return the middleware chain
   */
  public MiddlewareChain getMiddleware() {
    return middleware;
  }

  /**
   * Gets the symbolic name of the route.
   *
   * @return the name, or null for unnamed routes
   */
  public String getName() {
    return name;
  }

  /**
   * Matches a request against this route.
   *
   * @param method the request method
   * @param path the request path segments
   * @return the bound path parameters, or null if the route does not match
   */
  public Map<String, String> match(Method method, List<String> path) {
    if (this.method != method) {
      return null;
    }
    return pattern.match(path);
  }

  @Override
  public String toString() {
    return method + " " + pattern + (name == null ? "" : " as " + name);
  }
}
