package com.aino.core;

import com.aino.http.Context;
import com.aino.http.Header;
import com.aino.http.Request;
import com.aino.http.Response;
import com.aino.middleware.Middleware;
import com.aino.middleware.MiddlewareChain;
import com.aino.middleware.Pipeline;
import com.aino.plugin.Plugin;
import com.aino.util.JsonUtil;
import com.aino.util.LogUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderValues;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The application: holds the middleware pipeline and the configuration copied onto every
 * context, and binds the pipeline to an Undertow server.
 *
 * <pre>{@code
 * Aino app = new Aino()
 *     .port(3000)
 *     .use(CommonMiddleware.common())
 *     .use(router.bindRoutes())
 *     .use(Router.matchRoute())
 *     .use(CommonMiddleware.params())
 *     .use(Router.handleRoute());
 * app.listen();
 * }</pre>
 */
public class Aino {
  private static final Logger logger = LoggerFactory.getLogger(Aino.class);

  private static final int HTTP_INTERNAL_SERVER_ERROR = 500;
  private static final String DEVELOPMENT = "development";
  private static final String GENERIC_ERROR = "{\"error\": \"Internal Server Error\"}";

  private String host = System.getProperty("aino.host", "localhost");
  private int port = Integer.getInteger("aino.port", 3000);
  private String environment = System.getProperty("aino.environment", DEVELOPMENT);
  private String urlScheme = "http";
  private String urlHost;
  private Integer urlPort;

  private final Map<String, Object> config = new HashMap<>();
  private final Map<String, Object> locals = new HashMap<>();
  private final List<Plugin> plugins = new ArrayList<>();
  private MiddlewareChain pipeline = MiddlewareChain.empty();

  private Undertow server;

  /**
   * Sets the host for the server.
   *
   * @param host the host to bind to
   * @return this instance for method chaining
   */
  public Aino host(String host) {
    this.host = host;
    return this;
  }

  /**
   * Sets the port for the server. Port 0 binds an ephemeral port, see {@link #getBoundPort()}.
   *
   * @param port the port to listen on
   * @return this instance for method chaining
   */
  public Aino port(int port) {
    this.port = port;
    return this;
  }

  public Aino environment(String environment) {
    this.environment = environment;
    return this;
  }

  public String getEnvironment() {
    return environment;
  }

  /**
   * Sets the scheme used when building absolute URLs.
   *
   * @param urlScheme e.g. "https"
   * @return this instance for method chaining
   */
  public Aino urlScheme(String urlScheme) {
    this.urlScheme = urlScheme;
    return this;
  }

  /**
   * Sets the host used when building absolute URLs. Defaults to the bind host.
   *
   * @param urlHost the public host name
   * @return this instance for method chaining
   */
  public Aino urlHost(String urlHost) {
    this.urlHost = urlHost;
    return this;
  }

  /**
   * Sets the port used when building absolute URLs. Defaults to the bind port.
   *
   * @param urlPort the public port
   * @return this instance for method chaining
   */
  public Aino urlPort(int urlPort) {
    this.urlPort = urlPort;
    return this;
  }

  /**
   * Sets an application config value, readable from every context with
   * {@link Context#config(String)}.
   *
   * @param key the key
   * @param value the value
   * @return this instance for method chaining
   */
  public Aino config(String key, Object value) {
    config.put(key, value);
    return this;
  }

  /**
   * Appends a middleware to the application pipeline.
   *
   * @param middleware the middleware to add
   * @return this instance for method chaining
   */
  public Aino use(Middleware middleware) {
    pipeline = pipeline.then(middleware);
    return this;
  }

  public Aino use(MiddlewareChain chain) {
    pipeline = pipeline.then(chain);
    return this;
  }

  /**
   * Registers a plugin with the application.
   *
   * @param plugin the plugin to register
   * @return this instance for method chaining
   */
  public Aino register(Plugin plugin) {
    logger.info(LogUtil.info("Registering plugin: " + LogUtil.colored(plugin.getName(), LogUtil.CYAN_BOLD)));
    plugins.add(plugin);
    plugin.register(this);
    return this;
  }

  /**
   * Gets a plugin by name.
   *
   * @param name the name of the plugin
   * @return the plugin or null if not found
   */
  public Plugin getPlugin(String name) {
    for (Plugin plugin : plugins) {
      if (plugin.getName().equals(name)) {
        return plugin;
      }
    }
    return null;
  }

  public Aino set(String key, Object value) {
    locals.put(key, value);
    return this;
  }

  @SuppressWarnings("unchecked")
  public <T> T get(String key) {
    return (T) locals.get(key);
  }

  /**
   * Runs a request through the pipeline.
   *
   * @param request the inbound request
   * @return the response built by the pipeline
   * @throws com.aino.http.IncompleteResponseException if the pipeline left response fields unset
   * @throws Exception anything a middleware throws
   */
  public Response handle(Request request) throws Exception {
    Context ctx =
        new Context(request)
            .urlScheme(urlScheme)
            .urlHost(urlHost != null ? urlHost : host)
            .urlPort(urlPort != null ? urlPort : port)
            .environment(environment)
            .config(config);
    return Pipeline.reduce(ctx, pipeline).toResponse();
  }

  /** Starts the server and begins listening for requests. */
  public void listen() {
    listen(
        () ->
            logger.info(
                LogUtil.info(
                    "Aino listening on "
                        + LogUtil.colored("http://" + host + ":" + getBoundPort(), LogUtil.BLUE_BOLD)
                        + " ("
                        + environment
                        + ")")));
  }

  /**
   * Starts the server with a callback function.
   *
   * @param callback the function to call when the server has started
   */
  public void listen(Runnable callback) {
    for (Plugin plugin : plugins) {
      logger.info(LogUtil.info("Starting plugin: " + LogUtil.colored(plugin.getName(), LogUtil.CYAN_BOLD)));
      plugin.onStart(this);
    }

    server = Undertow.builder().addHttpListener(port, host).setHandler(new AinoHttpHandler()).build();
    server.start();

    if (callback != null) {
      callback.run();
    }
  }

  /** Stops the server. */
  public void stop() {
    if (server == null) {
      return;
    }
    for (Plugin plugin : plugins) {
      logger.info(LogUtil.info("Stopping plugin: " + LogUtil.colored(plugin.getName(), LogUtil.CYAN_BOLD)));
      plugin.onStop(this);
    }
    server.stop();
    server = null;
    logger.info(LogUtil.info("Server stopped"));
  }

  /**
   * Gets the port the running server is bound to.
   *
   * @return the bound port
   * @throws IllegalStateException if the server is not running
   */
  public int getBoundPort() {
    if (server == null) {
      throw new IllegalStateException("Server is not running");
    }
    return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
  }

  private String errorBody(Exception e) {
    if (!DEVELOPMENT.equals(environment)) {
      return GENERIC_ERROR;
    }
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("error", "Internal Server Error");
    error.put("exception", e.getClass().getName());
    error.put("message", e.getMessage());
    try {
      return JsonUtil.toJson(error);
    } catch (JsonProcessingException jsonError) {
      logger.warn(LogUtil.warn("Could not serialize error details: " + jsonError.getOriginalMessage()));
      return GENERIC_ERROR;
    }
  }

  /** Bridges Undertow exchanges to {@link #handle(Request)}. */
  private class AinoHttpHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
      // body reads block, so leave the IO thread
      if (exchange.isInIoThread()) {
        exchange.dispatch(this);
        return;
      }

      long start = System.nanoTime();
      exchange.startBlocking();

      try {
        Response response = handle(toRequest(exchange));
        write(exchange, response);
      } catch (Exception e) {
        handleError(exchange, e);
      }

      logger.info(
          LogUtil.request(
              exchange.getRequestMethod().toString(),
              exchange.getRequestPath(),
              exchange.getStatusCode(),
              System.nanoTime() - start));
      if (!exchange.isComplete()) {
        exchange.endExchange();
      }
    }

    private Request toRequest(HttpServerExchange exchange) throws IOException {
      Request.Builder builder =
          Request.builder(exchange.getRequestMethod().toString(), rawPath(exchange))
              .queryString(exchange.getQueryString())
              .scheme(exchange.getRequestScheme())
              .host(exchange.getHostName())
              .port(exchange.getHostPort());

      for (HeaderValues values : exchange.getRequestHeaders()) {
        String name = values.getHeaderName().toString();
        for (String value : values) {
          builder.header(name, value);
        }
      }

      byte[] body = exchange.getInputStream().readAllBytes();
      return builder.body(new String(body, StandardCharsets.UTF_8)).build();
    }

    /** The path as sent, still percent-encoded. Segments are decoded after splitting. */
    private String rawPath(HttpServerExchange exchange) {
      if (exchange.isHostIncludedInRequestURI()) {
        return URI.create(exchange.getRequestURI()).getRawPath();
      }
      return exchange.getRequestURI();
    }

    private void write(HttpServerExchange exchange, Response response) {
      exchange.setStatusCode(response.getStatus());
      for (Header header : response.getHeaders()) {
        exchange.getResponseHeaders().add(new HttpString(header.getName()), header.getValue());
      }
      exchange.getResponseSender().send(ByteBuffer.wrap(response.getBodyBytes()));
    }

    private void handleError(HttpServerExchange exchange, Exception e) {
      logger.error(LogUtil.error("Error processing request: " + e.getMessage()), e);
      if (exchange.isResponseStarted()) {
        logger.warn(LogUtil.warn("Cannot send error response, the response has already started"));
        return;
      }
      exchange.setStatusCode(HTTP_INTERNAL_SERVER_ERROR);
      exchange.getResponseHeaders().clear();
      exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
      exchange.getResponseSender().send(errorBody(e));
    }
  }
}
