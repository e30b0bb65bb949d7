package com.aino.example.handlers;

import com.aino.csrf.Csrf;
import com.aino.http.Context;
import com.aino.middleware.MiddlewareChain;
import com.aino.routing.Router;
import com.aino.session.Flash;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Handler for order pages: a list, a form, and create, show and delete actions. */
public class OrderHandler {
  private final Map<Integer, String> orders = new ConcurrentSkipListMap<>();
  private final AtomicInteger nextId = new AtomicInteger(1);
  private final Router router;

  public OrderHandler(Router router) {
    this.router = router;
  }

  /**
   * Registers the order routes.
   *
   * @param protect middleware run before every order action, e.g. CSRF protection
   */
  public void registerRoutes(MiddlewareChain protect) {
    router.get("/orders", protect.then(this::index), "orders");
    router.get("/orders/new", protect.then(this::newOrder), "new_order");
    router.get("/orders/:id", protect.then(this::show), "order");
    router.post("/orders", protect.then(this::create), "create_order");
    router.delete("/orders/:id", protect.then(this::destroy), "delete_order");
  }

  public Map<Integer, String> getOrders() {
    return Collections.unmodifiableMap(orders);
  }

  Context index(Context ctx) {
    StringBuilder html = new StringBuilder("<h1>Orders</h1>");
    String notice = Flash.get(ctx, "notice");
    if (notice != null) {
      html.append("<p class=\"notice\">").append(escape(notice)).append("</p>");
    }
    html.append("<ul>");
    for (Map.Entry<Integer, String> order : orders.entrySet()) {
      String path = router.pathFor("order", Map.of("id", order.getKey()));
      html.append("<li><a href=\"").append(path).append("\">")
          .append(escape(order.getValue())).append("</a></li>");
    }
    html.append("</ul>");
    return ctx.responseStatus(200).html(html.toString());
  }

  Context newOrder(Context ctx) {
    String html =
        "<form method=\"post\" action=\"" + router.pathFor("create_order", Map.of()) + "\">"
            + "<input type=\"hidden\" name=\"csrf_token\" value=\"" + Csrf.getToken(ctx) + "\">"
            + "<input name=\"order[name]\">"
            + "<button>Create</button></form>";
    return ctx.responseStatus(200).html(html);
  }

  Context show(Context ctx) {
    Integer id = orderId(ctx);
    String name = id == null ? null : orders.get(id);
    if (name == null) {
      return notFound(ctx);
    }
    return ctx.responseStatus(200).html("<h1>" + escape(name) + "</h1>");
  }

  Context create(Context ctx) {
    Object order = ctx.param("order");
    Object name = order instanceof Map ? ((Map<?, ?>) order).get("name") : null;
    if (!(name instanceof String) || ((String) name).isBlank()) {
      return ctx.responseStatus(422).html("<p>Name is required</p>");
    }

    int id = nextId.getAndIncrement();
    orders.put(id, (String) name);
    Flash.put(ctx, "notice", "Order " + id + " created");
    return ctx.redirect(router.urlFor(ctx, "order", Map.of("id", id)));
  }

  Context destroy(Context ctx) {
    Integer id = orderId(ctx);
    if (id == null || orders.remove(id) == null) {
      return notFound(ctx);
    }
    Flash.put(ctx, "notice", "Order deleted");
    return ctx.redirect(router.pathFor("orders", Map.of()));
  }

  private static Integer orderId(Context ctx) {
    try {
      return Integer.valueOf(String.valueOf(ctx.param("id")));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Context notFound(Context ctx) {
    return ctx.responseStatus(404).responseHeader("Content-Type", "text/plain").responseBody("Not found");
  }

  private static String escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
  }
}
