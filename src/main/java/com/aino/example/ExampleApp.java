package com.aino.example;

import com.aino.core.Aino;
import com.aino.example.handlers.OrderHandler;
import com.aino.middleware.CommonMiddleware;
import com.aino.plugin.csrf.CsrfPlugin;
import com.aino.plugin.session.SessionPlugin;
import com.aino.routing.Router;
import java.nio.file.Path;
import java.util.Map;

/** Example application: an order list behind signed-cookie sessions and CSRF protection. */
public class ExampleApp {

  public static void main(String[] args) {
    String secret = System.getProperty("aino.secret", "change-me");
    create(SessionPlugin.signed(secret, "example-salt"), Path.of("assets")).listen();
  }

  /**
   * Wires the example application.
   *
   * @param sessions the session plugin to use
   * @param assets the directory served under /assets
   * @return the configured application
   */
  public static Aino create(SessionPlugin sessions, Path assets) {
    CsrfPlugin csrf = new CsrfPlugin();
    Router router = new Router();
    OrderHandler orders = new OrderHandler(router);
    orders.registerRoutes(csrf.protect());
    router.get("/", ctx -> ctx.redirect(router.pathFor("orders", Map.of())));

    Aino app = new Aino().register(sessions).register(csrf).set("orders", orders);
    return app.use(CommonMiddleware.common())
        .use(CommonMiddleware.assets(assets))
        .use(sessions.load())
        .use(router.bindRoutes())
        .use(Router.matchRoute())
        .use(CommonMiddleware.params())
        .use(Router.handleRoute())
        .use(sessions.save());
  }
}
