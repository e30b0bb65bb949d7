package com.aino.core;

import com.aino.http.IncompleteResponseException;
import com.aino.http.Request;
import com.aino.http.Response;
import com.aino.middleware.CommonMiddleware;
import com.aino.middleware.MiddlewareChain;
import com.aino.plugin.AbstractPlugin;
import com.aino.routing.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the application entry point and the Undertow binding.
 */
@DisplayName("Aino Tests")
public class AinoTest {

    private Aino app;

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
    }

    private static Aino routedApp(Router router) {
        return new Aino()
                .host("127.0.0.1")
                .port(0)
                .use(CommonMiddleware.common())
                .use(router.bindRoutes())
                .use(Router.matchRoute())
                .use(CommonMiddleware.params())
                .use(Router.handleRoute());
    }

    @Test
    @DisplayName("Should answer 404 for unknown paths")
    void testNotFound() throws Exception {
        Response response = routedApp(new Router()).handle(Request.builder("GET", "/nope").build());

        assertEquals(404, response.getStatus());
        assertEquals("Not found", response.getBodyText());
    }

    @Test
    @DisplayName("Should copy URL settings and config onto every context")
    void testConfigOnContext() throws Exception {
        Router router = new Router();
        router.get("/info", ctx -> ctx.responseStatus(200)
                .html(ctx.urlScheme() + " " + ctx.urlHost() + " " + ctx.urlPort() + " " + ctx.environment() + " " + ctx.config("shop")));

        Aino configured = routedApp(router)
                .urlScheme("https")
                .urlHost("shop.example")
                .urlPort(443)
                .environment("test")
                .config("shop", "north");

        Response response = configured.handle(Request.builder("GET", "/info").build());

        assertEquals("https shop.example 443 test north", response.getBodyText());
    }

    @Test
    @DisplayName("Should raise when the pipeline leaves the response incomplete")
    void testIncompleteResponse() {
        Aino bare = new Aino().use(ctx -> ctx.responseStatus(200));

        assertThrows(IncompleteResponseException.class, () -> bare.handle(Request.builder("GET", "/").build()));
    }

    @Test
    @DisplayName("Should notify plugins on register, start and stop")
    void testPluginLifecycle() {
        List<String> events = new ArrayList<>();
        AbstractPlugin plugin = new AbstractPlugin("recorder", "1.0.0") {
            @Override
            public void register(Aino app) {
                super.register(app);
                events.add("register");
            }

            @Override
            public void onStart(Aino app) {
                events.add("start");
            }

            @Override
            public void onStop(Aino app) {
                events.add("stop");
            }
        };

        app = routedApp(new Router()).register(plugin);
        app.listen(null);
        app.stop();
        app = null;

        assertEquals(List.of("register", "start", "stop"), events);
    }

    @Test
    @DisplayName("Should serve requests over HTTP with duplicate headers and a 500 boundary")
    void testLiveServer() throws Exception {
        // Given: a running server with a normal and a failing route
        Router router = new Router();
        router.post("/echo", ctx -> ctx.responseStatus(201)
                .responseHeader("Set-Cookie", "a=1")
                .responseHeader("Set-Cookie", "b=2")
                .html("hello " + ctx.param("name")));
        router.get("/boom", ctx -> {
            throw new IllegalStateException("kaboom");
        });
        app = routedApp(router);
        app.listen(null);
        String base = "http://127.0.0.1:" + app.getBoundPort();
        HttpClient client = HttpClient.newHttpClient();

        // When: posting a form
        HttpResponse<String> echo = client.send(
                HttpRequest.newBuilder(URI.create(base + "/echo?name=query"))
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString("name=jane"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        // Then: query beats body and both cookies arrive
        assertEquals(201, echo.statusCode());
        assertEquals("hello query", echo.body());
        assertEquals(List.of("a=1", "b=2"), echo.headers().allValues("set-cookie"));

        // When: a handler throws
        HttpResponse<String> boom = client.send(
                HttpRequest.newBuilder(URI.create(base + "/boom")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        // Then: a JSON 500 with details in development
        assertEquals(500, boom.statusCode());
        assertTrue(boom.body().contains("Internal Server Error"));
        assertTrue(boom.body().contains("kaboom"));
    }

    @Test
    @DisplayName("Should decode encoded path segments from the raw request URI")
    void testEncodedPathOverHttp() throws Exception {
        Router router = new Router();
        router.get("/orders/:id", MiddlewareChain.of(ctx -> ctx.responseStatus(200).html("order " + ctx.pathParams().get("id"))), "order");
        app = routedApp(router);
        app.listen(null);

        String path = router.pathFor("order", Map.of("id", "a b/c"));
        HttpResponse<String> response = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getBoundPort() + path)).build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("order a b/c", response.body());
    }

    @Test
    @DisplayName("Should hide exception details outside development")
    void testProductionErrors() throws Exception {
        Router router = new Router();
        router.get("/boom", ctx -> {
            throw new IllegalStateException("secret detail");
        });
        app = routedApp(router).environment("production");
        app.listen(null);

        HttpResponse<String> boom = HttpClient.newHttpClient().send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getBoundPort() + "/boom")).build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(500, boom.statusCode());
        assertEquals("{\"error\": \"Internal Server Error\"}", boom.body());
    }

    @Test
    @DisplayName("Should report no bound port before listening")
    void testBoundPortBeforeListen() {
        assertThrows(IllegalStateException.class, () -> new Aino().getBoundPort());
    }
}
