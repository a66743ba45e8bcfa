package alpha.nomagicdispatch.middleware;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.testutil.Logging;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of {@link AccessLog}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class AccessLogTest
{
    private static final Clock FIXED = Clock.fixed(
            Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);
    
    private final List<String> lines = new CopyOnWriteArrayList<>();
    
    private final AccessLog.Builder plain = AccessLog.builder()
            .colors(false)
            .clock(FIXED)
            .sink(lines::add);
    
    @Test
    void requestLine() throws Exception {
        var app = Engine.create();
        app.use(plain.headers(false).body(false).build());
        app.get("/users/:id", (req, res, ch) -> res.status(202).send("ok"));
        
        dispatch(app, "GET", "/users/7?x=1", Headers.empty(), "");
        
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).matches("2024-01-01T12:00:00Z GET /users/7 202 \\d+ms");
    }
    
    @Test
    void observesFinalStatus_404_500() throws Exception {
        var app = Engine.create();
        app.use(plain.headers(false).body(false).build());
        app.get("/boom", (req, res, ch) -> { throw new IllegalStateException(); });
        
        dispatch(app, "GET", "/nothing", Headers.empty(), "");
        dispatch(app, "GET", "/boom", Headers.empty(), "");
        
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("GET /nothing 404");
        assertThat(lines.get(1)).contains("GET /boom 500");
    }
    
    @Test
    void asyncHandler() throws Exception {
        var app = Engine.create();
        app.use(plain.headers(false).body(false).build());
        app.get("/slow", (req, res, ch) ->
            CompletableFuture.runAsync(() -> {
                res.send("done");
                ch.proceed();
            }));
        
        dispatch(app, "GET", "/slow", Headers.empty(), "");
        
        // Logging may trail the completion of the dispatch
        long deadline = System.nanoTime() + SECONDS.toNanos(3);
        while (lines.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).contains("GET /slow 200");
    }
    
    @Test
    void headersAndBody() throws Exception {
        var app = Engine.create();
        app.use(plain.build());
        app.post("/users", (req, res, ch) -> res.status(201).end());
        
        dispatch(app, "POST", "/users",
                Headers.empty().set("Content-Type", "application/json"),
                "{\"name\":\"Ada\"}");
        
        assertThat(lines).hasSize(5);
        assertThat(lines.get(0)).startsWith("2024-01-01T12:00:00Z POST /users 201 ");
        assertThat(lines.get(1)).isEqualTo("Headers:");
        assertThat(lines.get(2)).isEqualTo("  Content-Type: application/json");
        assertThat(lines.get(3)).isEqualTo("Body:");
        assertThat(lines.get(4)).contains("\"name\" : \"Ada\"");
    }
    
    @Test
    void separator() throws Exception {
        var app = Engine.create();
        app.use(plain.headers(false).body(false).separator(true).build());
        app.get("/", (req, res, ch) -> res.send("x"));
        
        dispatch(app, "GET", "/", Headers.empty(), "");
        dispatch(app, "GET", "/", Headers.empty(), "");
        
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).contains("GET / 200");
        assertThat(lines.get(1)).isEmpty();
        assertThat(lines.get(2)).contains("GET / 200");
        assertThat(lines.get(3)).isEmpty();
    }
    
    @Test
    void sinkFails_responseUnaffected() throws Exception {
        var rec = Logging.startRecording(AccessLog.class);
        try {
            var app = Engine.create();
            app.use(plain.sink(line -> { throw new IllegalStateException("sink"); }).build());
            app.get("/", (req, res, ch) -> res.status(201).send("x"));
            
            var res = dispatch(app, "GET", "/", Headers.empty(), "");
            
            assertThat(res.statusCode()).isEqualTo(201);
            assertThat(new String(res.body().toBytes(), UTF_8)).isEqualTo("x");
            assertThat(rec.take(WARNING, "Access log sink failed", IllegalStateException.class))
                .isNotNull();
        } finally {
            rec.stop();
        }
    }
    
    @Test
    void colors() throws Exception {
        var app = Engine.create();
        app.use(plain.colors(true).headers(false).body(false).build());
        app.get("/", (req, res, ch) -> res.send("x"));
        
        dispatch(app, "GET", "/", Headers.empty(), "");
        
        assertThat(lines.get(0))
            .contains("\u001B[1mGET\u001B[0m")
            .contains("\u001B[32m200\u001B[0m");
    }
    
    @Test
    void responseNotModified() throws Exception {
        var app = Engine.create();
        app.use(plain.build());
        app.get("/", (req, res, ch) -> res.header("X-A", "1").status(203).send("body"));
        
        var res = dispatch(app, "GET", "/", Headers.empty(), "");
        
        assertThat(res.statusCode()).isEqualTo(203);
        assertThat(res.headers().asMap()).containsOnlyKeys("X-A");
        assertThat(new String(res.body().toBytes(), UTF_8)).isEqualTo("body");
    }
    
    private static Response dispatch(
            Engine app, String method, String target, Headers headers, String body)
            throws Exception
    {
        return app.dispatch(InboundRequest.of(method, target, headers, body.getBytes(UTF_8)))
                  .toCompletableFuture().get(3, SECONDS);
    }
}
