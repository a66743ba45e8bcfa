package alpha.nomagicdispatch.middleware;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests of {@link StaticFiles}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class StaticFilesTest
{
    @TempDir
    Path root;
    
    private Engine testee;
    
    @BeforeEach
    void before() throws IOException {
        Path web = Files.createDirectory(root.resolve("web"));
        Files.writeString(web.resolve("index.html"), "<h1>Home</h1>");
        Files.createDirectory(web.resolve("css"));
        Files.writeString(web.resolve("css").resolve("site.css"), "body{}");
        Files.writeString(root.resolve("secret.txt"), "top secret");
        
        testee = Engine.create();
        testee.use(StaticFiles.of(web));
        testee.get("/api/ping", (req, res, ch) -> res.send("pong"));
        testee.post("/css/site.css", (req, res, ch) -> res.send("posted"));
    }
    
    @Test
    void index() throws Exception {
        var res = get("/");
        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(text(res)).isEqualTo("<h1>Home</h1>");
        assertThat(res.headers().firstValue("Content-Type")).contains("text/html; charset=utf-8");
    }
    
    @Test
    void nested() throws Exception {
        var res = get("/css/site.css");
        assertThat(text(res)).isEqualTo("body{}");
        assertThat(res.headers().firstValue("Content-Type")).contains("text/css; charset=utf-8");
    }
    
    @Test
    void missing_fallsThrough() throws Exception {
        assertThat(text(get("/api/ping"))).isEqualTo("pong");
        assertThat(get("/nope.html").statusCode()).isEqualTo(404);
    }
    
    @Test
    void directory_fallsThrough() throws Exception {
        assertThat(get("/css").statusCode()).isEqualTo(404);
    }
    
    @Test
    void traversal_refused() throws Exception {
        var res = get("/../secret.txt");
        assertThat(res.statusCode()).isEqualTo(404);
        assertThat(text(res)).isEqualTo("Not Found");
    }
    
    @Test
    void onlyGet() throws Exception {
        var res = testee.dispatch(InboundRequest.of("POST", "/css/site.css", Headers.empty(), new byte[0]))
                        .toCompletableFuture().get(3, SECONDS);
        assertThat(text(res)).isEqualTo("posted");
    }
    
    @Test
    void customIndex() throws Exception {
        Files.writeString(root.resolve("home.txt"), "home");
        var app = Engine.create();
        app.use(StaticFiles.of(root, "home.txt"));
        var res = app.dispatch(InboundRequest.of("GET", "/", Headers.empty(), new byte[0]))
                     .toCompletableFuture().get(3, SECONDS);
        assertThat(text(res)).isEqualTo("home");
        assertThat(res.headers().firstValue("Content-Type")).contains("text/plain; charset=utf-8");
    }
    
    @Test
    void blankIndex() {
        assertThatThrownBy(() -> StaticFiles.of(root, " "))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }
    
    private Response get(String path) throws Exception {
        return testee.dispatch(InboundRequest.of("GET", path, Headers.empty(), new byte[0]))
                     .toCompletableFuture().get(3, SECONDS);
    }
    
    private static String text(Response res) {
        return new String(res.body().toBytes(), UTF_8);
    }
}
