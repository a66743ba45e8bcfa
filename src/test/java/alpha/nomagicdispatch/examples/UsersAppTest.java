package alpha.nomagicdispatch.examples;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of {@link UsersApp}, dispatched without a transport.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class UsersAppTest
{
    @TempDir
    Path web;
    
    private Engine app;
    
    @BeforeEach
    void before() {
        app = UsersApp.create(web);
    }
    
    @Test
    void getUser() throws Exception {
        var res = dispatch("GET", "/users/7", Headers.empty(), "");
        
        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.headers().firstValue("Content-Type")).contains("application/json");
        var json = json(res);
        assertThat(json.get("userId").asText()).isEqualTo("7");
        assertThat(json.get("message").asText()).isEqualTo("Fetched user 7");
    }
    
    @Test
    void postUser_echo() throws Exception {
        var res = dispatch("POST", "/users",
                Headers.empty().set("Content-Type", "application/json"),
                "{\"name\":\"Ada\",\"langs\":[\"en\",\"fr\"]}");
        
        assertThat(res.statusCode()).isEqualTo(201);
        var json = json(res);
        assertThat(json.get("message").asText()).isEqualTo("User created");
        assertThat(json.get("user").get("name").asText()).isEqualTo("Ada");
        assertThat(json.get("user").get("langs")).hasSize(2);
    }
    
    @Test
    void postUser_form() throws Exception {
        var res = dispatch("POST", "/users",
                Headers.empty().set("Content-Type", "application/x-www-form-urlencoded"),
                "name=Ada");
        assertThat(res.statusCode()).isEqualTo(201);
        assertThat(json(res).get("user").get("name").asText()).isEqualTo("Ada");
    }
    
    @Test
    void staticFileServedFirst() throws Exception {
        Files.writeString(web.resolve("index.html"), "hi");
        var res = dispatch("GET", "/", Headers.empty(), "");
        assertThat(new String(res.body().toBytes(), UTF_8)).isEqualTo("hi");
    }
    
    @Test
    void unknown_404() throws Exception {
        assertThat(dispatch("DELETE", "/users/7", Headers.empty(), "").statusCode())
            .isEqualTo(404);
    }
    
    private Response dispatch(String method, String target, Headers headers, String body)
            throws Exception
    {
        return app.dispatch(InboundRequest.of(method, target, headers, body.getBytes(UTF_8)))
                  .toCompletableFuture().get(3, SECONDS);
    }
    
    private static JsonNode json(Response res) {
        assertThat(res.body()).isInstanceOf(Body.Json.class);
        return ((Body.Json) res.body()).value();
    }
}
