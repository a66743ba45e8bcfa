package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link RequestBodyParser}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class RequestBodyParserTest
{
    @Test
    void json() {
        var b = parse("application/json; charset=utf-8", "{\"name\":\"Ada\",\"age\":36}");
        assertThat(b).isInstanceOf(Body.Json.class);
        var n = ((Body.Json) b).value();
        assertThat(n.get("name").asText()).isEqualTo("Ada");
        assertThat(n.get("age").asInt()).isEqualTo(36);
    }
    
    @Test
    void json_malformed() {
        assertThat(parse("application/json", "{nope")).isEqualTo(Body.empty());
    }
    
    @Test
    void json_trailingContent_isEmpty() {
        assertThat(parse("application/json", "{\"a\":1} xyz")).isEqualTo(Body.empty());
        assertThat(parse("application/json", "[1] [2]")).isEqualTo(Body.empty());
    }
    
    @Test
    void json_trailingWhitespace_isJson() {
        var b = parse("application/json", "{\"a\":1} \r\n");
        assertThat(((Body.Json) b).value().get("a").asInt()).isEqualTo(1);
    }
    
    @Test
    void json_whitespaceOnly_isEmpty() {
        var b = parse("application/json", "   \n");
        assertThat(b).isEqualTo(Body.empty());
        assertThat(b.isEmpty()).isTrue();
    }
    
    @Test
    void form() {
        var b = parse("application/x-www-form-urlencoded", "name=Ada+L&city=London");
        var n = ((Body.Json) b).value();
        assertThat(n.get("name").asText()).isEqualTo("Ada L");
        assertThat(n.get("city").asText()).isEqualTo("London");
    }
    
    @Test
    void octetStream() {
        var b = parse("application/octet-stream", "raw");
        assertThat(b).isEqualTo(Body.bytes("raw".getBytes(UTF_8)));
    }
    
    @Test
    void text() {
        assertThat(parse("text/plain", "hello")).isEqualTo(Body.text("hello"));
    }
    
    @Test
    void noContentType_isText() {
        assertThat(RequestBodyParser.parse(Headers.empty(), "hi".getBytes(UTF_8)))
            .isEqualTo(Body.text("hi"));
    }
    
    @Test
    void empty() {
        assertThat(parse("application/json", "")).isEqualTo(Body.empty());
        assertThat(parse("application/json", "").isEmpty()).isTrue();
    }
    
    @Test
    void contentTypeCaseInsensitive() {
        assertThat(parse("Application/JSON", "[1,2]")).isInstanceOf(Body.Json.class);
    }
    
    private static Body parse(String contentType, String body) {
        var h = Headers.empty().set("content-type", contentType);
        return RequestBodyParser.parse(h, body.getBytes(UTF_8));
    }
}
