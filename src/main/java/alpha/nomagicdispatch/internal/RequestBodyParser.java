package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.util.Json;

import java.io.IOException;
import java.util.Locale;

import static alpha.nomagicdispatch.HttpConstants.HeaderKey.CONTENT_TYPE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Converts the bytes of a request body into a {@link Body}, as documented in
 * {@link alpha.nomagicdispatch.message.Request#body()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestBodyParser
{
    private static final System.Logger LOG
            = System.getLogger(RequestBodyParser.class.getPackageName());
    
    private RequestBodyParser() {
        // Empty
    }
    
    static Body parse(Headers headers, byte[] bytes) {
        if (bytes.length == 0) {
            return Body.empty();
        }
        String type = headers.firstValue(CONTENT_TYPE)
                             .map(v -> v.toLowerCase(Locale.ROOT))
                             .orElse("");
        if (type.contains("application/json")) {
            try {
                return Body.json(Json.read(bytes));
            } catch (IOException e) {
                LOG.log(DEBUG, "Malformed JSON request body, discarding it.", e);
                return Body.empty();
            }
        } else if (type.contains("application/x-www-form-urlencoded")) {
            var obj = Json.object();
            RequestTarget.parseQuery(new String(bytes, UTF_8)).forEach(obj::put);
            return Body.json(obj);
        } else if (type.contains("application/octet-stream")) {
            return Body.bytes(bytes);
        }
        return Body.text(new String(bytes, UTF_8));
    }
}
