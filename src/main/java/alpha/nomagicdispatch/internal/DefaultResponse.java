package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.util.Json;
import alpha.nomagicdispatch.util.MimeTypes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static alpha.nomagicdispatch.HttpConstants.HeaderKey.CONTENT_TYPE;
import static alpha.nomagicdispatch.HttpConstants.HeaderKey.LOCATION;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.THREE_HUNDRED_TWO;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Response}.<p>
 * 
 * Fields are volatile as handlers of the same dispatch may run on different
 * threads, one after the other.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultResponse implements Response
{
    private static final String APPLICATION_JSON = "application/json",
                                TEXT_PLAIN       = "text/plain; charset=utf-8";
    
    private final Headers headers;
    private volatile int status;
    private volatile Body body;
    private volatile boolean written;
    
    DefaultResponse() {
        headers = Headers.empty();
        status  = TWO_HUNDRED;
        body    = Body.empty();
    }
    
    @Override
    public int statusCode() {
        return status;
    }
    
    @Override
    public Response status(int code) {
        status = requireValidStatus(code);
        return this;
    }
    
    @Override
    public Headers headers() {
        return headers;
    }
    
    @Override
    public Response header(String name, String value) {
        headers.set(name, value);
        return this;
    }
    
    @Override
    public Body body() {
        return body;
    }
    
    @Override
    public Response send(String text) {
        return send(Body.text(text));
    }
    
    @Override
    public Response send(Body body) {
        this.body = requireNonNull(body);
        written = true;
        return this;
    }
    
    @Override
    public Response json(Object data) {
        var tree = Json.toTree(data);
        headers.set(CONTENT_TYPE, APPLICATION_JSON);
        return send(Body.json(tree));
    }
    
    @Override
    public Response redirect(String url) {
        return redirect(THREE_HUNDRED_TWO, url);
    }
    
    @Override
    public Response redirect(int status, String url) {
        requireValidStatus(status);
        headers.set(LOCATION, requireNonNull(url));
        this.status = status;
        return end();
    }
    
    @Override
    public Response sendFile(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        headers.set(CONTENT_TYPE, MimeTypes.of(file));
        return send(Body.bytes(bytes));
    }
    
    @Override
    public Response end() {
        written = true;
        return this;
    }
    
    @Override
    public boolean isWritten() {
        return written;
    }
    
    /**
     * Discards all state and writes a plain text response.<p>
     * 
     * Used by the engine to produce fallback responses.
     * 
     * @param status code
     * @param text body
     */
    void replace(int status, String text) {
        headers.clear().set(CONTENT_TYPE, TEXT_PLAIN);
        this.status = status;
        send(text);
    }
    
    private static int requireValidStatus(int code) {
        if (code < 100 || code > 999) {
            throw new IllegalArgumentException(
                "Status code must be a three-digit number: " + code);
        }
        return code;
    }
    
    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() +
                "{status=" + status + ", written=" + written + ", body=" + body + "}";
    }
}
