package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Request;

import java.io.IOException;
import java.util.Map;

import static alpha.nomagicdispatch.HttpConstants.HeaderKey.HOST;

/**
 * Default implementation of {@link Request}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultRequest implements Request
{
    /**
     * Reads and converts the given inbound request.
     * 
     * @param in inbound request
     * @return a new request
     * @throws IOException if reading the body fails
     */
    static DefaultRequest of(InboundRequest in) throws IOException {
        var target  = RequestTarget.parse(in.target());
        var headers = Headers.copyOf(in.headers().asMap());
        return new DefaultRequest(
                in.method(),
                url(in.target(), headers),
                target.path(),
                headers,
                target.query(),
                RequestBodyParser.parse(headers, in.body()));
    }
    
    private static String url(String target, Headers headers) {
        if (!target.startsWith("/")) {
            return target;
        }
        return headers.firstValue(HOST)
                      .map(h -> "http://" + h + target)
                      .orElse(target);
    }
    
    private final String method, url, path;
    private final Headers headers;
    private final Map<String, String> query;
    private final Body body;
    private volatile Map<String, String> params;
    
    private DefaultRequest(
            String method, String url, String path,
            Headers headers, Map<String, String> query, Body body)
    {
        this.method  = method;
        this.url     = url;
        this.path    = path;
        this.headers = headers;
        this.query   = query;
        this.body    = body;
        this.params  = Map.of();
    }
    
    void bindParams(Map<String, String> params) {
        this.params = Map.copyOf(params);
    }
    
    @Override
    public String method() {
        return method;
    }
    
    @Override
    public String url() {
        return url;
    }
    
    @Override
    public String path() {
        return path;
    }
    
    @Override
    public Headers headers() {
        return headers;
    }
    
    @Override
    public Map<String, String> params() {
        return params;
    }
    
    @Override
    public Map<String, String> query() {
        return query;
    }
    
    @Override
    public Body body() {
        return body;
    }
    
    @Override
    public String toString() {
        return DefaultRequest.class.getSimpleName() +
                "{method=" + method + ", path=" + path + ", params=" + params + "}";
    }
}
