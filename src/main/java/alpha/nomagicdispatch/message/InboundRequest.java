package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.adapter.Adapter;

import java.io.IOException;

import static java.util.Objects.requireNonNull;

/**
 * A transport-neutral request, as handed to {@link Engine#dispatch(InboundRequest)}
 * by an {@link Adapter}.<p>
 * 
 * The engine reads each accessor at most once, on the thread calling {@code
 * dispatch}, before any handler runs.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface InboundRequest
{
    /**
     * Creates an {@code InboundRequest} with an already buffered body.
     * 
     * @param method  request method token, e.g. "GET"
     * @param target  request-target, e.g. "/users?page=2", or an absolute URL
     * @param headers request headers
     * @param body    request body (may be empty)
     * 
     * @return an {@code InboundRequest}
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static InboundRequest of(String method, String target, Headers headers, byte[] body) {
        return new Buffered(method, target, headers, body);
    }
    
    /**
     * Returns the method token.
     * 
     * @return the method token (never {@code null})
     */
    String method();
    
    /**
     * Returns the request-target.<p>
     * 
     * The target is either the origin form, i.e. an absolute path with an
     * optional query ("/where?q=now"), or the absolute form, i.e. a full URL
     * ("http://www.example.com/where?q=now"). The path component is
     * <i>not</i> percent-decoded by the engine.
     * 
     * @return the request-target (never {@code null})
     */
    String target();
    
    /**
     * Returns the request headers.
     * 
     * @return the request headers (never {@code null})
     */
    Headers headers();
    
    /**
     * Returns the request body.<p>
     * 
     * The adapter may implement this method lazily.
     * 
     * @return the request body (never {@code null}, may be empty)
     * 
     * @throws IOException if reading the body fails
     */
    byte[] body() throws IOException;
    
    /**
     * An {@code InboundRequest} with an already buffered body.
     * 
     * @param method  request method token
     * @param target  request-target
     * @param headers request headers
     * @param bytes   request body
     */
    record Buffered(String method, String target, Headers headers, byte[] bytes)
            implements InboundRequest
    {
        /**
         * Constructs a {@code Buffered}.
         * 
         * @param method  request method token
         * @param target  request-target
         * @param headers request headers
         * @param bytes   request body
         */
        public Buffered {
            requireNonNull(method);
            requireNonNull(target);
            requireNonNull(headers);
            requireNonNull(bytes);
        }
        
        @Override
        public byte[] body() {
            return bytes;
        }
    }
}
