package alpha.nomagicdispatch.handler;

import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.Response;

/**
 * Processes a request. Used both as middleware and as route handlers.<p>
 * 
 * A handler either writes the response, or passes control to the next handler
 * by calling {@link Chain#proceed()}, or signals an error by calling {@link
 * Chain#fail(Throwable)}.
 * 
 * <pre>{@code
 *   RequestHandler requireToken = (req, res, chain) -> {
 *       if (req.headers().contains("X-Token")) {
 *           chain.proceed();
 *       } else {
 *           chain.fail(new SecurityException("No token"));
 *       }
 *   };
 * }</pre>
 * 
 * Exceptions thrown by a handler are <i>not</i> delivered to the error
 * handlers. They escape the chain and the engine converts them into a "500
 * Internal Server Error" response. Expected errors should be signalled using
 * {@link Chain#fail(Throwable)}.<p>
 * 
 * The handler must be thread-safe, as it may be called concurrently by
 * different dispatches.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * Processes a request.
     * 
     * @param req   request (never {@code null})
     * @param res   response (never {@code null})
     * @param chain continuation (never {@code null})
     * 
     * @throws Exception if anything goes wrong
     */
    void handle(Request req, Response res, Chain chain) throws Exception;
}
