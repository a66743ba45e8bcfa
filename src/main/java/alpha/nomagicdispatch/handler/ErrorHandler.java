package alpha.nomagicdispatch.handler;

import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.Response;

/**
 * Translates an error signalled through {@link Chain#fail(Throwable)} into a
 * response.<p>
 * 
 * Error handlers are called in the same order they were registered, given
 * that their prefix filter matches the request path. The first error handler
 * to write the response stops the error handling. An error handler that does
 * not know what to do with the error should just return, which yields to the
 * next error handler.
 * 
 * <pre>{@code
 *   ErrorHandler forMyExpected = (error, req, res, chain) -> {
 *       if (error instanceof MyExpectedException e) {
 *           res.status(400).send(e.getMessage());
 *       }
 *       // Else, don't know what this is; next error handler
 *   };
 * }</pre>
 * 
 * If no error handler writes the response, the error is logged and the
 * client receives "500 Internal Server Error".<p>
 * 
 * Error handlers are not called if the response has already been written at
 * the time of the error. The error is then logged and ignored.<p>
 * 
 * The chain given to the error handler is inert. The error handler must
 * complete its job before returning.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an error.
     * 
     * @param error the error (never {@code null})
     * @param req   request (never {@code null})
     * @param res   response (never {@code null})
     * @param chain inert continuation (never {@code null})
     * 
     * @throws Exception if anything goes wrong
     */
    void handle(Throwable error, Request req, Response res, Chain chain) throws Exception;
}
