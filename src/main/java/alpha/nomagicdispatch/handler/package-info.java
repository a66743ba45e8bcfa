/**
 * Handlers make things happen.<p>
 * 
 * A {@link alpha.nomagicdispatch.handler.RequestHandler RequestHandler}
 * processes a {@link alpha.nomagicdispatch.message.Request Request} and
 * either writes the {@link alpha.nomagicdispatch.message.Response Response},
 * or passes control to the next handler using the {@link
 * alpha.nomagicdispatch.handler.Chain Chain}. Request handlers are registered
 * as middleware, or added to a {@link alpha.nomagicdispatch.route.Route
 * Route}. An {@link alpha.nomagicdispatch.handler.ErrorHandler ErrorHandler}
 * handles errors signalled through the chain.
 */
package alpha.nomagicdispatch.handler;
