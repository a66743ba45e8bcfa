/**
 * Home of the {@code Engine}.<p>
 * 
 * <strong>Architectural Overview</strong>. The {@link
 * alpha.nomagicdispatch.Engine Engine} is a registry of middleware, {@link
 * alpha.nomagicdispatch.route.Route Route}s and error handlers. For each
 * dispatched request, middleware and route handlers are called one after the
 * other, each passing control to the next through a {@link
 * alpha.nomagicdispatch.handler.Chain Chain}, until one of them writes the
 * {@link alpha.nomagicdispatch.message.Response Response}.<p>
 * 
 * The engine does no I/O. Requests are received and responses written by an
 * {@link alpha.nomagicdispatch.adapter.Adapter Adapter}.<p>
 * 
 * <strong>Examples</strong>. See package {@link alpha.nomagicdispatch.examples}.
 */
package alpha.nomagicdispatch;
