/**
 * Ready-made middleware, installed using
 * {@link alpha.nomagicdispatch.Engine#use(alpha.nomagicdispatch.handler.RequestHandler, alpha.nomagicdispatch.handler.RequestHandler...)}.
 */
package alpha.nomagicdispatch.middleware;
