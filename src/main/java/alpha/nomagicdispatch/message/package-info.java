/**
 * Request and response models of a dispatch.<p>
 * 
 * A {@link alpha.nomagicdispatch.message.InboundRequest} is what an adapter
 * hands to the engine. The engine turns it into a
 * {@link alpha.nomagicdispatch.message.Request}, which together with a
 * {@link alpha.nomagicdispatch.message.Response} is passed through the
 * handlers of one dispatch.
 */
package alpha.nomagicdispatch.message;
