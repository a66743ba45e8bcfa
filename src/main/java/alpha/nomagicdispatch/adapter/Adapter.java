package alpha.nomagicdispatch.adapter;

import alpha.nomagicdispatch.Engine;

import java.io.IOException;

/**
 * Translates a transport into engine requests, and engine responses back into
 * the transport.<p>
 * 
 * An adapter builds an {@link alpha.nomagicdispatch.message.InboundRequest}
 * for each request received, calls {@link Engine#dispatch}, and writes the
 * status, headers and body of the completed response. The engine never
 * touches a socket.<p>
 * 
 * The adapter used is selected by the application:
 * <pre>{@code
 *   Server s = app.listen(new JdkHttpServerAdapter(), 8080);
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Adapter
{
    /**
     * Starts serving the given engine.
     * 
     * @param engine to dispatch requests to
     * @param port   to listen on, 0 for a system-picked port
     * 
     * @return the running server
     * 
     * @throws NullPointerException if {@code engine} is {@code null}
     * @throws IOException if the port could not be bound
     */
    Server start(Engine engine, int port) throws IOException;
}
