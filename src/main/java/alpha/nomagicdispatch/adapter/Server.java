package alpha.nomagicdispatch.adapter;

/**
 * A running server, as returned by {@link Adapter#start}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Server extends AutoCloseable
{
    /**
     * Returns the port the server listens on.
     * 
     * @return the port the server listens on
     */
    int port();
    
    /**
     * Stops the server.<p>
     * 
     * Exchanges in progress are closed immediately. Calling this method more
     * than once has no effect.
     */
    void stop();
    
    /**
     * Same as {@link #stop()}.
     */
    @Override
    default void close() {
        stop();
    }
}
