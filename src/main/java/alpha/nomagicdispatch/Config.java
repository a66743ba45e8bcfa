package alpha.nomagicdispatch;

import alpha.nomagicdispatch.adapter.JdkHttpServerAdapter;

import java.time.Duration;

/**
 * Engine configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * 
 * <pre>{@code
 *   Config c = Config.configuration()
 *                    .accessLogging(false)
 *                    .timeoutDispatch(Duration.ofSeconds(5))
 *                    .build();
 *   Engine app = Engine.create(c);
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Access logging = true <br>
     * Timeout dispatch = 90 seconds <br>
     * Max request body size = 20 971 520 (20 MiB)
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns whether the engine logs one line per completed dispatch.<p>
     * 
     * The line is logged on level {@code INFO} and contains the request
     * method, the request path and the final status code, e.g. "GET /users/7
     * 200".
     * 
     * @return whether the engine logs one line per completed dispatch
     */
    boolean accessLogging();
    
    /**
     * Returns the max duration an adapter waits for a dispatch to complete.<p>
     * 
     * The engine itself has no notion of time. The timeout is applied by
     * adapters, for example {@link JdkHttpServerAdapter}, which on expiry
     * responds {@value HttpConstants.StatusCode#FIVE_HUNDRED_THREE}.
     * 
     * @return the max duration an adapter waits for a dispatch to complete
     */
    Duration timeoutDispatch();
    
    /**
     * Returns the max number of request body bytes an adapter will read.<p>
     * 
     * A request with a bigger body is rejected by the adapter with status
     * {@value HttpConstants.StatusCode#FOUR_HUNDRED_THIRTEEN}, and the engine
     * is never called.
     * 
     * @return the max number of request body bytes an adapter will read
     */
    int maxRequestBodySize();
    
    /**
     * Returns the builder instance that built this configuration.<p>
     * 
     * The builder may be used for further modifications of the configuration.
     * 
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * Returns the builder used to build the default configuration.
     * 
     * @return the builder used to build the default configuration
     * @see #toBuilder()
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * Each method returns a new builder instance representing the new state.
     * The API should be used in a fluent style.<p>
     * 
     * The implementation is thread-safe.
     * 
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#accessLogging()
         */
        Builder accessLogging(boolean newVal);
        
        /**
         * Sets a new value.<p>
         * 
         * The value can be any duration, although a too short (or negative)
         * duration will make the adapter reject most requests.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#timeoutDispatch()
         */
        Builder timeoutDispatch(Duration newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#maxRequestBodySize()
         */
        Builder maxRequestBodySize(int newVal);
        
        /**
         * Builds a configuration object.
         * 
         * @return the configuration object
         */
        Config build();
    }
}
