package alpha.nomagicdispatch.message;

import alpha.nomagicdispatch.HttpConstants.StatusCode;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * An outbound HTTP response, mutated by handlers.<p>
 * 
 * One instance is created per dispatch with status code {@value
 * StatusCode#TWO_HUNDRED}, no headers and an {@linkplain Body#empty() empty}
 * body.<p>
 * 
 * The first handler to <i>write</i> the response wins. Writing means calling
 * any one of the methods {@code send}, {@code json}, {@code sendFile}, {@code
 * redirect} or {@code end}. As soon as the response has been written, the
 * engine stops advancing the handler chain; no more middleware or route
 * handlers will execute. Setting the status code or a header does not write
 * the response.
 * 
 * <pre>{@code
 *   app.post("/users", (req, res, chain) ->
 *       res.status(201).json(Map.of("created", true)));
 * }</pre>
 * 
 * The implementation is not thread-safe, but safe to hand over between the
 * threads running the handlers of a dispatch.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Response
{
    /**
     * Returns the status code.
     * 
     * @return the status code
     */
    int statusCode();
    
    /**
     * Sets the status code.
     * 
     * @param code new status code
     * @return this (for chaining/fluency)
     * @throws IllegalArgumentException if {@code code} is not in the range 100 to 999
     */
    Response status(int code);
    
    /**
     * Returns the response headers.
     * 
     * @return the response headers (mutable, never {@code null})
     */
    Headers headers();
    
    /**
     * Sets a header, replacing any previous values.
     * 
     * @param name of header
     * @param value of header
     * @return this (for chaining/fluency)
     */
    Response header(String name, String value);
    
    /**
     * Returns the body.
     * 
     * @return the body (never {@code null})
     */
    Body body();
    
    /**
     * Sets a text body and writes the response.<p>
     * 
     * The {@code Content-Type} header is left untouched. Adapters will
     * default to "text/plain; charset=utf-8".
     * 
     * @param text content
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code text} is {@code null}
     */
    Response send(String text);
    
    /**
     * Sets a body and writes the response.
     * 
     * @param body content
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code body} is {@code null}
     */
    Response send(Body body);
    
    /**
     * Converts the given object to JSON, sets it as body, sets the {@code
     * Content-Type} to "application/json" and writes the response.
     * 
     * @param data to convert (may be {@code null}, which is JSON null)
     * @return this (for chaining/fluency)
     * @throws IllegalArgumentException if the data can not be converted
     */
    Response json(Object data);
    
    /**
     * Sets the status code to {@value StatusCode#THREE_HUNDRED_TWO}, the
     * {@code Location} header to the given URL and writes the response.
     * 
     * @param url target
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code url} is {@code null}
     */
    Response redirect(String url);
    
    /**
     * Sets the status code, the {@code Location} header and writes the
     * response.
     * 
     * @param status code
     * @param url target
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code url} is {@code null}
     * @throws IllegalArgumentException if {@code status} is not in the range 100 to 999
     */
    Response redirect(int status, String url);
    
    /**
     * Reads the given file into a binary body, sets the {@code Content-Type}
     * derived from the file extension and writes the response.<p>
     * 
     * If the file can not be read, the response is left untouched and the
     * exception is propagated.
     * 
     * @param file to send
     * @return this (for chaining/fluency)
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if an I/O error occurs
     */
    Response sendFile(Path file) throws IOException;
    
    /**
     * Writes the response without changing the body.
     * 
     * @return this (for chaining/fluency)
     */
    Response end();
    
    /**
     * Returns {@code true} if the response has been written.
     * 
     * @return {@code true} if the response has been written
     */
    boolean isWritten();
}
