package alpha.nomagicdispatch.examples;

import alpha.nomagicdispatch.Engine;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Mounts route groups under a path prefix.<p>
 * 
 * Each group is an engine of its own, registered and then copied into the
 * application. This example also shows a handler that writes its response
 * asynchronously.
 * 
 * <pre>
 *   curl localhost:8080/v1/ping
 *   curl localhost:8080/v2/ping
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ApiVersions
{
    private ApiVersions() {
        // Intentionally empty
    }
    
    private static final int PORT = 8080;
    
    /**
     * Application entry point.
     * 
     * @param args ignored
     * 
     * @throws IOException If an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        Engine v1 = Engine.create();
        v1.get("/ping", (req, res, chain) -> res.send("pong v1"));
        
        Engine v2 = Engine.create();
        v2.use((req, res, chain) -> {
            res.header("X-Api-Version", "2");
            chain.proceed();
        });
        
        /*
         * The handler returns before the response is written. The chain is
         * stalled until the handler calls chain.proceed(), which in this case
         * happens on another thread after the response was written, and so
         * ends the dispatch.
         */
        
        v2.get("/ping", (req, res, chain) ->
            CompletableFuture.runAsync(() -> {
                res.send("pong v2");
                chain.proceed();
            }));
        
        Engine app = Engine.create();
        app.mount("/v1", v1)
           .mount("/v2", v2);
        
        app.listen(PORT);
        System.out.println("Listening on port " + PORT + ".");
    }
}
