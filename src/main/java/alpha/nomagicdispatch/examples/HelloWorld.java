package alpha.nomagicdispatch.examples;

import alpha.nomagicdispatch.Engine;

import java.io.IOException;

/**
 * Responds "Hello World!" for requests to "/hello".
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HelloWorld
{
    private HelloWorld() {
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
        Engine app = Engine.create();
        
        /*
         * A handler that writes the response ends the chain. There is no need
         * to call chain.proceed().
         */
        
        app.get("/hello", (req, res, chain) -> res.send("Hello World!"));
        
        app.listen(PORT);
        System.out.println("Listening on port " + PORT + ".");
    }
}
