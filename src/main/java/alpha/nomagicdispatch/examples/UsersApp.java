package alpha.nomagicdispatch.examples;

import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.middleware.StaticFiles;
import alpha.nomagicdispatch.util.Json;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.TWO_HUNDRED_ONE;

/**
 * A small JSON API for users, with static files served from "./web".<p>
 * 
 * Try:
 * <pre>
 *   curl -i localhost:8080/users/7
 *   curl -i -H "Content-Type: application/json" -d '{"name":"Ada"}' localhost:8080/users
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class UsersApp
{
    private UsersApp() {
        // Intentionally empty
    }
    
    private static final int PORT = 8080;
    
    /**
     * Creates the application.<p>
     * 
     * The engine is not started.
     * 
     * @param web directory to serve static files from
     * @return the application
     */
    public static Engine create(Path web) {
        Engine app = Engine.create();
        
        app.use((req, res, chain) -> {
            System.out.println(req.method() + " " + req.path());
            chain.proceed();
        });
        
        // Proceeds if there is no file, so routes below take over
        app.use(StaticFiles.of(web));
        
        app.get("/users/:id", (req, res, chain) -> {
            String id = req.params().get("id");
            res.json(Map.of(
                "userId", id,
                "message", "Fetched user " + id));
        });
        
        app.post("/users", (req, res, chain) -> {
            var body = Json.object();
            body.put("message", "User created");
            if (req.body() instanceof Body.Json j) {
                body.set("user", j.value());
            } else {
                body.putNull("user");
            }
            res.status(TWO_HUNDRED_ONE).json(body);
        });
        
        app.onError((err, req, res, chain) -> {
            System.err.println(err);
            res.status(FIVE_HUNDRED).json(Map.of("error", "Something went wrong!"));
        });
        
        return app;
    }
    
    /**
     * Application entry point.
     * 
     * @param args ignored
     * 
     * @throws IOException If an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        create(Path.of("web")).listen(PORT);
        System.out.println("Listening on port " + PORT + ".");
    }
}
