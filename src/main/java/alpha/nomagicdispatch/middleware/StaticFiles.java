package alpha.nomagicdispatch.middleware;

import alpha.nomagicdispatch.handler.Chain;
import alpha.nomagicdispatch.handler.RequestHandler;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.Response;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import static alpha.nomagicdispatch.HttpConstants.Method.GET;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Serves files from a directory.<p>
 * 
 * The request path is resolved against the directory; "/css/site.css" is
 * served from {@code <directory>/css/site.css}. The path "/" is served from
 * the index file. Only {@code GET} requests are served.<p>
 * 
 * If the method is not {@code GET}, or the file does not exist, or the path
 * resolves to a location outside the directory, the middleware proceeds the
 * chain without touching the response. Therefore, routes registered on the
 * engine take over for anything that is not a file:
 * 
 * <pre>{@code
 *   app.use(StaticFiles.of(Path.of("public")));
 *   app.get("/api/users", ...);
 * }</pre>
 * 
 * The Content-Type of the response is derived from the file extension.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class StaticFiles implements RequestHandler
{
    private static final System.Logger LOG
            = System.getLogger(StaticFiles.class.getPackageName());
    
    /** Index file used if none is specified. */
    public static final String DEFAULT_INDEX = "index.html";
    
    /**
     * Creates a static file middleware using the index file
     * {@value DEFAULT_INDEX}.
     * 
     * @param directory to serve files from
     * @return a static file middleware
     * @throws NullPointerException if {@code directory} is {@code null}
     */
    public static StaticFiles of(Path directory) {
        return of(directory, DEFAULT_INDEX);
    }
    
    /**
     * Creates a static file middleware.<p>
     * 
     * A relative directory is resolved against the current working
     * directory.
     * 
     * @param directory to serve files from
     * @param indexFile file name served for "/"
     * @return a static file middleware
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalArgumentException if {@code indexFile} is blank
     */
    public static StaticFiles of(Path directory, String indexFile) {
        return new StaticFiles(directory, indexFile);
    }
    
    private final Path root;
    private final String indexFile;
    
    private StaticFiles(Path directory, String indexFile) {
        this.root = directory.toAbsolutePath().normalize();
        if (indexFile.isBlank()) {
            throw new IllegalArgumentException("Blank index file.");
        }
        this.indexFile = indexFile;
        LOG.log(INFO, () -> "Serving static files from: " + root);
    }
    
    @Override
    public void handle(Request req, Response res, Chain chain) {
        if (!GET.name().equals(req.method())) {
            chain.proceed();
            return;
        }
        Path file = resolve(req.path());
        if (file == null || !Files.isRegularFile(file)) {
            LOG.log(DEBUG, () -> "No file to serve for: " + req.path());
            chain.proceed();
            return;
        }
        try {
            res.sendFile(file);
        } catch (IOException e) {
            LOG.log(WARNING, "Failed to read file: " + file, e);
            chain.proceed();
        }
    }
    
    /**
     * Returns the file the given request path maps to.
     * 
     * @return the file, or {@code null} if the path escapes the directory
     */
    private Path resolve(String path) {
        String rel = path.equals("/") ? indexFile : path.substring(1);
        final Path p;
        try {
            p = root.resolve(rel).normalize();
        } catch (InvalidPathException e) {
            return null;
        }
        if (!p.startsWith(root) || p.equals(root)) {
            LOG.log(DEBUG, () -> "Refused path outside of directory: " + path);
            return null;
        }
        return p;
    }
    
    @Override
    public String toString() {
        return StaticFiles.class.getSimpleName() + "{root=" + root + ", indexFile=" + indexFile + "}";
    }
}
