package alpha.nomagicdispatch.adapter;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Headers;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static alpha.nomagicdispatch.HttpConstants.HeaderKey.CONTENT_TYPE;
import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.ENTITY_TOO_LARGE;
import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.SERVICE_UNAVAILABLE;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED_THREE;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_THIRTEEN;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * An adapter on top of the JDK's built-in {@code com.sun.net.httpserver}
 * server.<p>
 * 
 * The request body is read fully before the request is dispatched. A body
 * larger than {@link Config#maxRequestBodySize()} is rejected with
 * "413 Entity Too Large" and not dispatched.<p>
 * 
 * The exchange thread waits for the dispatch to complete for at most
 * {@link Config#timeoutDispatch()}, after which the client receives "503
 * Service Unavailable". Exchanges run on a cached thread pool owned by the
 * server.<p>
 * 
 * If the response has no Content-Type, one is derived from the body type;
 * "text/plain; charset=utf-8" for text, "application/json" for JSON and
 * "application/octet-stream" for bytes.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class JdkHttpServerAdapter implements Adapter
{
    private static final System.Logger LOG
            = System.getLogger(JdkHttpServerAdapter.class.getPackageName());
    
    @Override
    public Server start(Engine engine, int port) throws IOException {
        requireNonNull(engine);
        var http = HttpServer.create(new InetSocketAddress(port), 0);
        var exec = Executors.newCachedThreadPool();
        http.createContext("/", exch -> serve(engine, exch));
        http.setExecutor(exec);
        http.start();
        LOG.log(DEBUG, () -> "Listening on port " + http.getAddress().getPort());
        return new Running(http, exec);
    }
    
    private static void serve(Engine engine, HttpExchange exch) {
        final Config cfg = engine.config();
        try {
            byte[] body = readBody(exch.getRequestBody(), cfg.maxRequestBodySize());
            if (body == null) {
                writeFallback(exch, FOUR_HUNDRED_THIRTEEN, ENTITY_TOO_LARGE);
                return;
            }
            var in = InboundRequest.of(
                    exch.getRequestMethod(),
                    exch.getRequestURI().toString(),
                    Headers.copyOf(exch.getRequestHeaders()),
                    body);
            final Response res;
            try {
                res = engine.dispatch(in)
                            .toCompletableFuture()
                            .copy()
                            .orTimeout(cfg.timeoutDispatch().toNanos(), TimeUnit.NANOSECONDS)
                            .join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof TimeoutException) {
                    LOG.log(WARNING, () -> "Dispatch of " + in.method() + " " +
                            in.target() + " timed out after " + cfg.timeoutDispatch());
                    writeFallback(exch, FIVE_HUNDRED_THREE, SERVICE_UNAVAILABLE);
                } else {
                    LOG.log(ERROR, "Dispatch failed.", e);
                    writeFallback(exch, FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
                }
                return;
            }
            write(exch, res);
        } catch (IOException e) {
            LOG.log(DEBUG, () -> "Exchange failed: " + e);
        } catch (RuntimeException e) {
            LOG.log(ERROR, "Unexpected exchange failure.", e);
        } finally {
            exch.close();
        }
    }
    
    /**
     * Returns all bytes of the given stream, or {@code null} if there are more
     * than {@code max}.
     */
    private static byte[] readBody(InputStream in, int max) throws IOException {
        int limit = max == Integer.MAX_VALUE ? max : max + 1;
        byte[] b = in.readNBytes(limit);
        return b.length > max ? null : b;
    }
    
    private static void write(HttpExchange exch, Response res) throws IOException {
        var out = exch.getResponseHeaders();
        res.headers().forEach((k, vs) -> vs.forEach(v -> out.add(k, v)));
        Body b = res.body();
        if (!res.headers().contains(CONTENT_TYPE)) {
            String type = defaultContentType(b);
            if (type != null) {
                out.set(CONTENT_TYPE, type);
            }
        }
        send(exch, res.statusCode(), b.toBytes());
    }
    
    private static String defaultContentType(Body b) {
        if (b instanceof Body.Text) {
            return "text/plain; charset=utf-8";
        } else if (b instanceof Body.Json) {
            return "application/json";
        } else if (b instanceof Body.Bytes) {
            return "application/octet-stream";
        }
        return null;
    }
    
    private static void writeFallback(HttpExchange exch, int status, String text) throws IOException {
        exch.getResponseHeaders().set(CONTENT_TYPE, "text/plain; charset=utf-8");
        send(exch, status, text.getBytes(StandardCharsets.UTF_8));
    }
    
    private static void send(HttpExchange exch, int status, byte[] bytes) throws IOException {
        // -1 = no body
        exch.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exch.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
    
    private static final class Running implements Server {
        private final HttpServer http;
        private final ExecutorService exec;
        private final AtomicBoolean stopped;
        
        Running(HttpServer http, ExecutorService exec) {
            this.http    = http;
            this.exec    = exec;
            this.stopped = new AtomicBoolean();
        }
        
        @Override
        public int port() {
            return http.getAddress().getPort();
        }
        
        @Override
        public void stop() {
            if (stopped.compareAndSet(false, true)) {
                http.stop(0);
                exec.shutdownNow();
                LOG.log(DEBUG, "Server stopped.");
            }
        }
    }
}
