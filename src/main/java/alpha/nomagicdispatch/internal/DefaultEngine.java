package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.Config;
import alpha.nomagicdispatch.Engine;
import alpha.nomagicdispatch.HttpConstants.Method;
import alpha.nomagicdispatch.handler.ErrorHandler;
import alpha.nomagicdispatch.handler.RequestHandler;
import alpha.nomagicdispatch.message.InboundRequest;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.route.Route;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * The default implementation of {@code Engine}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultEngine implements Engine
{
    private static final System.Logger LOG
            = System.getLogger(DefaultEngine.class.getPackageName());
    
    private final Config config;
    private final Registry reg;
    private volatile boolean frozen;
    
    /**
     * Initializes this object.
     * 
     * @param config of engine
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultEngine(Config config) {
        this.config = requireNonNull(config);
        this.reg    = new Registry();
    }
    
    @Override
    public Engine route(Method method, String pattern, RequestHandler first, RequestHandler... more) {
        var r = Route.of(method, pattern, first, more);
        requireMutable();
        reg.addRoute(r);
        return this;
    }
    
    @Override
    public Engine add(Route route) {
        requireNonNull(route);
        requireMutable();
        reg.addRoute(route);
        return this;
    }
    
    @Override
    public Engine use(String prefix, RequestHandler first, RequestHandler... more) {
        requireValidFilter(prefix);
        requireMutable();
        forEach(first, more, h -> reg.addMiddleware(prefix, h));
        return this;
    }
    
    @Override
    public Engine onError(String prefix, ErrorHandler first, ErrorHandler... more) {
        requireValidFilter(prefix);
        requireMutable();
        forEach(first, more, h -> reg.addErrorHandler(prefix, h));
        return this;
    }
    
    @Override
    public Engine mount(String prefix, Engine child) {
        requireNonNull(prefix);
        requireNonNull(child);
        if (!prefix.startsWith("/") || (prefix.length() > 1 && prefix.endsWith("/"))) {
            throw new IllegalArgumentException(
                "Mount prefix must start with \"/\" and not end with \"/\": " + prefix);
        }
        if (child == this) {
            throw new IllegalArgumentException("Can not mount self.");
        }
        if (!(child instanceof DefaultEngine de)) {
            throw new IllegalArgumentException(
                "Unknown implementation: " + child.getClass().getName());
        }
        requireMutable();
        de.reg.copyInto(prefix, reg);
        return this;
    }
    
    @Override
    public List<Route> routes() {
        return reg.routes();
    }
    
    @Override
    public CompletionStage<Response> dispatch(InboundRequest request) {
        requireNonNull(request);
        frozen = true;
        final var res = new DefaultResponse();
        final DefaultRequest req;
        try {
            req = DefaultRequest.of(request);
        } catch (IOException | RuntimeException e) {
            LOG.log(ERROR, "Failed to read the inbound request, responding " +
                    FIVE_HUNDRED + ".", e);
            res.replace(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
            return completedStage(res);
        }
        return new InvocationChain(reg, req, res).execute().<Response>thenApply(nil -> {
            if (config.accessLogging()) {
                LOG.log(INFO, () -> req.method() + " " + req.path() + " " + res.statusCode());
            }
            return res;
        });
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    private void requireMutable() {
        if (frozen) {
            throw new IllegalStateException(
                "Engine has dispatched a request and can no longer be modified.");
        }
    }
    
    private static void requireValidFilter(String prefix) {
        requireNonNull(prefix);
        if (!prefix.equals(Registry.ALL) && !prefix.startsWith("/")) {
            throw new IllegalArgumentException(
                "Prefix must be \"" + Registry.ALL + "\" or start with \"/\": " + prefix);
        }
    }
    
    private static <H> void forEach(H first, H[] more, Consumer<? super H> action) {
        requireNonNull(first);
        for (H h : more) {
            requireNonNull(h);
        }
        action.accept(first);
        for (H h : more) {
            action.accept(h);
        }
    }
    
    @Override
    public String toString() {
        return DefaultEngine.class.getSimpleName() + "{routes=" + reg.routes() + "}";
    }
}
