package alpha.nomagicdispatch.middleware;

import alpha.nomagicdispatch.handler.Chain;
import alpha.nomagicdispatch.handler.RequestHandler;
import alpha.nomagicdispatch.message.Body;
import alpha.nomagicdispatch.message.Request;
import alpha.nomagicdispatch.message.Response;
import alpha.nomagicdispatch.util.Modifiers;

import java.time.Clock;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Logs each request after the response is final.<p>
 * 
 * The middleware records the time, {@linkplain Chain#proceed() proceeds}, and
 * once the returned stage completes, writes a line to the sink:
 * 
 * <pre>
 *   2024-01-01T12:00:00.123Z GET /users/7 200 3ms
 * </pre>
 * 
 * Optionally followed by the request headers and the request body, one line
 * each, and optionally an empty line separating one entry from the next. The
 * status logged is the final one, including a 404 or 500 produced by the
 * engine. The response is never modified. A sink that throws an exception
 * does not affect the response; the exception is logged on level {@code
 * WARNING}.<p>
 * 
 * By default colors (ANSI escape codes), headers and body are all enabled,
 * the separator is disabled, and the sink logs each line on level {@code
 * INFO} using the {@code System.Logger} of this package.
 * 
 * <pre>{@code
 *   app.use(AccessLog.builder().colors(false).body(false).build());
 * }</pre>
 * 
 * Register the access log first, so that it observes all handlers.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class AccessLog implements RequestHandler
{
    private static final System.Logger LOG
            = System.getLogger(AccessLog.class.getPackageName());
    
    private static final String
            RESET  = "\u001B[0m",
            BRIGHT = "\u001B[1m",
            DIM    = "\u001B[2m",
            RED    = "\u001B[31m",
            GREEN  = "\u001B[32m",
            YELLOW = "\u001B[33m",
            CYAN   = "\u001B[36m",
            WHITE  = "\u001B[37m",
            GRAY   = "\u001B[90m";
    
    /**
     * Returns an access log with default options.
     * 
     * @return an access log with default options
     */
    public static AccessLog create() {
        return builder().build();
    }
    
    /**
     * Returns a builder of an access log.
     * 
     * @return a builder of an access log
     */
    public static Builder builder() {
        return Builder.ROOT;
    }
    
    private final boolean colors, headers, body, separator;
    private final Consumer<String> sink;
    private final Clock clock;
    
    private AccessLog(Builder.MutableState s) {
        colors    = s.colors;
        headers   = s.headers;
        body      = s.body;
        separator = s.separator;
        sink      = s.sink;
        clock     = s.clock;
    }
    
    @Override
    public void handle(Request req, Response res, Chain chain) {
        final long start = System.nanoTime();
        chain.proceed().whenComplete((nil, thr) -> {
            try {
                log(req, res, NANOSECONDS.toMillis(System.nanoTime() - start));
            } catch (RuntimeException e) {
                LOG.log(WARNING, "Access log sink failed.", e);
            }
        });
    }
    
    private void log(Request req, Response res, long millis) {
        final int status = res.statusCode();
        if (colors) {
            sink.accept(clock.instant() + " " +
                    BRIGHT + req.method() + RESET + " " + req.path() + " " +
                    statusColor(status) + status + RESET + " " +
                    GRAY + millis + "ms" + RESET);
        } else {
            sink.accept(clock.instant() + " " +
                    req.method() + " " + req.path() + " " + status + " " + millis + "ms");
        }
        if (headers && !req.headers().isEmpty()) {
            sink.accept(dim("Headers:"));
            req.headers().forEach((k, vs) ->
                sink.accept("  " + dim(k + ":") + " " + String.join(", ", vs)));
        }
        if (body && !req.body().isEmpty()) {
            sink.accept(dim("Body:"));
            sink.accept("  " + format(req.body()));
        }
        if (separator) {
            sink.accept("");
        }
    }
    
    private String dim(String s) {
        return colors ? DIM + s + RESET : s;
    }
    
    private static String format(Body b) {
        if (b instanceof Body.Json j) {
            return j.value().toPrettyString();
        } else if (b instanceof Body.Text t) {
            return t.value();
        } else {
            return "[" + b.toBytes().length + " bytes]";
        }
    }
    
    private static String statusColor(int status) {
        if (status >= 500) {
            return RED;
        } else if (status >= 400) {
            return YELLOW;
        } else if (status >= 300) {
            return CYAN;
        } else if (status >= 200) {
            return GREEN;
        }
        return WHITE;
    }
    
    /**
     * An immutable builder of {@link AccessLog}.<p>
     * 
     * Each setter returns a new builder instance.
     */
    public static final class Builder
    {
        static final Builder ROOT = new Builder(Modifiers.none());
        
        static class MutableState {
            boolean colors  = true,
                    headers = true,
                    body    = true,
                    separator;
            Consumer<String> sink = line -> LOG.log(INFO, line);
            Clock clock = Clock.systemUTC();
        }
        
        private final Modifiers<MutableState> mods;
        
        private Builder(Modifiers<MutableState> mods) {
            this.mods = mods;
        }
        
        private Builder with(Consumer<MutableState> mod) {
            return new Builder(mods.then(mod));
        }
        
        /**
         * Sets whether lines contain ANSI color codes.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder colors(boolean newVal) {
            return with(s -> s.colors = newVal);
        }
        
        /**
         * Sets whether request headers are logged.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder headers(boolean newVal) {
            return with(s -> s.headers = newVal);
        }
        
        /**
         * Sets whether the request body is logged.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder body(boolean newVal) {
            return with(s -> s.body = newVal);
        }
        
        /**
         * Sets whether each entry is followed by an empty line.
         * 
         * @param newVal new value
         * @return a new builder
         */
        public Builder separator(boolean newVal) {
            return with(s -> s.separator = newVal);
        }
        
        /**
         * Sets the receiver of log lines.
         * 
         * @param newVal new value
         * @return a new builder
         * @throws NullPointerException if {@code newVal} is {@code null}
         */
        public Builder sink(Consumer<String> newVal) {
            requireNonNull(newVal);
            return with(s -> s.sink = newVal);
        }
        
        /**
         * Sets the clock used for timestamps.
         * 
         * @param newVal new value
         * @return a new builder
         * @throws NullPointerException if {@code newVal} is {@code null}
         */
        public Builder clock(Clock newVal) {
            requireNonNull(newVal);
            return with(s -> s.clock = newVal);
        }
        
        /**
         * Builds the access log.
         * 
         * @return an access log
         */
        public AccessLog build() {
            return new AccessLog(mods.applyTo(MutableState::new));
        }
    }
}
