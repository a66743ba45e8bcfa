package alpha.nomagicdispatch.internal;

import alpha.nomagicdispatch.handler.Chain;
import alpha.nomagicdispatch.handler.ErrorHandler;
import alpha.nomagicdispatch.handler.RequestHandler;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.nomagicdispatch.HttpConstants.ReasonPhrase.NOT_FOUND;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicdispatch.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;

/**
 * Represents a work flow of executing middleware, finding a route, executing
 * the route's handlers and, on failure, executing error handlers. These
 * entities co-operate to write the response of one dispatch.<p>
 * 
 * The entry point is {@link #execute()}, which returns a stage that completes
 * when the response is final. The stage always completes normally. An
 * unwritten response is replaced with "404 Not Found", an error that no error
 * handler wrote a response for and an exception that escaped a handler are
 * both replaced with "500 Internal Server Error".<p>
 * 
 * Handlers execute one at a time. A handler is executed only after the
 * previous handler has both returned and called its {@link Chain}; which may
 * happen on a different thread. All state transitions go through an atomic
 * variable, which also publishes the effects of one handler to the next.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class InvocationChain
{
    private static final System.Logger LOG
            = System.getLogger(InvocationChain.class.getPackageName());
    
    private static final CompletionStage<Void> COMPLETED = completedStage(null);
    
    private static final Chain INERT = new Chain() {
        @Override
        public CompletionStage<Void> proceed() {
            return COMPLETED;
        }
        
        @Override
        public void fail(Throwable error) {
            requireNonNull(error);
        }
        
        @Override
        public void abort() {
            // Empty
        }
    };
    
    // Signals given through the chain; a Throwable means fail
    private static final Object PROCEED = "proceed", ABORT = "abort";
    
    private final Registry reg;
    private final DefaultRequest req;
    private final DefaultResponse res;
    private final CompletableFuture<Void> done;
    private final CompletionStage<Void> doneView;
    // Only accessed by the thread advancing the chain
    private Iterator<RequestHandler> handlers;
    private boolean routeResolved;
    
    InvocationChain(Registry reg, DefaultRequest req, DefaultResponse res) {
        assert reg != null;
        assert req != null;
        assert res != null;
        this.reg      = reg;
        this.req      = req;
        this.res      = res;
        this.done     = new CompletableFuture<>();
        this.doneView = done.minimalCompletionStage();
    }
    
    /**
     * First execute middleware, then look up and execute a route.
     * 
     * @return a stage that completes when the response is final
     */
    CompletionStage<Void> execute() {
        handlers = reg.middleware(req.path()).iterator();
        advance();
        return doneView;
    }
    
    private void advance() {
        if (res.isWritten()) {
            LOG.log(DEBUG, "Response written, chain complete.");
            finish();
            return;
        }
        var h = nextHandler();
        if (h == null) {
            finish();
        } else {
            new Step(h).invoke();
        }
    }
    
    private RequestHandler nextHandler() {
        if (handlers.hasNext()) {
            return handlers.next();
        }
        if (routeResolved) {
            return null;
        }
        routeResolved = true;
        var m = reg.lookup(req.method(), req.path());
        if (m == null) {
            LOG.log(DEBUG, () -> "No route found for " + req.method() + " " + req.path());
            return null;
        }
        LOG.log(DEBUG, () -> "Matched route: " + m.route());
        req.bindParams(m.result().parameters());
        handlers = m.route().handlers().iterator();
        return handlers.next();
    }
    
    private void handleError(Throwable error) {
        if (res.isWritten()) {
            LOG.log(WARNING,
                "Handler failed after the response was written. This error is ignored.", error);
            finish();
            return;
        }
        LOG.log(DEBUG, () -> "Entering error handling: " + error);
        for (ErrorHandler eh : reg.errorHandlers(req.path())) {
            try {
                eh.handle(error, req, res, INERT);
            } catch (Throwable t) {
                if (t != error) {
                    t.addSuppressed(error);
                }
                escaped(t);
                return;
            }
            if (res.isWritten()) {
                finish();
                return;
            }
        }
        LOG.log(ERROR, "No error handler wrote a response, responding " +
                FIVE_HUNDRED + ".", error);
        res.replace(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
        done.complete(null);
    }
    
    private void escaped(Throwable t) {
        LOG.log(ERROR, "Exception escaped the invocation chain, responding " +
                FIVE_HUNDRED + ".", t);
        res.replace(FIVE_HUNDRED, INTERNAL_SERVER_ERROR);
        done.complete(null);
    }
    
    private void finish() {
        if (!res.isWritten()) {
            res.replace(FOUR_HUNDRED_FOUR, NOT_FOUND);
        }
        done.complete(null);
    }
    
    // Status of a handler invocation;
    //     both implicit- and explicit completion required for continuation
    private static final int
            AWAITING_BOTH = 0,
            AWAITING_EXPL = 1,
            AWAITING_IMPL = 2,
            AWAITING_NONE = 3;
    
    private final class Step implements Chain {
        private final RequestHandler handler;
        private final AtomicInteger status;
        private final AtomicReference<Object> signal;
        
        Step(RequestHandler handler) {
            this.handler = handler;
            this.status  = new AtomicInteger(AWAITING_BOTH);
            this.signal  = new AtomicReference<>();
        }
        
        void invoke() {
            try {
                handler.handle(req, res, this);
            } catch (Throwable t) {
                if (status.getAndSet(AWAITING_NONE) != AWAITING_NONE) {
                    if (signal.get() instanceof Throwable e && e != t) {
                        t.addSuppressed(e);
                    }
                    escaped(t);
                } else {
                    LOG.log(WARNING,
                        "Handler returned exceptionally, but the chain already completed. " +
                        "This error is ignored.", t);
                }
                return;
            }
            final boolean written = res.isWritten();
            int old = status.getAndUpdate(v -> switch (v) {
                case AWAITING_BOTH -> written ? AWAITING_NONE : AWAITING_EXPL;
                case AWAITING_IMPL, AWAITING_NONE -> AWAITING_NONE;
                default -> throw new AssertionError("Unexpected: " + v);
            });
            if (old == AWAITING_IMPL) {
                act();
            } else if (old == AWAITING_BOTH && written) {
                // Will finish
                advance();
            }
        }
        
        @Override
        public CompletionStage<Void> proceed() {
            explicit(PROCEED);
            return doneView;
        }
        
        @Override
        public void fail(Throwable error) {
            explicit(requireNonNull(error));
        }
        
        @Override
        public void abort() {
            explicit(ABORT);
        }
        
        private void explicit(Object sig) {
            if (!signal.compareAndSet(null, sig)) {
                LOG.log(DEBUG, "Chain already called, this call is ignored.");
                return;
            }
            int old = status.getAndUpdate(v -> switch (v) {
                case AWAITING_BOTH -> AWAITING_IMPL;
                case AWAITING_EXPL, AWAITING_NONE -> AWAITING_NONE;
                default -> throw new AssertionError("Unexpected: " + v);
            });
            if (old == AWAITING_EXPL) {
                act();
            } else if (old == AWAITING_NONE && sig instanceof Throwable t) {
                LOG.log(WARNING,
                    "Chain failed, but the handler's invocation already completed. " +
                    "This error is ignored.", t);
            }
        }
        
        private void act() {
            Object s = signal.get();
            if (s == PROCEED) {
                advance();
            } else if (s == ABORT) {
                LOG.log(DEBUG, () -> "Chain aborted by " + handler);
                finish();
            } else {
                handleError((Throwable) s);
            }
        }
    }
}
