package alpha.nomagicdispatch;

import alpha.nomagicdispatch.util.Modifiers;

import java.time.Duration;
import java.util.function.Consumer;

import static java.time.Duration.ofSeconds;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder  builder;
    private final boolean  accessLogging;
    private final Duration timeoutDispatch;
    private final int      maxRequestBodySize;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder            = b;
        accessLogging      = s.accessLogging;
        timeoutDispatch    = s.timeoutDispatch;
        maxRequestBodySize = s.maxRequestBodySize;
    }
    
    @Override
    public boolean accessLogging() {
        return accessLogging;
    }
    
    @Override
    public Duration timeoutDispatch() {
        return timeoutDispatch;
    }
    
    @Override
    public int maxRequestBodySize() {
        return maxRequestBodySize;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "accessLogging=" + accessLogging +
                ", timeoutDispatch=" + timeoutDispatch +
                ", maxRequestBodySize=" + maxRequestBodySize + "}";
    }
    
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder(Modifiers.none());
        
        static class MutableState {
            boolean  accessLogging      = true;
            Duration timeoutDispatch    = ofSeconds(90);
            int      maxRequestBodySize = 20_971_520;
        }
        
        private final Modifiers<MutableState> mods;
        
        private DefaultBuilder(Modifiers<MutableState> mods) {
            this.mods = mods;
        }
        
        private Builder with(Consumer<MutableState> mod) {
            return new DefaultBuilder(mods.then(mod));
        }
        
        @Override
        public Builder accessLogging(boolean newVal) {
            return with(s -> s.accessLogging = newVal);
        }
        
        @Override
        public Builder timeoutDispatch(Duration newVal) {
            requireNonNull(newVal);
            return with(s -> s.timeoutDispatch = newVal);
        }
        
        @Override
        public Builder maxRequestBodySize(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative: " + newVal);
            }
            return with(s -> s.maxRequestBodySize = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, mods.applyTo(MutableState::new));
        }
    }
}
