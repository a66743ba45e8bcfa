package alpha.nomagicdispatch.util;

import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered list of modifications to a mutable state container.<p>
 * 
 * This is the backbone of the library's immutable builders. A builder holds a
 * {@code Modifiers} instance, each setter returns a new builder holding the
 * list extended with one more modification, and the {@code build} method
 * replays all modifications against a new state container:
 * 
 * <pre>{@code
 *   Builder timeout(Duration v) {
 *       return new Builder(mods.then(s -> s.timeout = v));
 *   }
 *   Config build() {
 *       return new DefaultConfig(this, mods.applyTo(State::new));
 *   }
 * }</pre>
 * 
 * Extending a list never affects the list it was extended from. A builder can
 * therefore be branched off from any number of times.
 * 
 * @param <S> type of mutable state container
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Modifiers<S>
{
    private static final Modifiers<?> NONE = new Modifiers<>(null, null, 0);
    
    /**
     * Returns the empty list.
     * 
     * @param <S> type of mutable state container
     * @return the empty list
     */
    @SuppressWarnings("unchecked")
    public static <S> Modifiers<S> none() {
        return (Modifiers<S>) NONE;
    }
    
    private final Modifiers<S> prev;
    private final Consumer<? super S> mod;
    private final int size;
    
    private Modifiers(Modifiers<S> prev, Consumer<? super S> mod, int size) {
        this.prev = prev;
        this.mod  = mod;
        this.size = size;
    }
    
    /**
     * Returns a new list with the given modification appended.
     * 
     * @param mod modification
     * @return a new list
     * @throws NullPointerException if {@code mod} is {@code null}
     */
    public Modifiers<S> then(Consumer<? super S> mod) {
        return new Modifiers<>(this, requireNonNull(mod), size + 1);
    }
    
    /**
     * Returns the number of modifications.
     * 
     * @return the number of modifications
     */
    public int size() {
        return size;
    }
    
    /**
     * Creates a state container and applies all modifications to it, in the
     * order they were appended.
     * 
     * @param factory of state
     * @return the modified state
     * @throws NullPointerException if the factory returns {@code null}
     */
    @SuppressWarnings("unchecked")
    public S applyTo(Supplier<? extends S> factory) {
        Consumer<? super S>[] ordered = new Consumer[size];
        int i = size;
        for (var m = this; m.mod != null; m = m.prev) {
            ordered[--i] = m.mod;
        }
        S s = requireNonNull(factory.get());
        for (Consumer<? super S> c : ordered) {
            c.accept(s);
        }
        return s;
    }
}
