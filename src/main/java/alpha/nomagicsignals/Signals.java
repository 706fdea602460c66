package alpha.nomagicsignals;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Is a namespace for the library version and factories of {@link
 * SignalListener}.<p>
 * 
 * Each call to a factory method returns a new listener instance. The
 * returned reference must be kept if the listener is to be removed later.
 */
public final class Signals
{
    private Signals() {
        // Empty
    }
    
    /**
     * The version of this library.
     */
    public static final String VERSION = "1.0.0";
    
    /**
     * Returns a listener that runs the given action.<p>
     * 
     * The context and arguments are ignored. The listener never halts the
     * dispatch.
     * 
     * @param action to run
     * @return a new listener
     * @throws NullPointerException if {@code action} is {@code null}
     */
    public static SignalListener running(Runnable action) {
        requireNonNull(action);
        return (ctx, args) -> {
            action.run();
            return null;
        };
    }
    
    /**
     * Returns a listener that passes the arguments to the given consumer.<p>
     * 
     * The context is ignored. The listener never halts the dispatch.
     * 
     * @param consumer of arguments
     * @return a new listener
     * @throws NullPointerException if {@code consumer} is {@code null}
     */
    public static SignalListener consuming(Consumer<? super Object[]> consumer) {
        requireNonNull(consumer);
        return (ctx, args) -> {
            consumer.accept(args);
            return null;
        };
    }
    
    /**
     * Returns a listener that passes the arguments to the given consumer and
     * then halts the dispatch.
     * 
     * @param consumer of arguments
     * @return a new listener
     * @throws NullPointerException if {@code consumer} is {@code null}
     */
    public static SignalListener consumingAndHalting(Consumer<? super Object[]> consumer) {
        requireNonNull(consumer);
        return (ctx, args) -> {
            consumer.accept(args);
            return Boolean.FALSE;
        };
    }
}
