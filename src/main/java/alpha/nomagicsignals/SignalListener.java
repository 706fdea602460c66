package alpha.nomagicsignals;

/**
 * Receiver of a {@link Signal}'s dispatch.<p>
 * 
 * The identity of a listener is its object reference. A signal will never
 * call {@code equals()} on the listener. Lambdas and method references create
 * a new instance each time they are evaluated. This will add but fail to
 * remove:
 * <pre>
 *   Signal started = ...
 *   started.add((ctx, args) -> null);
 *   // Does nothing, different instance
 *   started.remove((ctx, args) -> null);
 * </pre>
 * 
 * Solution:
 * <pre>
 *   SignalListener l = (ctx, args) -> null;
 *   started.add(l);
 *   started.remove(l);
 * </pre>
 * 
 * The returned value is passed back to the signal. If the value is
 * {@link Boolean#FALSE}, then the signal stops the propagation of the current
 * dispatch; the remaining listeners with a lower priority will not be
 * invoked. Any other value, including {@code null}, lets the dispatch move
 * on.
 * 
 * @see Signals#running(Runnable)
 * @see Signals#consuming(java.util.function.Consumer)
 */
@FunctionalInterface
public interface SignalListener
{
    /**
     * Receive a dispatch.<p>
     * 
     * The {@code args} array is built anew for each invocation and may be
     * freely modified by the listener.
     * 
     * @param context as given when the listener was added (may be {@code null})
     * @param args curried parameters of the binding followed by the dispatched
     *             arguments (never {@code null}, may be empty)
     * 
     * @return {@code Boolean.FALSE} to halt, anything else to continue
     */
    Object onSignal(Object context, Object... args);
}
