package alpha.nomagicsignals;

/**
 * Thrown by {@link Signal} when an already added listener is added again, but
 * with a different once-flag.<p>
 * 
 * A listener may be repeating or one-shot, never both. The first binding has
 * to be removed before the listener can be added the other way.
 * 
 * @see Signal#add(SignalListener, Object, int)
 * @see Signal#addOnce(SignalListener, Object, int)
 */
public final class ConflictingOnceStateException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;
    
    ConflictingOnceStateException(boolean requestedOnce) {
        super("You cannot " + (requestedOnce ? "add" : "addOnce") +
              "() then " + (requestedOnce ? "addOnce" : "add") +
              "() the same listener without removing the relationship first.");
    }
}
