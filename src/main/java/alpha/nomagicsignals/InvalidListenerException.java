package alpha.nomagicsignals;

/**
 * Thrown by {@link Signal} if an operation that requires a listener was given
 * {@code null}.
 */
public final class InvalidListenerException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;
    
    InvalidListenerException(String operation) {
        super("listener is a required param of " + operation + "().");
    }
}
