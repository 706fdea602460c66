package alpha.nomagicsignals;

/**
 * Thrown by all operations of a {@link Signal} that has been disposed, except
 * {@link Signal#dispose()} itself, {@link Signal#isDisposed()} and
 * {@code toString()}.
 * 
 * @see Signal#dispose()
 */
public final class SignalDisposedException extends IllegalStateException
{
    private static final long serialVersionUID = 1L;
    
    SignalDisposedException(Class<?> type) {
        super(type.getSimpleName() + " has been disposed.");
    }
}
