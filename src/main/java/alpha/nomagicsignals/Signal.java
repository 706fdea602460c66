package alpha.nomagicsignals;

import java.util.ArrayList;
import java.util.List;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Broadcasts a dispatch to all attached listeners.<p>
 * 
 * A signal decouples the producer (who calls {@link #dispatch(Object...)})
 * from the consumers (listeners added through one of the {@code add} methods).
 * 
 * <pre>
 *   class Download {
 *       final Signal completed = new Signal();
 *       void finish(Path file) {
 *           this.doStuff();
 *           completed.dispatch(file);
 *       }
 *   }
 *   // somewhere else
 *   SignalListener log = (ctx, args) -> { System.out.println(args[0]); return null; };
 *   download.completed.add(log);
 * </pre>
 * 
 * <strong>Order.</strong> Listeners are invoked in order of their priority,
 * highest first. Listeners of the same priority are invoked in the order they
 * were added.<p>
 * 
 * <strong>Propagation.</strong> A listener may stop the current dispatch from
 * reaching the remaining listeners, either by returning {@link Boolean#FALSE}
 * or by calling {@link #halt()}.<p>
 * 
 * <strong>Identity.</strong> A listener can only be added once. Adding it
 * again returns the binding already present. Listeners are compared using
 * {@code ==}, see {@link SignalListener}.<p>
 * 
 * <strong>Memorize.</strong> A memorizing signal saves the arguments of the
 * last dispatch and immediately invokes new listeners with those arguments.
 * This is useful for a signal that is dispatched only once, like "application
 * started"; late listeners will still be notified.<p>
 * 
 * <strong>Reentrancy.</strong> Listeners are invoked synchronously by the
 * thread calling {@code dispatch}. A listener may add or remove listeners and
 * may even dispatch the same signal again. A listener added during a dispatch
 * is invoked from the next dispatch. A listener removed during a dispatch is
 * not invoked if its turn has not yet come.<p>
 * 
 * There is no special handling of exceptions. If a listener throws an
 * exception, then that exception propagates to the caller of {@code
 * dispatch}, and the remaining listeners will miss out on the dispatch.<p>
 * 
 * <strong>Dispose.</strong> A signal no longer needed may be {@linkplain
 * #dispose() disposed}, after which all methods except {@code dispose},
 * {@link #isDisposed()} and {@code toString} throw a {@link
 * SignalDisposedException}.<p>
 * 
 * This class is not thread-safe. A signal is expected to be used by one
 * thread, or to be safely published and guarded by the application.
 * 
 * @see CompoundSignal
 */
public class Signal
{
    private static final System.Logger LOG
            = System.getLogger(Signal.class.getPackageName());
    
    private static final Object[] NO_ARGS = {};
    
    // Execution order; priority descending, then insertion order
    private List<SignalBinding> bindings;
    private Object[] previousParams;
    private boolean active, memorize, propagating, disposed;
    
    /**
     * Constructs an active signal with no listeners.
     */
    public Signal() {
        bindings = new ArrayList<>();
        active = true;
        propagating = true;
    }
    
    /**
     * Add a listener.<p>
     * 
     * Same as {@code add(listener, null, 0)}.
     * 
     * @param listener to add
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code addOnce}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding add(SignalListener listener) {
        return add(listener, null, 0);
    }
    
    /**
     * Add a listener.<p>
     * 
     * Same as {@code add(listener, context, 0)}.
     * 
     * @param listener to add
     * @param context passed to the listener (may be {@code null})
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code addOnce}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding add(SignalListener listener, Object context) {
        return add(listener, context, 0);
    }
    
    /**
     * Add a listener.<p>
     * 
     * If the listener has already been added, the current binding is returned
     * and the given context and priority have no effect.<p>
     * 
     * If this signal {@linkplain #setMemorize(boolean) memorizes} and it has
     * been dispatched, then the listener is invoked with the saved arguments
     * before this method returns.
     * 
     * @param listener to add
     * @param context passed to the listener (may be {@code null})
     * @param priority greater executes earlier (default is 0)
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code addOnce}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding add(SignalListener listener, Object context, int priority) {
        requireListener(listener, "add");
        return register(listener, false, context, priority, null);
    }
    
    /**
     * Add a listener that is removed after being invoked once.<p>
     * 
     * Same as {@code addOnce(listener, null, 0)}.
     * 
     * @param listener to add
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code add}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding addOnce(SignalListener listener) {
        return addOnce(listener, null, 0);
    }
    
    /**
     * Add a listener that is removed after being invoked once.<p>
     * 
     * Same as {@code addOnce(listener, context, 0)}.
     * 
     * @param listener to add
     * @param context passed to the listener (may be {@code null})
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code add}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding addOnce(SignalListener listener, Object context) {
        return addOnce(listener, context, 0);
    }
    
    /**
     * Add a listener that is removed after being invoked once.<p>
     * 
     * Otherwise, this method behaves the same as {@link
     * #add(SignalListener, Object, int)}. A memorizing signal that has been
     * dispatched will therefore invoke and remove the listener before this
     * method returns.
     * 
     * @param listener to add
     * @param context passed to the listener (may be {@code null})
     * @param priority greater executes earlier (default is 0)
     * @return the binding
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws ConflictingOnceStateException
     *             if {@code listener} was already added using {@code add}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalBinding addOnce(SignalListener listener, Object context, int priority) {
        requireListener(listener, "addOnce");
        return register(listener, true, context, priority, null);
    }
    
    /**
     * Add a repeating listener with curried params.<p>
     * 
     * The params are set before a memorized dispatch is replayed to the
     * listener.
     * 
     * @param listener to add
     * @param params curried params
     * @return the binding
     */
    SignalBinding addCurried(SignalListener listener, Object... params) {
        requireListener(listener, "add");
        return register(listener, false, null, 0, params);
    }
    
    /**
     * Remove a listener.<p>
     * 
     * The binding of the listener will be detached permanently. This method
     * is NOP if the listener is not attached.
     * 
     * @param listener to remove
     * @return the given listener
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public SignalListener remove(SignalListener listener) {
        requireListener(listener, "remove");
        final int i = indexOf(listener);
        if (i != -1) {
            bindings.remove(i).destroy();
        }
        return listener;
    }
    
    /**
     * Remove all listeners.
     * 
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void removeAll() {
        requireNotDisposed();
        bindings.forEach(SignalBinding::destroy);
        bindings.clear();
    }
    
    /**
     * Returns {@code true} if the listener is attached, otherwise {@code false}.
     * 
     * @param listener to look for
     * @return {@code true} if the listener is attached, otherwise {@code false}
     * @throws InvalidListenerException if {@code listener} is {@code null}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean has(SignalListener listener) {
        requireListener(listener, "has");
        return indexOf(listener) != -1;
    }
    
    /**
     * Returns the number of attached listeners.
     * 
     * @return the number of attached listeners
     * @throws SignalDisposedException if this signal has been disposed
     */
    public int getNumListeners() {
        requireNotDisposed();
        return bindings.size();
    }
    
    /**
     * Stop the propagation of the current dispatch.<p>
     * 
     * Listeners not yet invoked will not be invoked. Meant to be called by a
     * listener during a dispatch. Calling this method outside of a dispatch
     * has no effect; the next dispatch will propagate as usual.
     * 
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void halt() {
        requireNotDisposed();
        propagating = false;
    }
    
    /**
     * Synchronously invoke the listeners with the given arguments.<p>
     * 
     * The method returns when all listeners have been invoked, or a listener
     * stopped the propagation. This method is NOP if the signal is not
     * {@linkplain #setActive(boolean) active}.
     * 
     * @param args to pass to the listeners (may be {@code null})
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void dispatch(Object... args) {
        requireNotDisposed();
        if (!active) {
            LOG.log(DEBUG, () -> "Dispatch ignored, " + this + " is not active.");
            return;
        }
        final Object[] params = args == null ? NO_ARGS : args.clone();
        final SignalBinding[] snapshot = bindings.toArray(SignalBinding[]::new);
        if (memorize) {
            previousParams = params;
        }
        // halt() may have been called before this dispatch
        propagating = true;
        for (SignalBinding b : snapshot) {
            if (!propagating || Boolean.FALSE.equals(b.execute(params))) {
                break;
            }
        }
    }
    
    /**
     * Forget the memorized arguments.<p>
     * 
     * Has no effect on attached listeners.
     * 
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void forget() {
        requireNotDisposed();
        previousParams = null;
    }
    
    /**
     * Remove all listeners and release all resources.<p>
     * 
     * The signal can not be used after this call. Disposing an already
     * disposed signal is NOP.
     */
    public void dispose() {
        if (disposed) {
            LOG.log(DEBUG, () -> this + " already disposed.");
            return;
        }
        removeAll();
        bindings = null;
        previousParams = null;
        disposed = true;
        LOG.log(DEBUG, () -> "Disposed " + getClass().getSimpleName() + ".");
    }
    
    /**
     * Returns {@code true} if this signal has been disposed.
     * 
     * @return {@code true} if this signal has been disposed
     */
    public boolean isDisposed() {
        return disposed;
    }
    
    /**
     * Returns {@code true} if dispatches are propagated to listeners.
     * 
     * @return {@code true} if dispatches are propagated to listeners
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean isActive() {
        requireNotDisposed();
        return active;
    }
    
    /**
     * Enable or disable dispatching.<p>
     * 
     * An inactive signal ignores all dispatches; nor will they be memorized.
     * By default, a signal is active.
     * 
     * @param active {@code false} to disable, {@code true} to enable
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void setActive(boolean active) {
        requireNotDisposed();
        this.active = active;
    }
    
    /**
     * Returns {@code true} if this signal memorizes the last dispatch.
     * 
     * @return {@code true} if this signal memorizes the last dispatch
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean isMemorize() {
        requireNotDisposed();
        return memorize;
    }
    
    /**
     * Enable or disable memorization of the last dispatch.<p>
     * 
     * Disabling memorization does not forget what has already been memorized,
     * but the arguments will not be replayed while disabled.
     * 
     * @param memorize {@code true} to enable
     * @throws SignalDisposedException if this signal has been disposed
     * @see #forget()
     */
    public void setMemorize(boolean memorize) {
        requireNotDisposed();
        this.memorize = memorize;
    }
    
    /**
     * Throws {@link SignalDisposedException} if this signal has been disposed.
     * 
     * @throws SignalDisposedException if this signal has been disposed
     */
    protected final void requireNotDisposed() {
        if (disposed) {
            throw new SignalDisposedException(getClass());
        }
    }
    
    private void requireListener(SignalListener listener, String operation) {
        requireNotDisposed();
        if (listener == null) {
            throw new InvalidListenerException(operation);
        }
    }
    
    private SignalBinding register(
            SignalListener listener, boolean once,
            Object context, int priority, Object[] params)
    {
        final SignalBinding b;
        final int i = indexOf(listener);
        if (i != -1) {
            b = bindings.get(i);
            if (b.isOnce() != once) {
                throw new ConflictingOnceStateException(once);
            }
        } else {
            b = new SignalBinding(this, listener, once, context, priority);
            if (params != null) {
                b.setParams(params);
            }
            insert(b);
        }
        if (memorize && previousParams != null) {
            b.execute(previousParams);
        }
        return b;
    }
    
    private void insert(SignalBinding b) {
        // After all of a priority greater than or equal to the new one
        int n = bindings.size();
        while (n > 0 && bindings.get(n - 1).getPriority() < b.getPriority()) {
            --n;
        }
        bindings.add(n, b);
    }
    
    private int indexOf(SignalListener listener) {
        for (int i = 0, n = bindings.size(); i < n; ++i) {
            if (bindings.get(i).getListener() == listener) {
                return i;
            }
        }
        return -1;
    }
    
    @Override
    public String toString() {
        if (disposed) {
            return getClass().getSimpleName() + "{disposed}";
        }
        return getClass().getSimpleName() + "{" +
                "active=" + active +
                ", numListeners=" + bindings.size() + "}";
    }
}
