package alpha.nomagicsignals;

import static java.util.Objects.requireNonNull;

/**
 * A listener attached to a {@link Signal}.<p>
 * 
 * A binding is created and returned by the {@code add} methods of the signal
 * and is owned by the signal. It can be used to configure how the listener is
 * invoked ({@link #setActive(boolean)}, {@link #setParams(Object...)}) and
 * to detach the listener without a reference to the signal.<p>
 * 
 * Once detached, the binding is permanently unbound. It no longer references
 * neither the signal nor the listener, and a new binding must be created in
 * order to attach the listener again.<p>
 * 
 * Same as the signal, this class is not thread-safe.
 */
public final class SignalBinding
{
    private static final Object[] NO_ARGS = {};
    
    private final boolean once;
    private final int priority;
    private Signal signal;
    private SignalListener listener;
    private Object context;
    private boolean active;
    private Object[] params;
    
    SignalBinding(
            Signal signal, SignalListener listener,
            boolean once, Object context, int priority)
    {
        this.signal   = requireNonNull(signal);
        this.listener = requireNonNull(listener);
        this.once     = once;
        this.context  = context;
        this.priority = priority;
        this.active   = true;
    }
    
    /**
     * Invoke the listener, if this binding is active and bound.<p>
     * 
     * The listener receives the context of this binding and an argument array
     * consisting of the curried {@linkplain #setParams(Object...) params}
     * followed by the given arguments.<p>
     * 
     * A one-shot binding detaches itself after the listener returns. If the
     * listener throws an exception, the exception propagates and the binding
     * remains attached.
     * 
     * @param args to pass along (may be {@code null})
     * 
     * @return what the listener returned, or
     *         {@code null} if the listener was not invoked
     */
    public Object execute(Object... args) {
        if (!active || listener == null) {
            return null;
        }
        final Object r = listener.onSignal(context, effectiveArgs(args));
        if (once) {
            detach();
        }
        return r;
    }
    
    /**
     * Detach the listener from the signal.<p>
     * 
     * Semantically equivalent to {@code getSignal().remove(getListener())}.
     * This method is NOP if the binding has already been detached.
     * 
     * @return the detached listener, or
     *         {@code null} if the binding was not bound
     */
    public SignalListener detach() {
        return isBound() ? signal.remove(listener) : null;
    }
    
    /**
     * Returns {@code true} if this binding is attached to a signal, otherwise
     * {@code false}.
     * 
     * @return {@code true} if this binding is attached to a signal,
     *         otherwise {@code false}
     */
    public boolean isBound() {
        return signal != null && listener != null;
    }
    
    /**
     * Returns {@code true} if the listener is only executed once.
     * 
     * @return {@code true} if the listener is only executed once
     */
    public boolean isOnce() {
        return once;
    }
    
    /**
     * Returns the listener.
     * 
     * @return the listener, or {@code null} if detached
     */
    public SignalListener getListener() {
        return listener;
    }
    
    /**
     * Returns the signal.
     * 
     * @return the signal, or {@code null} if detached
     */
    public Signal getSignal() {
        return signal;
    }
    
    /**
     * Returns the context passed to the listener.
     * 
     * @return the context (may be {@code null})
     */
    public Object getContext() {
        return context;
    }
    
    /**
     * Returns the priority.<p>
     * 
     * A greater value executes earlier. The default is 0.
     * 
     * @return the priority
     */
    public int getPriority() {
        return priority;
    }
    
    /**
     * Returns {@code true} if the listener will be invoked on dispatch.
     * 
     * @return {@code true} if the listener will be invoked on dispatch
     */
    public boolean isActive() {
        return active;
    }
    
    /**
     * Pause or resume the binding.<p>
     * 
     * An inactive binding remains attached to the signal, but the listener is
     * not invoked.
     * 
     * @param active {@code false} to pause, {@code true} to resume
     */
    public void setActive(boolean active) {
        this.active = active;
    }
    
    /**
     * Returns a copy of the curried params.
     * 
     * @return a copy of the curried params (may be {@code null})
     */
    public Object[] getParams() {
        return params == null ? null : params.clone();
    }
    
    /**
     * Set params to be passed to the listener, ahead of the dispatched
     * arguments.<p>
     * 
     * For example, if params are {@code [1, 2]} and the signal dispatch
     * {@code "x"}, then the listener receives {@code [1, 2, "x"]}.
     * 
     * @param params to prepend (may be {@code null}, removes the params)
     */
    public void setParams(Object... params) {
        this.params = params == null ? null : params.clone();
    }
    
    /**
     * Clears all references. Called by the signal when the binding is
     * removed.
     */
    void destroy() {
        signal   = null;
        listener = null;
        context  = null;
    }
    
    private Object[] effectiveArgs(Object[] args) {
        final Object[] a = args == null ? NO_ARGS : args;
        if (params == null || params.length == 0) {
            return a.clone();
        }
        final Object[] all = new Object[params.length + a.length];
        System.arraycopy(params, 0, all, 0, params.length);
        System.arraycopy(a, 0, all, params.length, a.length);
        return all;
    }
    
    @Override
    public String toString() {
        return SignalBinding.class.getSimpleName() + "{" +
                "once=" + once +
                ", bound=" + isBound() +
                ", active=" + active +
                ", priority=" + priority + "}";
    }
}
