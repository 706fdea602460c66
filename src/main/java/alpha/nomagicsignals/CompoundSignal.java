package alpha.nomagicsignals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * A signal dispatched when all of its source signals have been dispatched.<p>
 * 
 * The compound signal listens to each one of the sources. For each source, the
 * arguments of its dispatch are collected. When all sources have dispatched,
 * the compound signal dispatches the collected arguments; one {@code Object[]}
 * per source, in the same order as the sources were given to the
 * constructor.
 * 
 * <pre>
 *   Signal configLoaded = ..., cacheWarmed = ...
 *   CompoundSignal ready = new CompoundSignal(configLoaded, cacheWarmed);
 *   ready.add((ctx, args) -> {
 *       Object[] fromConfig = (Object[]) args[0],
 *                fromCache  = (Object[]) args[1];
 *       ...
 *   });
 * </pre>
 * 
 * By default, the compound signal behaves like a promise. It is resolved only
 * once ({@link #isUnique()}), and it {@linkplain #isMemorize() memorizes} the
 * result, so that a listener added after the resolution is invoked
 * immediately. After the one and only dispatch, all listeners are removed.
 * Dispatching the compound signal directly after it has resolved replays the
 * collected arguments, whatever arguments were given.<p>
 * 
 * If not unique, the compound signal dispatches each time all sources have
 * dispatched, after which the collected arguments are cleared and a new round
 * begins.<p>
 * 
 * By default, the first dispatch of a source within a round is the one
 * collected. Further dispatches from the same source are ignored until the
 * round completes, unless {@link #setOverride(boolean) override} is enabled,
 * in which case the latest dispatch is the one collected.<p>
 * 
 * The sources are not owned. Disposing the compound signal detaches it from
 * the sources but does not dispose the sources.<p>
 * 
 * Same as {@link Signal}, this class is not thread-safe.
 */
public class CompoundSignal extends Signal
{
    private static final System.Logger LOG
            = System.getLogger(CompoundSignal.class.getPackageName());
    
    private List<Signal> sources;
    private List<SignalBinding> links;
    private Object[][] collected;
    private boolean resolved, unique, override;
    
    /**
     * Constructs a {@code CompoundSignal}.
     * 
     * @param first source
     * @param more sources
     * 
     * @throws NullPointerException if any source is {@code null}
     * @throws IllegalArgumentException if the same source is given twice
     * @throws SignalDisposedException if a source has been disposed
     */
    public CompoundSignal(Signal first, Signal... more) {
        this(Stream.concat(Stream.of(first), Arrays.stream(more)).toList());
    }
    
    /**
     * Constructs a {@code CompoundSignal}.<p>
     * 
     * A memorizing source that has already been dispatched counts as
     * dispatched. If all sources are such sources, the compound signal resolves
     * before the constructor returns.
     * 
     * @param sources of the compound signal
     * 
     * @throws NullPointerException
     *             if {@code sources} or any element is {@code null}
     * @throws IllegalArgumentException
     *             if {@code sources} is empty, or
     *             if the same source is given twice
     * @throws SignalDisposedException if a source has been disposed
     */
    public CompoundSignal(List<? extends Signal> sources) {
        final List<Signal> s = List.copyOf(sources);
        requireValid(s);
        super.setMemorize(true);
        this.unique    = true;
        this.sources   = s;
        this.collected = new Object[s.size()][];
        this.links     = new ArrayList<>(s.size());
        final SignalListener collector = this::collect;
        for (int i = 0; i < s.size(); ++i) {
            links.add(s.get(i).addCurried(collector, i));
        }
    }
    
    private static void requireValid(List<Signal> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("No sources.");
        }
        Set<Signal> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Signal s : sources) {
            if (!seen.add(s)) {
                throw new IllegalArgumentException("Duplicated source: " + s);
            }
            s.requireNotDisposed();
        }
    }
    
    /**
     * Dispatch the compound signal.<p>
     * 
     * If this signal has resolved and is unique, then the given arguments are
     * ignored and the collected arguments are dispatched again. Otherwise,
     * the given arguments are dispatched and the signal is resolved.<p>
     * 
     * After the dispatch, a unique signal removes all of its listeners,
     * otherwise the signal is {@linkplain #reset() reset}.<p>
     * 
     * This method is NOP if the signal is not {@linkplain #setActive(boolean)
     * active}; it will not resolve.
     * 
     * @param args to pass to the listeners (may be {@code null})
     * @throws SignalDisposedException if this signal has been disposed
     */
    @Override
    public void dispatch(Object... args) {
        requireNotDisposed();
        if (!isActive()) {
            super.dispatch(args);
            return;
        }
        final Object[] params = resolved && unique ? snapshot() : args;
        if (!resolved) {
            LOG.log(DEBUG, () -> "Resolved " + this + ".");
        }
        resolved = true;
        super.dispatch(params);
        // A listener may have disposed this signal
        if (isDisposed()) {
            return;
        }
        if (unique) {
            removeAll();
        } else {
            reset();
        }
    }
    
    /**
     * Clear the collected arguments and mark the signal as not resolved.<p>
     * 
     * The compound signal remains attached to the sources and a new round of
     * collecting begins.
     * 
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void reset() {
        requireNotDisposed();
        Arrays.fill(collected, null);
        resolved = false;
        LOG.log(DEBUG, () -> "Reset " + this + ".");
    }
    
    /**
     * Returns {@code true} if all sources have dispatched, otherwise
     * {@code false}.<p>
     * 
     * A signal that is not unique is reset right after each resolution and so
     * this method returns {@code true} only for the duration of the dispatch.
     * 
     * @return {@code true} if all sources have dispatched,
     *         otherwise {@code false}
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean isResolved() {
        requireNotDisposed();
        return resolved;
    }
    
    /**
     * Returns {@code true} if the signal resolves only once.<p>
     * 
     * The default is {@code true}.
     * 
     * @return {@code true} if the signal resolves only once
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean isUnique() {
        requireNotDisposed();
        return unique;
    }
    
    /**
     * Set whether the signal resolves only once.
     * 
     * @param unique {@code false} to resolve on each completed round
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void setUnique(boolean unique) {
        requireNotDisposed();
        this.unique = unique;
    }
    
    /**
     * Returns {@code true} if a source dispatching again within the same
     * round replaces its collected arguments.<p>
     * 
     * The default is {@code false}.
     * 
     * @return {@code true} if the last dispatch of a source is collected
     * @throws SignalDisposedException if this signal has been disposed
     */
    public boolean isOverride() {
        requireNotDisposed();
        return override;
    }
    
    /**
     * Set whether a source dispatching again within the same round replaces
     * its collected arguments.
     * 
     * @param override {@code true} to collect the last dispatch of a source
     * @throws SignalDisposedException if this signal has been disposed
     */
    public void setOverride(boolean override) {
        requireNotDisposed();
        this.override = override;
    }
    
    /**
     * Returns the sources.
     * 
     * @return the sources (unmodifiable)
     * @throws SignalDisposedException if this signal has been disposed
     */
    public List<Signal> getSources() {
        requireNotDisposed();
        return sources;
    }
    
    /**
     * Remove all listeners, detach from the sources and release all
     * resources.<p>
     * 
     * The sources are not disposed.
     */
    @Override
    public void dispose() {
        if (isDisposed()) {
            super.dispose();
            return;
        }
        links.forEach(SignalBinding::detach);
        super.dispose();
        links = null;
        sources = null;
        collected = null;
    }
    
    private Object collect(Object context, Object... args) {
        final int i = (Integer) args[0];
        if (collected[i] == null || override) {
            collected[i] = Arrays.copyOfRange(args, 1, args.length);
        }
        if (allCollected() && (!resolved || !unique)) {
            dispatch(snapshot());
        }
        return null;
    }
    
    private Object[] snapshot() {
        return Arrays.copyOf(collected, collected.length, Object[].class);
    }
    
    private boolean allCollected() {
        for (Object[] c : collected) {
            if (c == null) {
                return false;
            }
        }
        return true;
    }
    
    @Override
    public String toString() {
        if (isDisposed()) {
            return super.toString();
        }
        return CompoundSignal.class.getSimpleName() + "{" +
                "active=" + isActive() +
                ", numListeners=" + getNumListeners() +
                ", sources=" + sources.size() +
                ", resolved=" + resolved + "}";
    }
}
