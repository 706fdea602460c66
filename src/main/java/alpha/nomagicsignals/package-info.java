/**
 * Synchronous, in-process signals.<p>
 * 
 * A {@link alpha.nomagicsignals.Signal Signal} broadcasts a dispatch to its
 * listeners, ordered by priority. Each attached listener is represented by a
 * {@link alpha.nomagicsignals.SignalBinding SignalBinding}. A {@link
 * alpha.nomagicsignals.CompoundSignal CompoundSignal} joins many signals into
 * one, dispatched when all sources have dispatched.<p>
 * 
 * There are no threads and no queues involved. All listeners are invoked by
 * the thread dispatching, before {@code dispatch} returns.<p>
 * 
 * <strong>Examples</strong>. See package {@link alpha.nomagicsignals.examples}.
 */
package alpha.nomagicsignals;
