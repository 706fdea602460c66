/**
 * Runnable examples of how to use signals.
 */
package alpha.nomagicsignals.examples;
