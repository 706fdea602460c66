package alpha.nomagicsignals.examples;

import alpha.nomagicsignals.CompoundSignal;
import alpha.nomagicsignals.Signal;

import java.util.Arrays;

import static alpha.nomagicsignals.Signals.consuming;

/**
 * Waits for two independent loaders before printing what they loaded.
 */
public class AwaitAllSources
{
    /**
     * Application entry point.
     * 
     * @param args ignored
     */
    public static void main(String... args) {
        Signal configLoaded = new Signal(),
               usersLoaded  = new Signal();
        
        CompoundSignal ready = new CompoundSignal(configLoaded, usersLoaded);
        
        // Argument i is the Object[] dispatched by source i
        ready.add(consuming(a -> System.out.println(
                "Ready! config=" + Arrays.toString((Object[]) a[0]) +
                ", users=" + Arrays.toString((Object[]) a[1]))));
        
        usersLoaded.dispatch("alice", "bob");
        System.out.println("Resolved: " + ready.isResolved());
        configLoaded.dispatch("prod");
        
        // The result is memorized, a late listener is invoked immediately
        ready.add(consuming(a -> System.out.println("Late, but still got it.")));
    }
}
