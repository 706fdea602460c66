package alpha.nomagicsignals.examples;

import alpha.nomagicsignals.Signal;
import alpha.nomagicsignals.SignalListener;

/**
 * Prints greetings in order of priority, until one listener halts.
 */
public class PriorityAndHalt
{
    /**
     * Application entry point.
     * 
     * @param args ignored
     */
    public static void main(String... args) {
        Signal greeted = new Signal();
        
        SignalListener polite = (ctx, a) -> {
            System.out.println("Good day, " + a[0] + ".");
            return null;
        };
        
        // The context is given to the listener as-is
        SignalListener loud = (ctx, a) -> {
            System.out.println(ctx + " " + a[0] + "!");
            return null;
        };
        
        // Returning FALSE stops the dispatch; same as calling greeted.halt()
        SignalListener grumpy = (ctx, a) -> {
            System.out.println("Go away, " + a[0] + ".");
            return Boolean.FALSE;
        };
        
        SignalListener neverCalled = (ctx, a) -> {
            System.out.println("You will not see this.");
            return null;
        };
        
        // Added first, but the greatest priority executes first
        greeted.add(polite);
        greeted.add(loud, "HEY", 10);
        greeted.add(grumpy, null, -1);
        greeted.add(neverCalled, null, -5);
        
        greeted.dispatch("World");
    }
}
