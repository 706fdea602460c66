package alpha.nomagicsignals;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static alpha.nomagicsignals.Signals.consuming;
import static alpha.nomagicsignals.Signals.consumingAndHalting;
import static alpha.nomagicsignals.Signals.running;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Signals}.
 */
class SignalsTest
{
    private final List<Object> calls = new ArrayList<>();
    
    @Test
    void version() {
        assertThat(Signals.VERSION).isEqualTo("1.0.0");
    }
    
    @Test
    void running_ignoresArgs() {
        var l = running(() -> calls.add("ran"));
        assertThat(l.onSignal("ctx", 1, 2)).isNull();
        assertThat(calls).containsExactly("ran");
    }
    
    @Test
    void consuming_receivesArgs() {
        var l = consuming(args -> calls.add(args.length));
        assertThat(l.onSignal(null, "a", "b")).isNull();
        assertThat(calls).containsExactly(2);
    }
    
    @Test
    void consumingAndHalting_stopsPropagation() {
        var s = new Signal();
        s.add(consumingAndHalting(args -> calls.add("first")), null, 1);
        s.add(consuming(args -> calls.add("second")));
        s.dispatch();
        assertThat(calls).containsExactly("first");
    }
    
    @Test
    void newInstanceEachCall() {
        Runnable r = () -> {};
        assertThat(running(r)).isNotSameAs(running(r));
    }
    
    @Test
    void nullAction() {
        assertThatThrownBy(() -> running(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> consuming(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> consumingAndHalting(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
