package alpha.nomagicsignals.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Logging utilities.
 */
public final class Logging
{
    private Logging() {
        // Empty
    }
    
    /**
     * Start recording log records from the logger of the package that the
     * given component belongs to.<p>
     * 
     * All levels are recorded. Recording must be stopped using {@link
     * Recorder#stop()}, which also restores the logger's level.
     * 
     * @param component to extract package from
     * 
     * @return a recorder
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static Recorder startRecording(Class<?> component) {
        return new Recorder(Logger.getLogger(component.getPackageName()));
    }
    
    /**
     * Is a log handler accumulating records, and an API for querying them.
     */
    public static final class Recorder extends Handler {
        // Strong reference, or JUL may GC the logger and our level with it
        private final Logger logger;
        private final Level oldLevel;
        private final List<LogRecord> records;
        
        Recorder(Logger logger) {
            this.logger   = requireNonNull(logger);
            this.oldLevel = logger.getLevel();
            this.records  = new ArrayList<>();
            setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }
        
        /**
         * Stream a snapshot of all records observed.
         * 
         * @return a snapshot of all records observed
         */
        public synchronized Stream<LogRecord> records() {
            return List.copyOf(records).stream();
        }
        
        /**
         * Stream the messages of all records observed with the given level.
         * 
         * @param level of record
         * @return messages of all records observed with the given level
         */
        public Stream<String> messages(System.Logger.Level level) {
            var jul = toJUL(level);
            return records().filter(r -> r.getLevel().equals(jul))
                            .map(LogRecord::getMessage);
        }
        
        /**
         * Stop recording.
         */
        public void stop() {
            logger.removeHandler(this);
            logger.setLevel(oldLevel);
        }
        
        @Override
        public synchronized void publish(LogRecord record) {
            records.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            stop();
        }
    }
    
    /**
     * Translate a {@code System.Logger.Level} to its JUL counterpart, the
     * same way the JDK does when {@code System.Logger} is backed by JUL.
     * 
     * @param level to translate
     * @return the JUL level
     * @throws NullPointerException if {@code level} is {@code null}
     */
    public static Level toJUL(System.Logger.Level level) {
        return switch (level) {
            case ALL     -> Level.ALL;
            case TRACE   -> Level.FINER;
            case DEBUG   -> Level.FINE;
            case INFO    -> Level.INFO;
            case WARNING -> Level.WARNING;
            case ERROR   -> Level.SEVERE;
            case OFF     -> Level.OFF;
        };
    }
}
