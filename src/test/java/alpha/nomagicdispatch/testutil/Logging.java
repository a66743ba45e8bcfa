package alpha.nomagicdispatch.testutil;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Utility API for recording log records.<p>
 * 
 * The engine logs through {@code System.Logger}, which by default is backed by
 * {@code java.util.logging}. Records are captured by adding a JUL handler to
 * the logger of the component's package.
 * 
 * <pre>{@code
 *   var rec = Logging.startRecording(DefaultEngine.class);
 *   ...
 *   rec.stop();
 *   assertThat(rec.take(ERROR, "No error handler", IOException.class)).isNotNull();
 * }</pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Logging
{
    private Logging() {
        // Empty
    }
    
    /**
     * Start recording all log records from the package of the given
     * component.
     * 
     * @param component to record
     * @return a recorder
     */
    public static Recorder startRecording(Class<?> component) {
        var logger = Logger.getLogger(component.getPackageName());
        var r = new Recorder(logger, logger.getLevel());
        logger.setLevel(java.util.logging.Level.ALL);
        logger.addHandler(r);
        return r;
    }
    
    /**
     * Map a {@code System.Logger.Level} to a {@code java.util.logging.Level}.
     * 
     * @param level to map
     * @return the JUL level
     */
    public static java.util.logging.Level toJUL(System.Logger.Level level) {
        switch (level) {
            case ALL:     return java.util.logging.Level.ALL;
            case TRACE:   return java.util.logging.Level.FINER;
            case DEBUG:   return java.util.logging.Level.FINE;
            case INFO:    return java.util.logging.Level.INFO;
            case WARNING: return java.util.logging.Level.WARNING;
            case ERROR:   return java.util.logging.Level.SEVERE;
            case OFF:     return java.util.logging.Level.OFF;
            default:
                throw new IllegalArgumentException("No mapping for: " + level);
        }
    }
    
    /**
     * A JUL handler that keeps all records published.
     */
    public static final class Recorder extends Handler {
        private final Logger logger;
        private final java.util.logging.Level was;
        private final Deque<LogRecord> records;
        
        Recorder(Logger logger, java.util.logging.Level was) {
            this.logger  = logger;
            this.was     = was;
            this.records = new ConcurrentLinkedDeque<>();
        }
        
        /**
         * Returns all records published so far.
         * 
         * @return all records published so far
         */
        public Stream<LogRecord> records() {
            return records.stream();
        }
        
        /**
         * Remove and return the first record matching the given criteria.
         * 
         * @param level of record
         * @param messageStartsWith start of message
         * @param error type of thrown (instance-of)
         * 
         * @return the record, or {@code null} if no record matches
         */
        public LogRecord take(
                System.Logger.Level level, String messageStartsWith,
                Class<? extends Throwable> error)
        {
            requireNonNull(messageStartsWith);
            var jul = toJUL(level);
            var it = records.iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (r.getLevel().equals(jul) &&
                    r.getMessage().startsWith(messageStartsWith) &&
                    error.isInstance(r.getThrown()))
                {
                    it.remove();
                    return r;
                }
            }
            return null;
        }
        
        /**
         * Returns {@code true} if a record with the given level and message
         * exists.
         * 
         * @param level of record
         * @param message the message
         * @return see JavaDoc
         */
        public boolean contains(System.Logger.Level level, String message) {
            var jul = toJUL(level);
            return records().anyMatch(r ->
                    r.getLevel().equals(jul) && message.equals(r.getMessage()));
        }
        
        /**
         * Stop recording.
         */
        public void stop() {
            logger.removeHandler(this);
            logger.setLevel(was);
        }
        
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}
