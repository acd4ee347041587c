package org.lsst.fits.converter;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a task and logs how long it took. The elapsed milliseconds are passed
 * as the last format argument.
 *
 * @author tonyj
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());

    private Timed() {
    }

    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(Level.FINE, callable, message, args);
    }

    public static <T> T execute(Level level, Callable<T> callable, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return callable.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (LOG.isLoggable(level)) {
                Object[] withTime = new Object[args.length + 1];
                System.arraycopy(args, 0, withTime, 0, args.length);
                withTime[args.length] = elapsed;
                LOG.log(level, String.format(message, withTime));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }
}
