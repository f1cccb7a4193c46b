package org.abstractica.sessionsync.handlers;

/**
 * Receives a value after it has changed.
 *
 * <p>Listeners are called after the change is committed, on the thread that
 * applied it. A listener that needs another thread (a UI thread, for
 * instance) should hand the value over itself. Exceptions thrown by a
 * listener are logged and do not affect other listeners.</p>
 *
 * @param <T> the observed value type
 */
@FunctionalInterface
public interface ChangeListener<T>
{
    /**
     * Called with the previous and the new value.
     *
     * @param previous the value before the change, null if there was none
     * @param current  the value after the change, null if it was dropped
     */
    void onChange(T previous, T current);
}
