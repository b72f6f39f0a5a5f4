package hr.juren.conflator;

import java.util.NoSuchElementException;

/**
 * Thrown on a read of a key that was not written since the last reset.
 * {@link #retained()} tells a stale key apart from one never written.
 */
public class KeyNotDirtyException extends NoSuchElementException {

    private final transient Object key;
    private final boolean retained;

    public KeyNotDirtyException(Object key, boolean retained) {
        super(key + " not found in dirty set" + (retained ? " (not written since last reset)" : ""));
        this.key = key;
        this.retained = retained;
    }

    public Object key() {
        return key;
    }

    public boolean retained() {
        return retained;
    }
}
