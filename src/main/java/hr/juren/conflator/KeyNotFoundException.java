package hr.juren.conflator;

import java.util.NoSuchElementException;

public class KeyNotFoundException extends NoSuchElementException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super(key + " is not dirty");
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
