package io.keepwarm.store;

/**
 * Raised when the schedule store cannot read or write a record.
 */
public class StoreException extends Exception {
    
    public StoreException(String message) {
        super(message);
    }
    
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
