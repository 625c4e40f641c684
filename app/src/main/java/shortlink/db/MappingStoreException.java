package shortlink.db;

public abstract class MappingStoreException extends Exception {
    protected MappingStoreException(String message) {
        super(message);
    }

    protected MappingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
