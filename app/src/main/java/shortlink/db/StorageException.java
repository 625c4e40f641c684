package shortlink.db;

/**
 * The persistence layer could not complete an operation. A failed put leaves
 * no mapping behind.
 */
public class StorageException extends MappingStoreException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
