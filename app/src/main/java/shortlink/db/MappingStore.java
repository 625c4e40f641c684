package shortlink.db;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import shortlink.codes.CodeGenerator;

/**
 * Durable {@code code -> url} storage with unique code assignment.
 * <p>
 * Implementations provide an atomic insert-if-absent; {@link #put(String)}
 * builds the generate/insert/retry loop on top of it. All operations are
 * thread-safe.
 */
public abstract class MappingStore implements AutoCloseable {
    public static final int DEFAULT_MAX_ATTEMPTS = 16;

    private static Logger logger = LogManager.getLogger(MappingStore.class.getName());

    private final CodeGenerator generator;
    private final int maxAttempts;
    private final boolean dedup;

    private final Object dedupLock = new Object();

    protected MappingStore(CodeGenerator generator, int maxAttempts, boolean dedup){
        if(maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be positive");
        this.generator = generator;
        this.maxAttempts = maxAttempts;
        this.dedup = dedup;
    }

    /**
     * Insert {@code (code, url)} unless {@code code} is already taken.
     *
     * @return true if the mapping was written, false if the code was occupied
     */
    abstract protected boolean insertIfAbsent(String code, String url) throws StorageException;

    /**
     * @return the code of some mapping to {@code url}, or null if there is none
     */
    abstract protected String findCode(String url) throws StorageException;

    /**
     * @return the URL stored for {@code code}, or null if there is none
     */
    abstract public String get(String code) throws StorageException;

    /**
     * Snapshot of every mapping, ordered by code.
     */
    abstract public List<Mapping> list() throws StorageException;

    @Override
    abstract public void close() throws StorageException;

    public boolean isDedup() {
        return dedup;
    }

    /**
     * Assign a new code to {@code url} and store the mapping. The mapping is
     * visible to {@link #get(String)} once this returns.
     *
     * @return the assigned code
     */
    public String put(String url) throws StorageException, CodeSpaceExhaustedException {
        if(url == null || url.isEmpty())
            throw new IllegalArgumentException("url must not be empty");

        if(!dedup) return insertNew(url);

        synchronized(dedupLock){
            String existing = findCode(url);
            if(existing != null){
                logger.debug("Reusing code " + existing + " for " + url);
                return existing;
            }
            return insertNew(url);
        }
    }

    private String insertNew(String url) throws StorageException, CodeSpaceExhaustedException {
        for(int attempt = 1; attempt <= maxAttempts; ++attempt){
            String code = generator.next();
            if(insertIfAbsent(code, url)) return code;
            logger.warn("Code collision on " + code + " (attempt " + attempt + "/" + maxAttempts + ")");
        }
        throw new CodeSpaceExhaustedException(maxAttempts);
    }
}
