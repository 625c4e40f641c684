package shortlink.db;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import shortlink.codes.CodeGenerator;

/**
 * JDBC-backed store. Defaults to an SQLite file; any database that
 * understands {@code INSERT ... ON CONFLICT DO NOTHING} (PostgreSQL, SQLite)
 * can be used through its JDBC URL.
 * <p>
 * Every operation runs on its own connection in auto-commit mode, so a
 * returned put is already committed.
 */
public class MappingStoreSql extends MappingStore {
    public static final String SQLITE_PREFIX = "jdbc:sqlite:";
    public static final int SQLITE_BUSY_TIMEOUT_MILLIS = 5000;

    private static Logger logger = LogManager.getLogger(MappingStoreSql.class.getName());

    private final String jdbcUrl;
    private final boolean readOnly;
    private final Properties properties = new Properties();

    public static MappingStoreSql openFile(Path path, CodeGenerator generator, int maxAttempts, boolean dedup) throws StorageException {
        Path parent = path.toAbsolutePath().getParent();
        if(parent != null){
            try {
                Files.createDirectories(parent);
            } catch(IOException e){
                throw new StorageException("Could not create directory " + parent, e);
            }
        }
        return new MappingStoreSql(SQLITE_PREFIX + path, generator, maxAttempts, dedup, false);
    }

    /**
     * Open an existing SQLite file for reading only: no directories, schema
     * or journal changes are made, and puts fail.
     */
    public static MappingStoreSql openFileReadOnly(Path path) throws StorageException {
        return new MappingStoreSql(SQLITE_PREFIX + path, null, 1, false, true);
    }

    public MappingStoreSql(String url, CodeGenerator generator, int maxAttempts, boolean dedup) throws StorageException {
        this(url, generator, maxAttempts, dedup, false);
    }

    public MappingStoreSql(String url, CodeGenerator generator, int maxAttempts, boolean dedup, boolean readOnly) throws StorageException {
        super(generator, maxAttempts, dedup);
        this.jdbcUrl = url;
        this.readOnly = readOnly;
        if(isSqlite()){
            properties.setProperty("busy_timeout", Integer.toString(SQLITE_BUSY_TIMEOUT_MILLIS));
        }
        if(readOnly){
            logger.info("Opened store at " + jdbcUrl + " (read-only)");
        } else {
            seed();
        }
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    private boolean isSqlite(){
        return jdbcUrl.startsWith(SQLITE_PREFIX);
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, properties);
    }

    /**
     * Create the schema if it does not exist yet.
     */
    private void seed() throws StorageException {
        try(Connection conn = connect(); Statement st = conn.createStatement()){
            if(isSqlite()){
                st.execute("PRAGMA journal_mode=WAL");
            }
            st.execute("""
                CREATE TABLE IF NOT EXISTS mappings(
                    code VARCHAR(32) PRIMARY KEY,
                    url VARCHAR NOT NULL
                )
            """);
            st.execute("CREATE INDEX IF NOT EXISTS mappings_url ON mappings(url)");
            logger.info("Opened store at " + jdbcUrl);
        } catch(SQLException e){
            throw new StorageException("Could not initialize store at " + jdbcUrl, e);
        }
    }

    @Override
    public String put(String url) throws StorageException, CodeSpaceExhaustedException {
        if(readOnly) throw new StorageException("Store at " + jdbcUrl + " is opened read-only");
        return super.put(url);
    }

    @Override
    protected boolean insertIfAbsent(String code, String url) throws StorageException {
        try(Connection conn = connect();
            PreparedStatement stmt = conn.prepareStatement("""
                INSERT INTO mappings(code, url)
                VALUES (?, ?)
                ON CONFLICT (code) DO NOTHING
            """)){
            stmt.setString(1, code);
            stmt.setString(2, url);
            int n = stmt.executeUpdate();
            return (n == 1);
        } catch(SQLException e){
            throw new StorageException("Failed to insert " + code + " => " + url, e);
        }
    }

    @Override
    protected String findCode(String url) throws StorageException {
        try(Connection conn = connect();
            PreparedStatement stmt = conn.prepareStatement("""
                SELECT code FROM mappings
                WHERE url=?
                ORDER BY code
                LIMIT 1
            """)){
            stmt.setString(1, url);
            try(ResultSet rs = stmt.executeQuery()){
                if(!rs.next()) return null;
                return rs.getString("code");
            }
        } catch(SQLException e){
            throw new StorageException("Failed to look up code for " + url, e);
        }
    }

    @Override
    public String get(String code) throws StorageException {
        try(Connection conn = connect();
            PreparedStatement stmt = conn.prepareStatement("""
                SELECT url FROM mappings
                WHERE code=?
            """)){
            stmt.setString(1, code);
            try(ResultSet rs = stmt.executeQuery()){
                if(!rs.next()) return null;
                return rs.getString("url");
            }
        } catch(SQLException e){
            throw new StorageException("Failed to get " + code, e);
        }
    }

    @Override
    public List<Mapping> list() throws StorageException {
        List<Mapping> ret = new ArrayList<>();
        try(Connection conn = connect();
            Statement st = conn.createStatement();
            ResultSet rs = st.executeQuery("SELECT code, url FROM mappings ORDER BY code")){
            while(rs.next()){
                ret.add(new Mapping(rs.getString("code"), rs.getString("url")));
            }
        } catch(SQLException e){
            throw new StorageException("Failed to list mappings", e);
        }
        return ret;
    }

    @Override
    public void close() {
        logger.debug("Closed store at " + jdbcUrl);
    }
}
