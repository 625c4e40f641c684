package shortlink;

import java.nio.file.Files;
import java.util.concurrent.CountDownLatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import shortlink.codes.RandomCodeGenerator;
import shortlink.db.MappingStore;
import shortlink.db.MappingStoreSql;
import shortlink.db.StorageException;
import shortlink.server.ShortLinkServer;

public class App {
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static Logger logger = LogManager.getLogger(App.class.getName());

    public static void main(String args[]) {
        Config config;
        try {
            config = Config.parse(args);
        } catch(IllegalArgumentException e){
            System.err.println(e.getMessage());
            System.err.println(Config.USAGE);
            System.exit(EXIT_USAGE);
            return;
        }

        try {
            switch(config.getCommand()){
                case SERVE: serve(config); break;
                case LS: System.exit(list(config)); break;
            }
        } catch(Exception e){
            logger.fatal("Failed to run " + config.getCommand().name().toLowerCase(), e);
            System.exit(EXIT_FAILURE);
        }
    }

    static MappingStore openStore(Config config) throws StorageException {
        return openStore(config, false);
    }

    /**
     * @param readOnly open without creating the schema; puts fail
     */
    static MappingStore openStore(Config config, boolean readOnly) throws StorageException {
        if(readOnly){
            if(config.getJdbcUrl() != null)
                return new MappingStoreSql(config.getJdbcUrl(), null, 1, false, true);
            return MappingStoreSql.openFileReadOnly(config.getDb());
        }
        RandomCodeGenerator generator = new RandomCodeGenerator(config.getCodeLength());
        if(config.getJdbcUrl() != null)
            return new MappingStoreSql(config.getJdbcUrl(), generator, config.getMaxAttempts(), config.isDedup());
        return MappingStoreSql.openFile(config.getDb(), generator, config.getMaxAttempts(), config.isDedup());
    }

    static int list(Config config) throws StorageException {
        if(config.getJdbcUrl() == null && !Files.isRegularFile(config.getDb())){
            System.err.println("database file does not exist or is not a file: " + config.getDb());
            return EXIT_FAILURE;
        }
        try(MappingStore store = openStore(config, true)){
            new ListCommand(store, config.describeStore()).run(System.out);
        }
        return 0;
    }

    static void serve(Config config) throws Exception {
        if(config.getIndex() != null && !Files.isRegularFile(config.getIndex())){
            logger.warn("index file does not exist or is not a file: " + config.getIndex() + "; / will answer 404");
        }

        MappingStore store = openStore(config);
        ShortLinkServer server = new ShortLinkServer(config.getAddress(), store, config.getIndex(), config.getThreads());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            server.close();
            try {
                store.close();
            } catch(StorageException e){
                logger.error("Failed to close store", e);
            }
            stopped.countDown();
        }));

        server.start();
        logger.info("Starting shortlink at http://" + config.getAddress().getHostString() + ":" + server.getAddress().getPort()
            + ", db at " + config.describeStore());
        stopped.await();
    }
}
