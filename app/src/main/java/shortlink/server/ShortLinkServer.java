package shortlink.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpServer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import shortlink.db.MappingStore;

public class ShortLinkServer implements AutoCloseable {
    private static Logger logger = LogManager.getLogger(ShortLinkServer.class.getName());

    private static final int STOP_DELAY_SECONDS = 1;

    private final HttpServer server;
    private final ExecutorService executor;

    public ShortLinkServer(InetSocketAddress address, MappingStore store, Path index, int threads) throws IOException {
        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "http-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        server = HttpServer.create(address, 0);
        server.createContext("/", new ShortLinkHttpHandler(store, index));
        server.setExecutor(executor);
    }

    public void start(){
        server.start();
        logger.info("Listening on " + getAddress());
    }

    /**
     * Actual bound address; differs from the requested one when port 0 was asked for.
     */
    public InetSocketAddress getAddress(){
        return server.getAddress();
    }

    @Override
    public void close() {
        logger.info("Stopping HTTP server");
        server.stop(STOP_DELAY_SECONDS);
        executor.shutdown();
        try {
            if(!executor.awaitTermination(5, TimeUnit.SECONDS))
                executor.shutdownNow();
        } catch(InterruptedException e){
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
