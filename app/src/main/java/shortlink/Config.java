package shortlink;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;

import shortlink.codes.RandomCodeGenerator;
import shortlink.db.MappingStore;

/**
 * Command line options, parsed once at startup.
 */
public class Config {
    public enum Command {
        SERVE,
        LS
    }

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_THREADS = 2 * Runtime.getRuntime().availableProcessors();

    public static final String USAGE = String.join(System.lineSeparator(),
        "usage: shortlink serve <db> [--url <host:port>] [--index <file>] [--code-length <n>]",
        "                            [--dedup] [--jdbc-url <url>] [--threads <n>]",
        "       shortlink ls <db> [--jdbc-url <url>]");

    private Command command;
    private Path db;
    private String jdbcUrl = null;
    private InetSocketAddress address = new InetSocketAddress(DEFAULT_HOST, DEFAULT_PORT);
    private Path index = null;
    private int codeLength = RandomCodeGenerator.DEFAULT_LENGTH;
    private int maxAttempts = MappingStore.DEFAULT_MAX_ATTEMPTS;
    private boolean dedup = false;
    private int threads = DEFAULT_THREADS;

    private Config(){
    }

    /**
     * @throws IllegalArgumentException with a message for the user if the arguments are not valid
     */
    public static Config parse(String[] args){
        Iterator<String> it = Arrays.asList(args).iterator();
        if(!it.hasNext()) throw new IllegalArgumentException("missing command");

        Config config = new Config();
        String command = it.next();
        switch(command){
            case "serve": config.command = Command.SERVE; break;
            case "ls": config.command = Command.LS; break;
            default: throw new IllegalArgumentException("unknown command: " + command);
        }

        while(it.hasNext()){
            String arg = it.next();
            if(!arg.startsWith("--")){
                if(config.db != null) throw new IllegalArgumentException("unexpected argument: " + arg);
                config.db = Path.of(arg);
                continue;
            }

            if(arg.equals("--dedup")){
                if(config.command != Command.SERVE) throw new IllegalArgumentException("unknown option: " + arg);
                config.dedup = true;
                continue;
            }

            if(!it.hasNext()) throw new IllegalArgumentException("missing value for " + arg);
            String value = it.next();

            if(arg.equals("--jdbc-url")){
                config.jdbcUrl = value;
                continue;
            }
            if(config.command != Command.SERVE) throw new IllegalArgumentException("unknown option: " + arg);

            switch(arg){
                case "--url": config.address = parseAddress(value); break;
                case "--index": config.index = Path.of(value); break;
                case "--code-length": config.codeLength = parseInt(arg, value, RandomCodeGenerator.MIN_LENGTH, RandomCodeGenerator.MAX_LENGTH); break;
                case "--threads": config.threads = parseInt(arg, value, 1, 1024); break;
                default: throw new IllegalArgumentException("unknown option: " + arg);
            }
        }

        if(config.db == null && config.jdbcUrl == null)
            throw new IllegalArgumentException("missing database path");

        return config;
    }

    static InetSocketAddress parseAddress(String s){
        int i = s.lastIndexOf(':');
        if(i <= 0 || i == s.length()-1) throw new IllegalArgumentException("invalid address, expected <host:port>: " + s);
        String host = s.substring(0, i);
        if(host.startsWith("[") && host.endsWith("]")) host = host.substring(1, host.length()-1);
        int port = parseInt("port", s.substring(i+1), 0, 65535);
        return new InetSocketAddress(host, port);
    }

    private static int parseInt(String name, String value, int min, int max){
        int n;
        try {
            n = Integer.parseInt(value);
        } catch(NumberFormatException e){
            throw new IllegalArgumentException("invalid value for " + name + ": " + value);
        }
        if(n < min || n > max)
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + n);
        return n;
    }

    public Command getCommand() {
        return command;
    }

    /**
     * Path of the SQLite store; null when only a JDBC URL was given.
     */
    public Path getDb() {
        return db;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    public Path getIndex() {
        return index;
    }

    public int getCodeLength() {
        return codeLength;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isDedup() {
        return dedup;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Human readable location of the store, for log lines.
     */
    public String describeStore(){
        return jdbcUrl != null ? jdbcUrl : db.toString();
    }
}
