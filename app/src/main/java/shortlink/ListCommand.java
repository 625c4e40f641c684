package shortlink;

import java.io.PrintStream;
import java.util.List;

import shortlink.db.Mapping;
import shortlink.db.MappingStore;
import shortlink.db.StorageException;

/**
 * Prints every mapping of a store, for operators.
 */
public class ListCommand {
    private final MappingStore store;
    private final String location;

    public ListCommand(MappingStore store, String location){
        this.store = store;
        this.location = location;
    }

    public int run(PrintStream out) throws StorageException {
        List<Mapping> mappings = store.list();

        int n = mappings.size();
        out.println(n + " mapping" + (n == 1 ? "" : "s") + " found in " + location + ":");
        for(Mapping m : mappings){
            out.println("  " + m.getCode() + " -> " + m.getUrl());
        }
        return n;
    }
}
