package shortlink.db;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import shortlink.codes.CodeGenerator;

/**
 * Non-durable store; mappings live as long as the instance.
 */
public class MappingStoreMemory extends MappingStore {
    private final ConcurrentSkipListMap<String, String> codeToUrl = new ConcurrentSkipListMap<>();
    private final Map<String, String> urlToCode = new ConcurrentHashMap<>();

    public MappingStoreMemory(CodeGenerator generator){
        this(generator, DEFAULT_MAX_ATTEMPTS, false);
    }

    public MappingStoreMemory(CodeGenerator generator, int maxAttempts, boolean dedup){
        super(generator, maxAttempts, dedup);
    }

    @Override
    protected boolean insertIfAbsent(String code, String url) {
        if(codeToUrl.putIfAbsent(code, url) != null) return false;
        urlToCode.putIfAbsent(url, code);
        return true;
    }

    @Override
    protected String findCode(String url) {
        return urlToCode.get(url);
    }

    @Override
    public String get(String code) {
        return codeToUrl.get(code);
    }

    @Override
    public List<Mapping> list() {
        List<Mapping> ret = new ArrayList<>();
        for(Map.Entry<String, String> e : codeToUrl.entrySet()){
            ret.add(new Mapping(e.getKey(), e.getValue()));
        }
        return ret;
    }

    @Override
    public void close() {
    }
}
