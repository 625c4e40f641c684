package shortlink.db;

import java.util.Objects;

public class Mapping {
    private final String code;
    private final String url;

    public Mapping(String code, String url){
        this.code = Objects.requireNonNull(code);
        this.url = Objects.requireNonNull(url);
    }

    public String getCode() {
        return code;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Mapping)) return false;
        Mapping other = (Mapping)o;
        return code.equals(other.code) && url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, url);
    }

    @Override
    public String toString() {
        return code + " -> " + url;
    }
}
