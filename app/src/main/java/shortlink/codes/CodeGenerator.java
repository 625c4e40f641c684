package shortlink.codes;

@FunctionalInterface
public interface CodeGenerator {
    /**
     * Produce a fresh candidate code. Candidates are not guaranteed to be
     * unused; the caller checks occupancy.
     */
    String next();
}
