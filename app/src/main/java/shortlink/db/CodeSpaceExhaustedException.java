package shortlink.db;

public class CodeSpaceExhaustedException extends MappingStoreException {
    private final int attempts;

    public CodeSpaceExhaustedException(int attempts) {
        super("No free code found after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
