package shortlink.server;

public class InvalidUrlException extends Exception {
    public InvalidUrlException(String message) {
        super(message);
    }
}
