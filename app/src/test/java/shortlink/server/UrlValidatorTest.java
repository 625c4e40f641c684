package shortlink.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;

import org.junit.Test;

public class UrlValidatorTest {
    private static void assertRejected(String url, String expectedMessage){
        try {
            UrlValidator.validate(url);
            fail("expected " + url + " to be rejected");
        } catch(InvalidUrlException e){
            assertEquals(expectedMessage, e.getMessage());
        }
    }

    @Test
    public void testAccepts() throws InvalidUrlException {
        assertEquals("https://example.com/long/path", UrlValidator.validate("https://example.com/long/path"));
        assertEquals("http://example.com", UrlValidator.validate("http://example.com"));
        assertEquals("HTTPS://Example.com/?q=1#x", UrlValidator.validate("HTTPS://Example.com/?q=1#x"));
    }

    @Test
    public void testTrims() throws InvalidUrlException {
        assertEquals("https://example.com/", UrlValidator.validate("  https://example.com/\n"));
    }

    @Test
    public void testRejects() {
        assertRejected("", "empty url");
        assertRejected(" \n\t", "empty url");
        assertRejected("example.com/path", "url missing scheme");
        assertRejected("ftp://example.com/file", "unsupported url scheme: ftp");
        assertRejected("javascript:alert(1)", "unsupported url scheme: javascript");
        assertRejected("https:///path-only", "url missing host");
        assertRejected("https://" + "a".repeat(UrlValidator.MAX_URL_LENGTH) + ".com", "url too long (max " + UrlValidator.MAX_URL_LENGTH + " characters)");
    }

    @Test
    public void testRejectsUnparsable() {
        try {
            UrlValidator.validate("https://exa mple.com/");
            fail("expected rejection");
        } catch(InvalidUrlException e){
            assertEquals(true, e.getMessage().startsWith("invalid url: "));
        }
    }

    @Test
    public void testRejectsNonAscii() {
        assertRejected("https://example.com/日本", "invalid url: character at index 20 must be percent-encoded");
        assertRejected("https://bücher.example/", "invalid url: character at index 9 must be percent-encoded");
    }

    @Test
    public void testAcceptsPercentEncoded() throws InvalidUrlException {
        String url = "https://example.com/%E6%97%A5%E6%9C%AC";
        assertEquals(url, UrlValidator.validate(url));
    }

    @Test
    public void testAcceptsRegistryBasedHost() throws InvalidUrlException {
        assertEquals("https://my_host.example.com/x", UrlValidator.validate("https://my_host.example.com/x"));
        assertEquals("http://user@my_host:8080/", UrlValidator.validate("http://user@my_host:8080/"));
    }

    @Test
    public void testRejectsInvalidUtf8() {
        byte[] body = new byte[]{'h', 't', 't', 'p', ':', '/', '/', (byte)0xC3, (byte)0x28};
        try {
            UrlValidator.validate(body);
            fail("expected rejection");
        } catch(InvalidUrlException e){
            assertEquals("invalid utf-8 in url", e.getMessage());
        }
    }

    @Test
    public void testBytes() throws InvalidUrlException {
        assertEquals("https://example.com/", UrlValidator.validate("https://example.com/".getBytes(StandardCharsets.UTF_8)));
    }
}
