package shortlink.server;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that a request body is a URL we are willing to redirect to.
 */
public class UrlValidator {
    public static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    public static final int MAX_URL_LENGTH = 2048;

    /**
     * @return the URL with surrounding whitespace removed
     */
    public static String validate(byte[] body) throws InvalidUrlException {
        String url;
        try {
            url = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString();
        } catch(CharacterCodingException e){
            throw new InvalidUrlException("invalid utf-8 in url");
        }
        return validate(url);
    }

    public static String validate(String raw) throws InvalidUrlException {
        String url = (raw == null ? "" : raw.strip());
        if(url.isEmpty())
            throw new InvalidUrlException("empty url");
        if(url.length() > MAX_URL_LENGTH)
            throw new InvalidUrlException("url too long (max " + MAX_URL_LENGTH + " characters)");

        for(int i = 0; i < url.length(); ++i){
            char c = url.charAt(i);
            if(c < 0x21 || c > 0x7E)
                throw new InvalidUrlException("invalid url: character at index " + i + " must be percent-encoded");
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch(URISyntaxException e){
            throw new InvalidUrlException("invalid url: " + e.getMessage());
        }

        String scheme = uri.getScheme();
        if(scheme == null)
            throw new InvalidUrlException("url missing scheme");
        if(!ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT)))
            throw new InvalidUrlException("unsupported url scheme: " + scheme);
        // registry-based authorities (e.g. hosts with underscores) have no parsed host
        if(uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty())
            throw new InvalidUrlException("url missing host");

        return url;
    }
}
