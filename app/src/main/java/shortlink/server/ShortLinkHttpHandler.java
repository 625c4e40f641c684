package shortlink.server;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import shortlink.codes.RandomCodeGenerator;
import shortlink.db.CodeSpaceExhaustedException;
import shortlink.db.MappingStore;
import shortlink.db.StorageException;

/**
 * Routes:
 * <ul>
 * <li>{@code POST /put} with the raw URL as body: 201 and the new code</li>
 * <li>{@code GET /<code>}: 308 to the stored URL, or 404</li>
 * <li>{@code GET /}: the index page, or 404 if there is none</li>
 * </ul>
 */
public class ShortLinkHttpHandler implements HttpHandler {
    public static final int MAX_BODY_BYTES = 8 * 1024;

    static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    static final String HTML_CONTENT_TYPE = "text/html; charset=utf-8";
    static final String STORAGE_ERROR_MESSAGE = "problem with database";

    private static Logger logger = LogManager.getLogger(ShortLinkHttpHandler.class.getName());

    private final MappingStore store;
    private final Path index;

    /**
     * @param index HTML file served on {@code /}; may be null
     */
    public ShortLinkHttpHandler(MappingStore store, Path index){
        this.store = store;
        this.index = index;
    }

    @Override
    public void handle(HttpExchange httpExchange) throws IOException {
        try {
            String path = httpExchange.getRequestURI().getRawPath();
            String method = httpExchange.getRequestMethod();

            boolean put = path.equals("/put") && method.equals("POST");
            if(!put) drainRequestBody(httpExchange);

            if(path.equals("/put")){
                if(method.equals("POST")) handlePut(httpExchange);
                else sendMethodNotAllowed(httpExchange, "POST");
            } else if(path.equals("/")){
                if(isRead(method)) handleIndex(httpExchange);
                else sendMethodNotAllowed(httpExchange, "GET, HEAD");
            } else if(path.indexOf('/', 1) < 0){
                if(isRead(method)) handleGet(httpExchange, path.substring(1));
                else sendMethodNotAllowed(httpExchange, "GET, HEAD");
            } else {
                sendEmpty(httpExchange, 404);
            }
        } catch(IOException e){
            throw e;
        } catch(Exception e){
            logger.error("Unexpected error while handling " + httpExchange.getRequestURI(), e);
            sendJson(httpExchange, 500, JsonResponse.error("internal error"));
        } finally {
            httpExchange.close();
        }
    }

    /**
     * Consume a body this route ignores; the server drops keep-alive
     * connections whose request body was left unread.
     */
    private static void drainRequestBody(HttpExchange httpExchange) throws IOException {
        try(InputStream is = httpExchange.getRequestBody()){
            is.readNBytes(MAX_BODY_BYTES);
        }
    }

    private static boolean isRead(String method){
        return method.equals("GET") || method.equals("HEAD");
    }

    private void handlePut(HttpExchange httpExchange) throws IOException {
        byte[] body;
        try(InputStream is = httpExchange.getRequestBody()){
            body = is.readNBytes(MAX_BODY_BYTES + 1);
        }
        if(body.length > MAX_BODY_BYTES){
            sendJson(httpExchange, 413, JsonResponse.error("request body too large (max " + MAX_BODY_BYTES + " bytes)"));
            return;
        }

        String url;
        try {
            url = UrlValidator.validate(body);
        } catch(InvalidUrlException e){
            logger.info("Rejected put: " + e.getMessage());
            sendJson(httpExchange, 400, JsonResponse.error(e.getMessage()));
            return;
        }

        String code;
        try {
            code = store.put(url);
        } catch(StorageException e){
            logger.error("db error: " + e.getMessage(), e);
            sendJson(httpExchange, 500, JsonResponse.error(STORAGE_ERROR_MESSAGE));
            return;
        } catch(CodeSpaceExhaustedException e){
            logger.error("Code space exhausted: " + e.getMessage());
            sendJson(httpExchange, 500, JsonResponse.error(STORAGE_ERROR_MESSAGE));
            return;
        }

        logger.info("stored: " + code + " -> " + url);
        sendJson(httpExchange, 201, JsonResponse.ok(code));
    }

    private void handleGet(HttpExchange httpExchange, String code) throws IOException {
        if(!RandomCodeGenerator.isWellFormed(code)){
            sendEmpty(httpExchange, 404);
            return;
        }

        String url;
        try {
            url = store.get(code);
        } catch(StorageException e){
            logger.error("db error: " + e.getMessage(), e);
            sendJson(httpExchange, 500, JsonResponse.error(STORAGE_ERROR_MESSAGE));
            return;
        }

        if(url == null){
            logger.debug("Unknown code " + code);
            sendEmpty(httpExchange, 404);
            return;
        }

        logger.info("found code " + code + " -> " + url);
        httpExchange.getResponseHeaders().set("Location", url);
        sendEmpty(httpExchange, 308);
    }

    private void handleIndex(HttpExchange httpExchange) throws IOException {
        if(index == null){
            sendEmpty(httpExchange, 404);
            return;
        }

        byte[] content;
        try {
            content = Files.readAllBytes(index);
        } catch(IOException e){
            logger.warn("Could not read index file " + index + ": " + e.getMessage());
            sendEmpty(httpExchange, 404);
            return;
        }

        httpExchange.getResponseHeaders().set("Content-Type", HTML_CONTENT_TYPE);
        send(httpExchange, 200, content);
    }

    private void sendMethodNotAllowed(HttpExchange httpExchange, String allow) throws IOException {
        httpExchange.getResponseHeaders().set("Allow", allow);
        sendEmpty(httpExchange, 405);
    }

    private void sendJson(HttpExchange httpExchange, int status, JsonResponse response) throws IOException {
        httpExchange.getResponseHeaders().set("Content-Type", JSON_CONTENT_TYPE);
        send(httpExchange, status, response.toJson().getBytes(StandardCharsets.UTF_8));
    }

    private void sendEmpty(HttpExchange httpExchange, int status) throws IOException {
        httpExchange.sendResponseHeaders(status, -1);
    }

    private void send(HttpExchange httpExchange, int status, byte[] content) throws IOException {
        if(content.length == 0 || httpExchange.getRequestMethod().equals("HEAD")){
            httpExchange.sendResponseHeaders(status, -1);
            return;
        }
        httpExchange.sendResponseHeaders(status, content.length);
        OutputStream os = httpExchange.getResponseBody();
        os.write(content);
        os.flush();
    }
}
