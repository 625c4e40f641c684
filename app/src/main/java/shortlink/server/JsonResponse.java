package shortlink.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Body of every JSON answer: {@code {"ok": ..., "msg": ...}}. On success
 * {@code msg} is the code, otherwise the reason.
 */
public class JsonResponse {
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private final boolean ok;
    private final String msg;

    private JsonResponse(boolean ok, String msg){
        this.ok = ok;
        this.msg = msg;
    }

    public static JsonResponse ok(String msg){
        return new JsonResponse(true, msg);
    }

    public static JsonResponse error(String msg){
        return new JsonResponse(false, msg);
    }

    public static JsonResponse fromJson(String json){
        return gson.fromJson(json, JsonResponse.class);
    }

    public boolean isOk() {
        return ok;
    }

    public String getMsg() {
        return msg;
    }

    public String toJson(){
        return gson.toJson(this);
    }
}
