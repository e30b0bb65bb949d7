package com.aino.session;

import com.aino.http.Context;
import com.aino.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores the session as JSON in a cookie, with an HMAC-SHA256 signature in a second cookie.
 *
 * <p>The data is readable by the client but cannot be changed without invalidating the
 * signature. A session whose signature does not verify is discarded.</p>
 */
public class CookieSessionStorage implements SessionStorage {
    private static final Logger logger = LoggerFactory.getLogger(CookieSessionStorage.class);

    static final String SESSION_COOKIE = "_aino_session";
    static final String SIGNATURE_COOKIE = "_aino_session_signature";
    private static final String HMAC = "HmacSHA256";

    private final byte[] key;
    private final String salt;

    /**
     * Creates a signed cookie storage.
     *
     * @param key  the signing key, must not be empty
     * @param salt appended to the data before signing
     */
    public CookieSessionStorage(String key, String salt) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Session signing key must not be empty");
        }
        this.key = key.getBytes(StandardCharsets.UTF_8);
        this.salt = salt == null ? "" : salt;
    }

    /**
     * Computes the signature for the given session data.
     *
     * @param data the serialized session
     * @return base64 of HMAC-SHA256(key, data + salt)
     */
    public String signature(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(key, HMAC));
            byte[] digest = mac.doFinal((data + salt).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    @Override
    public Context decode(Context ctx) {
        Map<String, String> cookies = requireCookies(ctx);
        String data = cookies.get(SESSION_COOKIE);
        String signature = cookies.get(SIGNATURE_COOKIE);
        if (data == null || signature == null) {
            return ctx.session(new LinkedHashMap<>());
        }

        byte[] expected = signature(data).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8))) {
            logger.debug("Discarding session cookie with a bad signature");
            return ctx.session(new LinkedHashMap<>());
        }
        return ctx.session(parse(data));
    }

    @Override
    public Context encode(Context ctx) {
        String data = serialize(ctx.session());
        return ctx.responseHeader("Set-Cookie", cookie(SESSION_COOKIE, data))
                .responseHeader("Set-Cookie", cookie(SIGNATURE_COOKIE, signature(data)));
    }

    static Map<String, String> requireCookies(Context ctx) {
        if (ctx.cookies() == null) {
            throw new IllegalStateException("Cookies have not been processed yet");
        }
        return ctx.cookies();
    }

    static Map<String, Object> parse(String json) {
        try {
            Map<String, Object> session = JsonUtil.fromJsonMap(json);
            return session == null ? new LinkedHashMap<>() : new LinkedHashMap<>(session);
        } catch (JsonProcessingException e) {
            logger.debug("Discarding unreadable session data: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Serializes the session with a fresh {@code t} timestamp so every write changes.
     * The output holds no {@code ;}, so it survives as a single cookie value.
     */
    static String serialize(Map<String, Object> session) {
        Map<String, Object> data = session == null ? new LinkedHashMap<>() : new LinkedHashMap<>(session);
        data.put("t", Instant.now().toString());
        try {
            return JsonUtil.toCookieJson(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session holds a value that cannot be written as JSON", e);
        }
    }

    static String cookie(String name, String value) {
        return name + "=" + value + "; HttpOnly; Path=/";
    }
}
