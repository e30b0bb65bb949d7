package com.aino.session;

import com.aino.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;

/**
 * Stores the session as AES-256-GCM encrypted JSON in a single cookie. The client can neither
 * read nor modify the data.
 */
public class EncryptedCookieSessionStorage implements SessionStorage {
    private static final Logger logger = LoggerFactory.getLogger(EncryptedCookieSessionStorage.class);

    private final byte[] key;

    /**
     * @param key the 32 byte AES key
     * @throws IllegalArgumentException if the key is not 32 bytes long
     */
    public EncryptedCookieSessionStorage(byte[] key) {
        AesGcm.checkKey(key);
        this.key = key.clone();
    }

    @Override
    public Context decode(Context ctx) {
        String blob = CookieSessionStorage.requireCookies(ctx).get(CookieSessionStorage.SESSION_COOKIE);
        if (blob == null) {
            return ctx.session(new LinkedHashMap<>());
        }
        try {
            return ctx.session(CookieSessionStorage.parse(AesGcm.decrypt(blob, key)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            logger.debug("Discarding session cookie that failed to decrypt: {}", e.getMessage());
            return ctx.session(new LinkedHashMap<>());
        }
    }

    @Override
    public Context encode(Context ctx) {
        String data = CookieSessionStorage.serialize(ctx.session());
        try {
            String blob = AesGcm.encrypt(data, key);
            return ctx.responseHeader("Set-Cookie", CookieSessionStorage.cookie(CookieSessionStorage.SESSION_COOKIE, blob));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt session", e);
        }
    }
}
