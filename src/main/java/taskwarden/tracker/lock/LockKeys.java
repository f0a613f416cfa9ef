package taskwarden.tracker.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds lock keys from a logical lock name and an optional scoping value.
 * {@code of("send_report")} gives {@code send_report};
 * {@code scoped("send_report", "user", 42)} gives {@code send_report:user=42}.
 */
public final class LockKeys {

    private static final Logger log = LoggerFactory.getLogger(LockKeys.class);

    /** Scope values longer than this are replaced by a digest. */
    static final int MAX_SCOPE_VALUE_LENGTH = 200;

    private LockKeys() {
    }

    public static String of(String lockName) {
        if (lockName == null || lockName.isBlank()) {
            throw new IllegalArgumentException("lockName is required");
        }
        return lockName;
    }

    /**
     * Key isolating runs per scope value, so the same lock name can be held
     * concurrently for different values but only once per value.
     * A null or blank value falls back to the bare lock name.
     */
    public static String scoped(String lockName, String scopeParam, Object scopeValue) {
        String base = of(lockName);
        if (scopeParam == null || scopeParam.isBlank()) {
            throw new IllegalArgumentException("scopeParam is required");
        }
        String value = scopeValue == null ? null : scopeValue.toString();
        if (value == null || value.isBlank()) {
            log.warn("No value for lock scope {}, using lock name {}", scopeParam, base);
            return base;
        }
        if (value.length() > MAX_SCOPE_VALUE_LENGTH) {
            return base + ":" + scopeParam + "#" + md5Prefix(value);
        }
        return base + ":" + scopeParam + "=" + value;
    }

    private static String md5Prefix(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
