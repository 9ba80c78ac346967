package fpt.com.ehraccess.domain.accesslog.service;

import fpt.com.ehraccess.common.constants.Constants;
import fpt.com.ehraccess.domain.accesslog.entity.AccessAction;
import fpt.com.ehraccess.domain.accesslog.entity.AccessLogEntry;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 over the entry's fields plus the previous entry's hash.
 */
@Component
public class AccessLogChainHasher {

    public static final String GENESIS_HASH = "0".repeat(64);

    public String hash(Long recordId, int sequenceNo, String accessor, AccessAction action, String context,
                       Instant occurredAt, Instant timestamp, String previousHash) {
        String data = String.format(Locale.ROOT, "%s|%d|%s|%s|%s|%s|%s|%s",
                recordId,
                sequenceNo,
                accessor,
                action == null ? "" : action.name(),
                context == null ? "" : context,
                occurredAt == null ? "" : occurredAt.toString(),
                timestamp == null ? "" : timestamp.toString(),
                previousHash == null ? "" : previousHash);
        return sha256(data);
    }

    public String hash(AccessLogEntry entry) {
        return hash(entry.getRecordId(), entry.getSequenceNo(), entry.getAccessorAddress(), entry.getAction(),
                entry.getContext(), entry.getOccurredAt(), entry.getTimestamp(), entry.getPreviousHash());
    }

    /**
     * Caller context as it is stored and hashed. Anything longer than its column keeps a prefix and
     * ends with {@code #} plus the SHA-256 of the full value, so distinct contexts stay distinct.
     */
    public static String boundContext(String context) {
        if (context == null || context.length() <= Constants.MAX_CONTEXT_LENGTH) {
            return context;
        }
        String digest = sha256(context);
        int keep = Constants.MAX_CONTEXT_LENGTH - digest.length() - 1;
        // never cut a surrogate pair in half
        if (Character.isHighSurrogate(context.charAt(keep - 1))) {
            keep--;
        }
        return context.substring(0, keep) + "#" + digest;
    }

    private static String sha256(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
