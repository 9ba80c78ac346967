package fpt.com.ehraccess.common.blob;

import fpt.com.ehraccess.common.exception.ErrorCode;
import fpt.com.ehraccess.common.exception.NotFoundException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public String put(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
        String hash = sha256(content);
        blobs.putIfAbsent(hash, content.clone());
        return hash;
    }

    @Override
    public byte[] get(String contentHash) {
        byte[] content = contentHash == null ? null : blobs.get(contentHash);
        if (content == null) {
            throw new NotFoundException(ErrorCode.NOT_FOUND, "contentHash");
        }
        return content.clone();
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
