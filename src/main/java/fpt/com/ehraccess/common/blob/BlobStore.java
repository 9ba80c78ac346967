package fpt.com.ehraccess.common.blob;

/**
 * Content-addressed storage for the documents that record entries point at.
 * Implementations never overwrite: putting the same bytes twice yields the same hash.
 */
public interface BlobStore {

    String put(byte[] content);

    /**
     * @throws fpt.com.ehraccess.common.exception.NotFoundException when nothing is stored under the hash
     */
    byte[] get(String contentHash);
}
