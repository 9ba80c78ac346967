package fpt.com.ehraccess.common.blob;

import fpt.com.ehraccess.common.exception.NotFoundException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBlobStoreTest {

    private final InMemoryBlobStore store = new InMemoryBlobStore();

    @Test
    void sameContentGivesSameAddress() {
        byte[] content = "lab result".getBytes(StandardCharsets.UTF_8);

        String first = store.put(content);
        String second = store.put(content.clone());

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertArrayEquals(content, store.get(first));
    }

    @Test
    void storedContentIsCopied() {
        byte[] content = "x-ray".getBytes(StandardCharsets.UTF_8);
        String hash = store.put(content);

        content[0] = 'X';
        store.get(hash)[1] = 'Y';

        assertEquals("x-ray", new String(store.get(hash), StandardCharsets.UTF_8));
    }

    @Test
    void unknownHashIsNotFound() {
        assertThrows(NotFoundException.class, () -> store.get("deadbeef"));
        assertThrows(NotFoundException.class, () -> store.get(null));
    }
}
