package fpt.com.ehraccess.common.config;

import fpt.com.ehraccess.common.blob.BlobStore;
import fpt.com.ehraccess.common.blob.InMemoryBlobStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to an in-process store when the host application does not provide one.
 */
@Configuration
public class BlobStoreConfig {

    @Bean
    @ConditionalOnMissingBean(BlobStore.class)
    public BlobStore blobStore() {
        return new InMemoryBlobStore();
    }
}
