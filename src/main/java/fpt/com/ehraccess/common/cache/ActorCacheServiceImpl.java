package fpt.com.ehraccess.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import fpt.com.ehraccess.domain.identity.dto.ActorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

@Service
public class ActorCacheServiceImpl implements ActorCacheService {

    private static final Logger log = LoggerFactory.getLogger(ActorCacheServiceImpl.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final long ttlSeconds;
    private final String keyPrefix;

    public ActorCacheServiceImpl(StringRedisTemplate redis,
                                 ObjectMapper objectMapper,
                                 @Value("${app.cache.actors.enabled:true}") boolean enabled,
                                 @Value("${app.cache.actors.ttl-seconds:900}") long ttlSeconds,
                                 @Value("${app.cache.key-prefix:ehr}") String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.ttlSeconds = ttlSeconds;
        this.keyPrefix = (keyPrefix == null || keyPrefix.isBlank()) ? "ehr" : keyPrefix.trim();
    }

    @Override
    public Optional<ActorResponse> get(String address) {
        if (!enabled || address == null || address.isBlank()) return Optional.empty();
        try {
            String v = redis.opsForValue().get(buildKey(address));
            if (v == null || v.isBlank()) return Optional.empty();
            return Optional.of(objectMapper.readValue(v, ActorResponse.class));
        } catch (Exception ex) {
            log.warn("Actor cache read failed for {}, falling back to store: {}", address, ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(ActorResponse actor) {
        if (!enabled || actor == null || !actor.isRegistered()) return;
        try {
            String value = objectMapper.writeValueAsString(actor);
            if (ttlSeconds > 0) {
                redis.opsForValue().set(buildKey(actor.getAddress()), value, Duration.ofSeconds(ttlSeconds));
            } else {
                redis.opsForValue().set(buildKey(actor.getAddress()), value);
            }
        } catch (Exception ex) {
            log.warn("Actor cache write failed for {}: {}", actor.getAddress(), ex.getMessage());
        }
    }

    String buildKey(String address) {
        String p = keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":";
        return p + "actor:" + address;
    }
}
