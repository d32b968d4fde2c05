package hle.mcp.toolkit.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON form of {@link CacheEntry} used for persistent storage and for the
 * size estimate reported in cache statistics.
 */
class CacheEntryCodec {

    private static final Logger logger = LoggerFactory.getLogger(CacheEntryCodec.class);

    private final ObjectMapper mapper;

    CacheEntryCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    String encode(CacheEntry<?> entry) throws IOException {
        return mapper.writeValueAsString(entry);
    }

    <T> CacheEntry<T> decode(String json, Class<T> type) throws IOException {
        JavaType entryType = mapper.getTypeFactory().constructParametricType(CacheEntry.class, type);
        return mapper.readValue(json, entryType);
    }

    /**
     * Approximates the memory held by {@code data} as two bytes per character
     * of its JSON form.
     */
    long estimateSize(Object data) {
        try {
            return mapper.writeValueAsString(data).length() * 2L;
        } catch (JsonProcessingException e) {
            logger.warn("Could not estimate cache entry size: {}", e.getMessage());
            return 0;
        }
    }
}
