package tech.scytalesystems.tiered_cache_starter.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1210h
 * <p>Derives a deterministic cache key from an operation name and its named arguments.
 *
 * <p>Flow:
 * <p>1. Sort arguments by name, so argument order never changes the key
 * <p>2. Encode each value as JSON with map entries and properties sorted
 * <p>3. Join as {@code operation:name=value:...}
 * <p>4. MD5 the result to a 32 character hex key
 */
public final class CacheKeyGenerator {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private CacheKeyGenerator() {
    }

    public static String generate(String operation, Map<String, ?> arguments) {
        if (operation == null || operation.isBlank()) throw new IllegalArgumentException("Operation name cannot be blank");

        StringJoiner parts = new StringJoiner(CacheKeys.SEPARATOR);
        parts.add(operation);

        if (arguments != null) {
            new TreeMap<>(arguments).forEach((name, value) -> parts.add(name + "=" + encode(value)));
        }

        return DigestUtils.md5DigestAsHex(parts.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Argument cannot be encoded into a cache key: " + value, e);
        }
    }
}
