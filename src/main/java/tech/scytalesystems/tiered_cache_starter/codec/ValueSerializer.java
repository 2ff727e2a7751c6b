package tech.scytalesystems.tiered_cache_starter.codec;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.util.CompressionUtil;

import java.io.IOException;
import java.util.Arrays;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 1045h
 * <p>
 * Turns cache values into the bytes stored in every tier and back.
 * <p>
 * Format:
 * <pre>
 * [format tag: 1 byte][body]
 *   0x00 RAW  : body is the JSON document
 *   0x01 GZIP : body is the GZIP compressed JSON document
 * </pre>
 * The JSON document carries the value's class ({@code @class}) so {@link #decode(byte[])}
 * rebuilds the same type. Values must be Jackson friendly: plain objects, records, mutable
 * collections, java.time types.
 * <p>
 * The body is compressed only when it is larger than the compression threshold and the
 * compressed form is smaller.
 */
public class ValueSerializer {
    private static final Logger log = LoggerFactory.getLogger(ValueSerializer.class);

    static final byte FORMAT_RAW = 0x00;
    static final byte FORMAT_GZIP = 0x01;

    private final GenericJackson2JsonRedisSerializer jsonSerializer;
    private final boolean compressionEnabled;
    private final int compressionThreshold;
    private final int compressionLevel;

    public ValueSerializer(TieredCacheProperties props) {
        this(props.isCompressionEnabled(), props.getLocal().getCompressionThreshold(), props.getCompressionLevel());
    }

    public ValueSerializer(boolean compressionEnabled, int compressionThreshold, int compressionLevel) {
        this.jsonSerializer = new GenericJackson2JsonRedisSerializer(objectMapper());
        this.compressionEnabled = compressionEnabled;
        this.compressionThreshold = compressionThreshold;
        this.compressionLevel = compressionLevel;
    }

    /**
     * Mapper used for stored values: java.time support and the value's class embedded in the document.
     */
    @SuppressWarnings("deprecation")
    static ObjectMapper objectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();

        mapper.activateDefaultTyping(mapper.getPolymorphicTypeValidator(),
                ObjectMapper.DefaultTyping.EVERYTHING, JsonTypeInfo.As.PROPERTY);

        return mapper;
    }

    /**
     * Encodes a value into tagged bytes.
     *
     * @throws CacheSerializationException if the value cannot be serialized
     */
    public byte[] encode(Object value) {
        if (value == null) throw new CacheSerializationException("Cannot encode a null value");

        byte[] json;
        try {
            json = jsonSerializer.serialize(value);
        } catch (SerializationException e) {
            throw new CacheSerializationException("Failed to serialize value of type " + value.getClass().getName(), e);
        }

        if (json == null) throw new CacheSerializationException("Serializer produced no bytes for " + value.getClass().getName());

        byte[] body = json;
        byte format = FORMAT_RAW;

        if (compressionEnabled) {
            try {
                byte[] compressed = CompressionUtil.compressIfSmaller(json, compressionThreshold, compressionLevel);

                if (compressed != null) {
                    body = compressed;
                    format = FORMAT_GZIP;
                }
            } catch (IOException e) {
                // The raw form is always valid
                log.warn("Compression failed for value of type {}, storing uncompressed: {}",
                        value.getClass().getName(), e.getMessage());
            }
        }

        byte[] encoded = new byte[body.length + 1];
        encoded[0] = format;
        System.arraycopy(body, 0, encoded, 1, body.length);

        if (log.isTraceEnabled()) {
            log.trace("Encoded {}: {} → {} ({})", value.getClass().getSimpleName(),
                    CompressionUtil.formatSize(json.length), CompressionUtil.formatSize(encoded.length),
                    format == FORMAT_GZIP ? "gzip" : "raw");
        }

        return encoded;
    }

    /**
     * Rebuilds the value written by {@link #encode(Object)}.
     *
     * @throws CacheSerializationException if the bytes are empty, carry an unknown tag or are corrupt
     */
    public Object decode(byte[] encoded) {
        if (encoded == null || encoded.length < 2) {
            throw new CacheSerializationException("Encoded value is empty or truncated");
        }

        byte[] body = Arrays.copyOfRange(encoded, 1, encoded.length);

        byte[] json;
        switch (encoded[0]) {
            case FORMAT_RAW -> json = body;
            case FORMAT_GZIP -> {
                try {
                    json = CompressionUtil.decompress(body);
                } catch (IOException e) {
                    throw new CacheSerializationException("Corrupt compressed value (" + body.length + " bytes)", e);
                }
            }
            default -> throw new CacheSerializationException("Unknown value format tag: " + encoded[0]);
        }

        try {
            return jsonSerializer.deserialize(json);
        } catch (SerializationException e) {
            throw new CacheSerializationException("Failed to deserialize value (" + json.length + " bytes)", e);
        }
    }

    /**
     * @return true when the encoded bytes carry a compressed body
     */
    public static boolean isCompressed(byte[] encoded) {
        return encoded != null && encoded.length > 0 && encoded[0] == FORMAT_GZIP;
    }
}
