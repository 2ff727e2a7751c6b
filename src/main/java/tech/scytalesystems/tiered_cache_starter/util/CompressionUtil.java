package tech.scytalesystems.tiered_cache_starter.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1002h
 * <p>
 * GZIP compression for cache payloads.
 * <p>
 * Used in two places:
 * - {@code ValueSerializer} compresses encoded values before they are written to any tier
 * - {@code L1CacheStore} compresses large payloads it keeps in memory
 * <p>
 * Compression is only kept when it makes the payload smaller; callers use
 * {@link #compressIfSmaller(byte[], int, int)} for that decision.
 * <p>
 * Thread Safety: All methods are stateless and thread-safe
 */
public final class CompressionUtil {
    private static final Logger log = LoggerFactory.getLogger(CompressionUtil.class);

    // Buffer size for streaming operations
    private static final int BUFFER_SIZE = 4096;

    private CompressionUtil() {
    }

    /**
     * Compresses a byte array using GZIP at the given deflate level.
     *
     * @param data  the data to compress
     * @param level deflate level, 1 (fastest) to 9 (smallest)
     * @return GZIP compressed byte array
     * @throws IOException if compression fails
     * @throws IllegalArgumentException if input is null or level is out of range
     */
    public static byte[] compress(byte[] data, int level) throws IOException {
        if (data == null) throw new IllegalArgumentException("Input data cannot be null");

        if (level < Deflater.BEST_SPEED || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level must be between 1 and 9: " + level);
        }

        if (data.length == 0) return new byte[0];

        ByteArrayOutputStream byteOutput = new ByteArrayOutputStream(data.length);

        try (GZIPOutputStream gzipOutput = new LeveledGzipOutputStream(byteOutput, level)) {
            gzipOutput.write(data);
            gzipOutput.finish();
        }

        byte[] result = byteOutput.toByteArray();

        if (log.isTraceEnabled()) {
            log.trace("Compressed byte array: {} bytes → {} bytes ({}% reduction)",
                    data.length, result.length, 100 - (result.length * 100L / data.length));
        }

        return result;
    }

    /**
     * Decompresses a GZIP-compressed byte array.
     *
     * @param compressed the compressed data
     * @return decompressed byte array
     * @throws IOException if the data is not valid GZIP
     * @throws IllegalArgumentException if input is null
     */
    public static byte[] decompress(byte[] compressed) throws IOException {
        if (compressed == null) throw new IllegalArgumentException("Input data cannot be null");

        if (compressed.length == 0) return new byte[0];

        try (ByteArrayInputStream byteInput = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipInput = new GZIPInputStream(byteInput);
             ByteArrayOutputStream byteOutput = new ByteArrayOutputStream(compressed.length * 2)) {

            // Read decompressed data in chunks
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;

            while ((bytesRead = gzipInput.read(buffer)) != -1) {
                byteOutput.write(buffer, 0, bytesRead);
            }

            byte[] result = byteOutput.toByteArray();

            if (log.isTraceEnabled()) {
                log.trace("Decompressed byte array: {} bytes → {} bytes", compressed.length, result.length);
            }

            return result;
        }
    }

    /**
     * Compresses {@code data} when it is larger than {@code threshold} and the compressed
     * form is strictly smaller.
     *
     * @return the compressed bytes, or {@code null} when the original bytes should be kept
     * @throws IOException if compression fails
     */
    public static byte[] compressIfSmaller(byte[] data, int threshold, int level) throws IOException {
        if (data == null) throw new IllegalArgumentException("Input data cannot be null");

        if (data.length <= threshold) return null;

        byte[] compressed = compress(data, level);

        if (compressed.length >= data.length) {
            log.trace("Compression rejected: {} bytes would become {} bytes", data.length, compressed.length);
            return null;
        }

        return compressed;
    }

    /**
     * Returns human-readable size string.
     *
     * @param bytes size in bytes
     * @return formatted string (e.g., "1.5 KB", "2.3 MB")
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        } else if (bytes < 1024 * 1024) {
            return String.format("%.2f KB", bytes / 1024.0);
        } else if (bytes < 1024 * 1024 * 1024) {
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        } else {
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out, BUFFER_SIZE);
            def.setLevel(level);
        }
    }
}
