package tech.scytalesystems.tiered_cache_starter.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 24/11/2025
 * Time 1010h
 */
@DisplayName("CompressionUtil Tests")
class CompressionUtilTest {

    @Test
    @DisplayName("Should compress and decompress byte array correctly")
    void testCompressDecompressByteArray() throws IOException {
        byte[] original = "{\"namespace\":\"users\",\"keys\":[\"user:1\",\"user:2\",\"user:3\"]}".repeat(20)
                .getBytes(StandardCharsets.UTF_8);

        byte[] compressed = CompressionUtil.compress(original, 3);
        byte[] decompressed = CompressionUtil.decompress(compressed);

        assertArrayEquals(original, decompressed);
        assertTrue(compressed.length < original.length);
    }

    @Test
    @DisplayName("Should handle empty byte array")
    void testEmptyByteArray() throws IOException {
        assertEquals(0, CompressionUtil.compress(new byte[0], 3).length);
        assertEquals(0, CompressionUtil.decompress(new byte[0]).length);
    }

    @Test
    @DisplayName("Should throw exception for null input")
    void testNullInput() {
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(null, 3));
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.decompress(null));
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compressIfSmaller(null, 0, 3));
    }

    @Test
    @DisplayName("Should reject compression levels outside 1..9")
    void testInvalidLevel() {
        byte[] data = "data".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(data, 0));
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(data, 10));
    }

    @Test
    @DisplayName("Should compress at every valid level and reject others")
    void testLevels() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 1000; i++) {
            sb.append("user:").append(i).append(",");
        }
        byte[] original = sb.toString().getBytes(StandardCharsets.UTF_8);

        byte[] fast = CompressionUtil.compress(original, 1);
        byte[] best = CompressionUtil.compress(original, 9);

        assertTrue(fast.length < original.length);
        assertTrue(best.length < original.length);
        assertArrayEquals(original, CompressionUtil.decompress(fast));
        assertArrayEquals(original, CompressionUtil.decompress(best));
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(original, 0));
        assertThrows(IllegalArgumentException.class, () -> CompressionUtil.compress(original, 10));
    }

    @Test
    @DisplayName("Should skip payloads at or below the threshold")
    void testCompressIfSmallerBelowThreshold() throws IOException {
        byte[] data = "x".repeat(100).getBytes(StandardCharsets.UTF_8);

        assertNull(CompressionUtil.compressIfSmaller(data, 100, 3));
        assertNotNull(CompressionUtil.compressIfSmaller(data, 99, 3));
    }

    @Test
    @DisplayName("Should skip payloads that do not shrink")
    void testCompressIfSmallerIncompressible() throws IOException {
        byte[] data = new byte[64];
        new Random(42).nextBytes(data);

        assertNull(CompressionUtil.compressIfSmaller(data, 0, 9));
    }

    @Test
    @DisplayName("Should fail on data that is not GZIP")
    void testDecompressInvalid() {
        assertThrows(IOException.class, () -> CompressionUtil.decompress(new byte[]{1, 2, 3, 4}));
    }

    @Test
    @DisplayName("Should format sizes correctly")
    void testFormatSize() {
        assertEquals("500 B", CompressionUtil.formatSize(500));
        assertTrue(CompressionUtil.formatSize(1536).endsWith(" KB"));
        assertTrue(CompressionUtil.formatSize(1024 * 1024).endsWith(" MB"));
        assertTrue(CompressionUtil.formatSize(1024L * 1024 * 1024).endsWith(" GB"));
    }
}
