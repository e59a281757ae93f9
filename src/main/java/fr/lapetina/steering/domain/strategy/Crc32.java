package fr.lapetina.steering.domain.strategy;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * CRC-32 (IEEE) of a string's UTF-8 bytes, as an unsigned 32-bit value.
 */
final class Crc32 {

    private Crc32() {
        // Utility class
    }

    static long hash(String key) {
        CRC32 crc = new CRC32();
        crc.update((key == null ? "" : key).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
