package io.bridged.capability.crypto;

import io.bridged.model.BridgeException;

import java.util.Arrays;
import java.util.Locale;

enum CipherAlgorithm {
    AES("AES", "AES", 16),
    BLOWFISH("Blowfish", "Blowfish", 8),
    DES("DES", "DES", 8),
    TRIPLE_DES("3DES", "DESede", 8);

    private final String displayName;
    private final String jcaName;
    private final int blockSize;

    CipherAlgorithm(String displayName, String jcaName, int blockSize) {
        this.displayName = displayName;
        this.jcaName = jcaName;
        this.blockSize = blockSize;
    }

    String displayName() {
        return displayName;
    }

    String jcaName() {
        return jcaName;
    }

    String transformation() {
        return jcaName + "/CBC/PKCS5Padding";
    }

    int blockSize() {
        return blockSize;
    }

    static CipherAlgorithm fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOWFISH;
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "AES":
            case "RIJNDAEL":
                return AES;
            case "BLOWFISH":
                return BLOWFISH;
            case "DES":
                return DES;
            case "3DES":
            case "DESEDE":
            case "TRIPLEDES":
            case "DES_EDE3":
                return TRIPLE_DES;
            default:
                throw BridgeException.validation("unsupported cipher: " + raw);
        }
    }

    /**
     * Fits raw key material to a length the algorithm accepts: AES pads with zeros to the next
     * of 16/24/32 bytes and truncates past 32, Blowfish takes 4 to 56 bytes, DES 8, 3DES 24.
     */
    byte[] sizeKey(byte[] raw) {
        switch (this) {
            case AES:
                if (raw.length <= 16) {
                    return Arrays.copyOf(raw, 16);
                }
                if (raw.length <= 24) {
                    return Arrays.copyOf(raw, 24);
                }
                return Arrays.copyOf(raw, 32);
            case BLOWFISH:
                if (raw.length < 4) {
                    return Arrays.copyOf(raw, 4);
                }
                return raw.length > 56 ? Arrays.copyOf(raw, 56) : raw.clone();
            case DES:
                return Arrays.copyOf(raw, 8);
            default:
                if (raw.length == 16) {
                    // Two-key 3DES: K1 K2 K1.
                    byte[] out = Arrays.copyOf(raw, 24);
                    System.arraycopy(raw, 0, out, 16, 8);
                    return out;
                }
                return Arrays.copyOf(raw, 24);
        }
    }
}
