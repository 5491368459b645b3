package io.bridged.capability.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Block cipher in CBC mode with PKCS#5 padding. Output is the random IV followed by the
 * ciphertext.
 */
final class CipherContext implements AutoCloseable {
    private final CipherAlgorithm algorithm;
    private final byte[] keyBytes;
    private final SecretKeySpec key;
    private final SecureRandom secureRandom;

    CipherContext(CipherAlgorithm algorithm, byte[] rawKey, SecureRandom secureRandom) {
        this.algorithm = algorithm;
        this.keyBytes = algorithm.sizeKey(rawKey);
        this.key = new SecretKeySpec(keyBytes, algorithm.jcaName());
        this.secureRandom = secureRandom;
    }

    CipherAlgorithm algorithm() {
        return algorithm;
    }

    int keyLength() {
        return keyBytes.length;
    }

    byte[] encrypt(byte[] plaintext) throws GeneralSecurityException {
        byte[] iv = new byte[algorithm.blockSize()];
        secureRandom.nextBytes(iv);
        Cipher cipher = Cipher.getInstance(algorithm.transformation());
        cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
        byte[] body = cipher.doFinal(plaintext);
        byte[] out = new byte[iv.length + body.length];
        System.arraycopy(iv, 0, out, 0, iv.length);
        System.arraycopy(body, 0, out, iv.length, body.length);
        return out;
    }

    byte[] decrypt(byte[] ivAndCiphertext) throws GeneralSecurityException {
        int blockSize = algorithm.blockSize();
        if (ivAndCiphertext.length < blockSize * 2 || ivAndCiphertext.length % blockSize != 0) {
            throw new GeneralSecurityException(
                    "Ciphertext length " + ivAndCiphertext.length + " is not valid for " + algorithm.displayName());
        }
        Cipher cipher = Cipher.getInstance(algorithm.transformation());
        cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(ivAndCiphertext, 0, blockSize));
        return cipher.doFinal(ivAndCiphertext, blockSize, ivAndCiphertext.length - blockSize);
    }

    @Override
    public void close() {
        Arrays.fill(keyBytes, (byte) 0);
    }
}
