package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.DecryptionError;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * AES-256-CBC payload cipher compatible with the service's legacy publishers.
 * <p>
 * The key is the first 32 characters of the lowercase hex SHA-256 of the cipher key.
 * With a random IV the wire layout is: iv(16) || ciphertext; otherwise the fixed IV
 * "0123456789012345" is used and only the ciphertext is sent.
 */
public final class LegacyCipher implements PayloadCipher {

    /** AES block and IV size in bytes */
    static final int BLOCK_SIZE = 16;

    /** derived key size in bytes (256 bits) */
    static final int KEY_SIZE = 32;

    private static final byte[] FIXED_IV = "0123456789012345".getBytes(StandardCharsets.UTF_8);
    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";

    private final SecretKeySpec keySpec;
    private final boolean randomIv;
    private final SecureRandom random;

    /**
     * Creates a new cipher.
     *
     * @param cipherKey the shared passphrase
     * @param randomIv  true if the IV is generated per message and sent as a prefix
     * @throws BeaconException if cipherKey is empty
     */
    public LegacyCipher(String cipherKey, boolean randomIv) {
        if (cipherKey == null || cipherKey.isEmpty()) {
            throw new BeaconException("cipherKey cannot be empty");
        }
        this.keySpec = new SecretKeySpec(deriveKey(cipherKey), "AES");
        this.randomIv = randomIv;
        this.random = new SecureRandom();
    }

    @Override
    public byte[] encrypt(byte[] plaintext) {
        try {
            byte[] iv = FIXED_IV;
            if (randomIv) {
                iv = new byte[BLOCK_SIZE];
                random.nextBytes(iv);
            }

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keySpec, new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plaintext);
            if (!randomIv) {
                return ciphertext;
            }

            byte[] combined = new byte[BLOCK_SIZE + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, BLOCK_SIZE);
            System.arraycopy(ciphertext, 0, combined, BLOCK_SIZE, ciphertext.length);
            return combined;
        } catch (GeneralSecurityException e) {
            throw new BeaconException("encryption failed: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] decrypt(byte[] data) {
        if (data == null) {
            throw new DecryptionError("ciphertext cannot be null");
        }

        byte[] iv = FIXED_IV;
        int offset = 0;
        if (randomIv) {
            if (data.length < BLOCK_SIZE) {
                throw new DecryptionError("invalid payload: missing IV");
            }
            iv = new byte[BLOCK_SIZE];
            System.arraycopy(data, 0, iv, 0, BLOCK_SIZE);
            offset = BLOCK_SIZE;
        }

        int length = data.length - offset;
        if (length == 0 || length % BLOCK_SIZE != 0) {
            throw new DecryptionError("invalid payload: ciphertext length " + length);
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keySpec, new IvParameterSpec(iv));
            return cipher.doFinal(data, offset, length);
        } catch (GeneralSecurityException e) {
            throw new DecryptionError("decryption failed: wrong key or corrupted data", e);
        }
    }

    static byte[] deriveKey(String cipherKey) {
        byte[] input = cipherKey.getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        // hex is 64 chars, the service uses the first 32 as raw key bytes
        String hex = Hex.toHexString(hash);
        return hex.substring(0, KEY_SIZE).getBytes(StandardCharsets.US_ASCII);
    }
}
