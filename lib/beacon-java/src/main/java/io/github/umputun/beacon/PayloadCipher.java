package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.DecryptionError;

/**
 * Encrypts and decrypts published payloads.
 */
public interface PayloadCipher {

    /**
     * Encrypts raw bytes.
     *
     * @param plaintext the data to encrypt
     * @return ciphertext in the cipher's wire layout
     */
    byte[] encrypt(byte[] plaintext);

    /**
     * Decrypts raw bytes.
     *
     * @param ciphertext data produced by {@link #encrypt(byte[])} or a compatible publisher
     * @return the plaintext
     * @throws DecryptionError if the data cannot be decrypted
     */
    byte[] decrypt(byte[] ciphertext);
}
