package com.codeheadsystems.credvault.crypto;

import com.codeheadsystems.credvault.crypto.exception.ConfigurationException;
import com.codeheadsystems.credvault.crypto.exception.DecryptionException;
import com.codeheadsystems.credvault.crypto.exception.EncryptionException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope encryption of credentials, bound to the identity that owns them.
 * <p>
 * Each call to {@link #encrypt} draws a fresh salt and IV, derives a one-off AES-256 key from
 * the master secret with PBKDF2-HMAC-SHA256, and seals the plaintext with AES-256-GCM using
 * the owning identity as additional authenticated data. The derived key lives only for the
 * duration of the call.
 * <p>
 * The master secret is copied at construction and never mutated, so a single instance is
 * safe to share between threads.
 */
public class EnvelopeEncryptor {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeEncryptor.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  /**
   * Minimum master secret length in bytes (256 bits).
   */
  public static final int MIN_MASTER_KEY_BYTES = 32;

  /**
   * Default and minimum PBKDF2 iteration count.
   */
  public static final int DEFAULT_ITERATIONS = 100_000;

  public static final int SALT_BYTES = 16;
  public static final int IV_BYTES = 12;

  private static final int KEY_BITS = 256;
  private static final int TAG_BITS = 128;

  private final byte[] masterKey;
  private final int iterations;
  private final RandomProvider randomProvider;

  /**
   * Creates an encryptor with the default iteration count and a default {@link RandomProvider}.
   *
   * @param masterKey the raw master secret, at least {@value #MIN_MASTER_KEY_BYTES} bytes
   * @throws ConfigurationException if the secret is missing or too short
   */
  public EnvelopeEncryptor(byte[] masterKey) {
    this(masterKey, DEFAULT_ITERATIONS, new RandomProvider());
  }

  /**
   * Creates an encryptor.
   *
   * @param masterKey      the raw master secret, at least {@value #MIN_MASTER_KEY_BYTES} bytes
   * @param iterations     PBKDF2 iterations, at least {@value #DEFAULT_ITERATIONS}
   * @param randomProvider source of salts and IVs
   * @throws ConfigurationException if the secret is missing or too short, or the iteration
   *                                count is below the minimum
   */
  public EnvelopeEncryptor(byte[] masterKey, int iterations, RandomProvider randomProvider) {
    if (masterKey == null || masterKey.length == 0) {
      throw new ConfigurationException("Encryption master key is required");
    }
    if (masterKey.length < MIN_MASTER_KEY_BYTES) {
      throw new ConfigurationException(
          "Encryption master key must be at least " + MIN_MASTER_KEY_BYTES + " bytes (256 bits)");
    }
    if (iterations < DEFAULT_ITERATIONS) {
      throw new ConfigurationException(
          "PBKDF2 iteration count must be at least " + DEFAULT_ITERATIONS);
    }
    this.masterKey = masterKey.clone();
    this.iterations = iterations;
    this.randomProvider = Objects.requireNonNull(randomProvider, "randomProvider");
    log.info("EnvelopeEncryptor(iterations={})", iterations);
  }

  /**
   * Creates an encryptor from a base64-encoded master secret.
   *
   * @param masterKeyBase64 the standard-base64 master secret
   * @return the encryptor
   * @throws ConfigurationException if the value is blank, not base64, or decodes to fewer than
   *                                {@value #MIN_MASTER_KEY_BYTES} bytes
   */
  public static EnvelopeEncryptor fromBase64(String masterKeyBase64) {
    if (masterKeyBase64 == null || masterKeyBase64.isBlank()) {
      throw new ConfigurationException("Encryption master key is required");
    }
    byte[] decoded;
    try {
      decoded = B64D.decode(masterKeyBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid encryption master key format: not base64", e);
    }
    try {
      return new EnvelopeEncryptor(decoded);
    } finally {
      Arrays.fill(decoded, (byte) 0);
    }
  }

  /**
   * Encrypts {@code plaintext} for {@code identity}.
   *
   * @param plaintext the secret to protect
   * @param identity  the owner, bound into the ciphertext as AAD
   * @return base64-encoded ciphertext, IV and salt; all three differ on every call
   * @throws EncryptionException if the cipher fails unexpectedly
   */
  public EncryptedPayload encrypt(String plaintext, String identity) {
    Objects.requireNonNull(plaintext, "plaintext");
    Objects.requireNonNull(identity, "identity");
    byte[] salt = randomProvider.randomBytes(SALT_BYTES);
    byte[] iv = randomProvider.randomBytes(IV_BYTES);
    byte[] key = deriveKey(salt);
    byte[] input = plaintext.getBytes(StandardCharsets.UTF_8);
    try {
      byte[] ciphertext = gcm(true, key, iv, aad(identity), input);
      return new EncryptedPayload(
          B64.encodeToString(ciphertext), B64.encodeToString(iv), B64.encodeToString(salt));
    } catch (InvalidCipherTextException | RuntimeException e) {
      throw new EncryptionException("Encryption failed", e);
    } finally {
      Arrays.fill(key, (byte) 0);
      Arrays.fill(input, (byte) 0);
    }
  }

  /**
   * Decrypts a payload produced by {@link #encrypt} for the same identity.
   *
   * @param payload  the stored payload
   * @param identity the owner the payload was encrypted for
   * @return the plaintext
   * @throws DecryptionException for any failure, including an identity mismatch
   */
  public String decrypt(EncryptedPayload payload, String identity) {
    Objects.requireNonNull(identity, "identity");
    if (payload == null
        || payload.ciphertext() == null || payload.iv() == null || payload.salt() == null) {
      throw new DecryptionException();
    }
    byte[] key = null;
    try {
      byte[] ciphertext = B64D.decode(payload.ciphertext());
      byte[] iv = B64D.decode(payload.iv());
      byte[] salt = B64D.decode(payload.salt());
      if (iv.length != IV_BYTES || salt.length != SALT_BYTES) {
        throw new DecryptionException();
      }
      key = deriveKey(salt);
      byte[] plaintext = gcm(false, key, iv, aad(identity), ciphertext);
      try {
        return new String(plaintext, StandardCharsets.UTF_8);
      } finally {
        Arrays.fill(plaintext, (byte) 0);
      }
    } catch (DecryptionException e) {
      throw e;
    } catch (InvalidCipherTextException | RuntimeException e) {
      throw new DecryptionException(e);
    } finally {
      if (key != null) {
        Arrays.fill(key, (byte) 0);
      }
    }
  }

  private byte[] deriveKey(byte[] salt) {
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(masterKey, salt, iterations);
    KeyParameter derived = (KeyParameter) generator.generateDerivedParameters(KEY_BITS);
    return derived.getKey();
  }

  private static byte[] gcm(boolean forEncryption, byte[] key, byte[] iv, byte[] aad, byte[] input)
      throws InvalidCipherTextException {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_BITS, iv, aad));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int len = cipher.processBytes(input, 0, input.length, out, 0);
    len += cipher.doFinal(out, len);
    return len == out.length ? out : Arrays.copyOf(out, len);
  }

  private static byte[] aad(String identity) {
    return identity.getBytes(StandardCharsets.UTF_8);
  }
}
