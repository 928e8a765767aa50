package com.codeheadsystems.credvault.crypto;

import java.security.SecureRandom;

/**
 * Injectable source of the salts and IVs used by {@link EnvelopeEncryptor}.
 * <p>
 * Every call draws fresh bytes; nothing is cached between encryptions.
 *
 * @param random the secure random backing this provider
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a provider backed by a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Returns {@code len} fresh random bytes.
   *
   * @param len the number of bytes
   * @return a new array filled from the secure random
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }
}
