package com.codeheadsystems.credvault.crypto;

/**
 * Output of {@link EnvelopeEncryptor#encrypt} and input of {@link EnvelopeEncryptor#decrypt}.
 * All three fields are standard base64. The GCM authentication tag is appended to the
 * ciphertext.
 *
 * @param ciphertext the AES-GCM ciphertext including the tag
 * @param iv         the 12-byte GCM nonce
 * @param salt       the 16-byte PBKDF2 salt
 */
public record EncryptedPayload(String ciphertext, String iv, String salt) {

  @Override
  public String toString() {
    return "EncryptedPayload[ciphertext=<" + length(ciphertext) + " chars>, iv=" + iv
        + ", salt=" + salt + "]";
  }

  private static int length(String value) {
    return value == null ? 0 : value.length();
  }
}
