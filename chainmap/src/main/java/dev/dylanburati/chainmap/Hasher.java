package dev.dylanburati.chainmap;

import java.nio.charset.StandardCharsets;

/**
 * Computes hashes for insertion to a {@link ChainedHashTable}. The rules of {@link Object#hashCode}
 * also apply here: equal keys must produce equal hashes on every call.
 *
 * The result is read as an unsigned 64-bit value when it is reduced to a bucket index.
 */
public interface Hasher {
  long hashBytes(byte[] data);

  default long hashString(String key) {
    return this.hashBytes(key.getBytes(StandardCharsets.UTF_8));
  }
}
