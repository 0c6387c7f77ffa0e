package dev.dylanburati.chainmap;

import java.util.Objects;

/**
 * A runtime exception that wraps a {@link HashTableStatus}. Only thrown where no status can be
 * returned: by the {@link ChainedHashTable#create} factories, by {@link ChainedHashTable.Lookup#value()}
 * on a lookup that did not succeed, and by the {@link ChainedHashTable#asMap()} view's {@code put}
 * when the table rejects the write.
 */
public class HashTableException extends RuntimeException {
  private final HashTableStatus status;

  public HashTableException(final HashTableStatus status, final String message) {
    super(message);
    this.status = Objects.requireNonNull(status);
  }

  public HashTableException(final HashTableStatus status, final String message, final Throwable cause) {
    super(message, cause);
    this.status = Objects.requireNonNull(status);
  }

  public HashTableStatus getStatus() {
    return this.status;
  }

  @Override
  public String toString() {
    return "HashTableException{status=" + this.status + ", message=" + this.getMessage() + "}";
  }
}
