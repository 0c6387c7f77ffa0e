package dev.dylanburati.chainmap;

/**
 * Outcome of an operation on a {@link ChainedHashTable}.
 */
public enum HashTableStatus {
  SUCCESS,
  /** A required argument was null, or the table has been destroyed. */
  INVALID_ARGUMENT,
  /** Memory for an entry, a key copy or a bucket array could not be obtained. */
  ALLOCATION_FAILURE,
  KEY_NOT_FOUND,
  /**
   * The put stored its entry, but the resize it triggered failed. The key is present with the
   * given value; only the growth of the bucket array did not happen.
   */
  REHASH_FAILURE,
  /** Doubling the bucket count would overflow an {@code int}. */
  SIZE_LIMIT_EXCEEDED,
  /** Clearing found the entry count out of step with the chains, or the table was destroyed. */
  CLEAR_FAILURE;

  public boolean isSuccess() {
    return this == SUCCESS;
  }

  /** Whether a put reporting this status left its key/value pair in the table. */
  public boolean isStored() {
    return this == SUCCESS || this == REHASH_FAILURE;
  }
}
