package dev.dylanburati.chainmap;

/**
 * Every allocation a {@link ChainedHashTable} keeps goes through here. Implementations signal
 * exhaustion by throwing {@link OutOfMemoryError}, which the table reports as
 * {@link HashTableStatus#ALLOCATION_FAILURE}.
 */
/* package-private */ interface NodeAllocator {
  NodeAllocator HEAP = new NodeAllocator() {};

  default ChainedHashTable.Entry[] buckets(int length) {
    return new ChainedHashTable.Entry[length];
  }

  default ChainedHashTable.Entry entry(byte[] key, int value, ChainedHashTable.Entry next) {
    return new ChainedHashTable.Entry(key, value, next);
  }

  /**
   * Takes ownership of a freshly encoded key for a new entry. The encoding is already a private
   * copy of the caller's string, so the default keeps it as is.
   */
  default byte[] adoptKey(byte[] encoded) {
    return encoded;
  }

  /** Largest bucket array this allocator can hand out. */
  default int maxBuckets() {
    return Integer.MAX_VALUE;
  }

  /** Called once for every entry the table lets go of, on delete, clear and destroy. */
  default void release(ChainedHashTable.Entry entry) {}
}
