package dev.dylanburati.chainmap;

import java.nio.charset.StandardCharsets;
import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static dev.dylanburati.chainmap.HashTableStatus.*;

/**
 * Hash table from strings to ints with separate chaining.
 *
 * Each bucket holds the head of a singly-linked chain of entries whose key hashes to that bucket.
 * Keys are stored as their UTF-8 encoding and hashed with a {@link Hasher} (DJB2 by default); the
 * bucket of a key is {@code hash mod capacity}, with the hash read as unsigned. New entries are
 * pushed at the head of their chain. When a new key brings the load factor above
 * {@link #MAX_LOAD_FACTOR}, the bucket array is doubled and every entry is relinked into the new
 * array. The bucket array never shrinks.
 *
 * Operations report their outcome as a {@link HashTableStatus} rather than throwing. Note that a
 * {@link HashTableStatus#REHASH_FAILURE} from {@link #put} means the pair <em>was</em> stored and only
 * the growth that followed failed.
 *
 * Not thread-safe. Concurrent readers are fine as long as no thread mutates; anything else needs
 * external locking.
 */
public class ChainedHashTable implements AutoCloseable {
  private static final Logger log = LogManager.getLogger(ChainedHashTable.class);

  public static final double MAX_LOAD_FACTOR = 0.75;

  private final Hasher hasher;
  private final NodeAllocator allocator;
  // INVARIANT 0: buckets.length > 0, or buckets == null once destroyed
  // INVARIANT 1: count == number of entries reachable from buckets
  // INVARIANT 2: each entry e is in chain remainderUnsigned(hash(e.key), buckets.length), and
  //   no two entries in a chain have equal keys
  private Entry[] buckets;
  private int count;
  // bumped on every structural change, checked by iterators
  private int modCount;

  private ChainedHashTable(final Hasher hasher, final NodeAllocator allocator, Entry[] buckets) {
    this.hasher = hasher;
    this.allocator = allocator;
    this.buckets = buckets;
    this.count = 0;
    this.modCount = 0;
  }

  /**
   * Creates an empty table with {@code initialSize} buckets, hashing with DJB2.
   *
   * @throws HashTableException with {@link HashTableStatus#INVALID_ARGUMENT} if
   *   {@code initialSize <= 0}, or {@link HashTableStatus#ALLOCATION_FAILURE} if the bucket
   *   array cannot be allocated
   */
  public static ChainedHashTable create(int initialSize) {
    return create(initialSize, Djb2Hasher.instance());
  }

  public static ChainedHashTable create(int initialSize, final Hasher hasher) {
    return create(initialSize, hasher, NodeAllocator.HEAP);
  }

  static ChainedHashTable create(int initialSize, final Hasher hasher, final NodeAllocator allocator) {
    if (initialSize <= 0) {
      log.warn("Hash table size must be positive, got {}", initialSize);
      throw new HashTableException(INVALID_ARGUMENT, "expected positive initialSize, got " + initialSize);
    }
    if (hasher == null || allocator == null) {
      log.warn("Hash table needs a hasher and an allocator");
      throw new HashTableException(INVALID_ARGUMENT, "hasher and allocator must not be null");
    }
    Entry[] buckets;
    try {
      buckets = allocator.buckets(initialSize);
    } catch (OutOfMemoryError e) {
      log.warn("Failed to allocate {} buckets for hash table", initialSize);
      throw new HashTableException(ALLOCATION_FAILURE, "cannot allocate " + initialSize + " buckets", e);
    }
    return new ChainedHashTable(hasher, allocator, buckets);
  }

  /** Number of entries. */
  public int size() {
    return this.count;
  }

  public boolean isEmpty() {
    return this.count == 0;
  }

  /** Length of the bucket array, or 0 once the table is destroyed. */
  public int capacity() {
    return this.buckets == null ? 0 : this.buckets.length;
  }

  public double loadFactor() {
    return this.buckets == null ? 0.0 : (double) this.count / this.buckets.length;
  }

  public boolean isDestroyed() {
    return this.buckets == null;
  }

  /**
   * Inserts {@code key} with {@code value}, or overwrites the value if the key is present.
   * Overwriting never changes the structure of the table.
   *
   * @return {@link HashTableStatus#SUCCESS}; {@link HashTableStatus#INVALID_ARGUMENT} for a null
   *   key or a destroyed table; {@link HashTableStatus#ALLOCATION_FAILURE} if the new entry could
   *   not be allocated, in which case nothing changed; {@link HashTableStatus#REHASH_FAILURE} if the
   *   entry was stored but the resize it triggered failed
   */
  public HashTableStatus put(String key, int value) {
    if (this.buckets == null || key == null) {
      log.warn("Invalid hash table or key provided to put");
      return INVALID_ARGUMENT;
    }
    byte[] keyContent = key.getBytes(StandardCharsets.UTF_8);
    int idx = this.indexFor(keyContent);
    for (Entry e = this.buckets[idx]; e != null; e = e.next) {
      if (Arrays.equals(e.key, keyContent)) {
        e.value = value;
        return SUCCESS;
      }
    }

    Entry created;
    try {
      created = this.allocator.entry(this.allocator.adoptKey(keyContent), value, this.buckets[idx]);
    } catch (OutOfMemoryError e) {
      log.warn("Failed to allocate entry for key '{}'", key);
      return ALLOCATION_FAILURE;
    }
    this.buckets[idx] = created;
    this.count++;
    this.modCount++;

    if ((double) this.count / this.buckets.length > MAX_LOAD_FACTOR) {
      HashTableStatus resized = this.resize();
      if (resized != SUCCESS) {
        log.error("Stored key '{}' but growing past {} buckets failed with {}", key, this.buckets.length, resized);
        return REHASH_FAILURE;
      }
    }
    return SUCCESS;
  }

  /**
   * Looks up {@code key}. Never allocates table storage and never mutates.
   *
   * @return a found {@link Lookup} carrying the value, or one whose status is
   *   {@link HashTableStatus#KEY_NOT_FOUND} or {@link HashTableStatus#INVALID_ARGUMENT}
   */
  public Lookup get(String key) {
    if (this.buckets == null || key == null) {
      log.warn("Invalid hash table or key provided to get");
      return Lookup.INVALID_ARGUMENT;
    }
    Entry e = this.find(key.getBytes(StandardCharsets.UTF_8));
    if (e == null) {
      return Lookup.KEY_NOT_FOUND;
    }
    return Lookup.found(e.value);
  }

  public int getOrDefault(String key, int defaultValue) {
    if (this.buckets == null || key == null) {
      return defaultValue;
    }
    Entry e = this.find(key.getBytes(StandardCharsets.UTF_8));
    return e == null ? defaultValue : e.value;
  }

  /** {@code false} for a null key or a destroyed table, otherwise whether {@link #get} would find the key. */
  public boolean containsKey(String key) {
    if (this.buckets == null || key == null) {
      return false;
    }
    return this.find(key.getBytes(StandardCharsets.UTF_8)) != null;
  }

  /**
   * Removes {@code key}. The bucket array is never shrunk.
   *
   * @return {@link HashTableStatus#SUCCESS}, {@link HashTableStatus#KEY_NOT_FOUND} (table unchanged),
   *   or {@link HashTableStatus#INVALID_ARGUMENT}
   */
  public HashTableStatus delete(String key) {
    if (this.buckets == null || key == null) {
      log.warn("Invalid hash table or key provided to delete");
      return INVALID_ARGUMENT;
    }
    byte[] keyContent = key.getBytes(StandardCharsets.UTF_8);
    int idx = this.indexFor(keyContent);
    Entry prev = null;
    for (Entry e = this.buckets[idx]; e != null; prev = e, e = e.next) {
      if (Arrays.equals(e.key, keyContent)) {
        this.unlink(idx, prev, e);
        return SUCCESS;
      }
    }
    return KEY_NOT_FOUND;
  }

  /**
   * Doubles the bucket array and relinks every entry into it. Entries and their keys are moved,
   * not copied. Called by {@link #put} when the load factor goes above {@link #MAX_LOAD_FACTOR}.
   *
   * If the doubled length does not fit, or the new array cannot be allocated, the table is left
   * exactly as it was.
   *
   * @return {@link HashTableStatus#SUCCESS}, {@link HashTableStatus#SIZE_LIMIT_EXCEEDED},
   *   {@link HashTableStatus#ALLOCATION_FAILURE} or {@link HashTableStatus#INVALID_ARGUMENT}
   */
  public HashTableStatus resize() {
    if (this.buckets == null) {
      log.warn("Invalid hash table provided to resize");
      return INVALID_ARGUMENT;
    }
    long doubled = 2L * this.buckets.length;
    if (doubled > this.allocator.maxBuckets()) {
      log.warn("Cannot grow hash table past {} buckets", this.buckets.length);
      return SIZE_LIMIT_EXCEEDED;
    }
    int newSize = (int) doubled;
    Entry[] nextBuckets;
    try {
      nextBuckets = this.allocator.buckets(newSize);
    } catch (OutOfMemoryError e) {
      log.warn("Failed to allocate {} buckets for resize", newSize);
      return ALLOCATION_FAILURE;
    }

    Entry[] prevBuckets = this.buckets;
    this.buckets = nextBuckets;
    this.count = 0;
    for (int src = 0; src < prevBuckets.length; src++) {
      Entry e = prevBuckets[src];
      while (e != null) {
        Entry following = e.next;
        int idx = this.indexFor(e.key);
        e.next = nextBuckets[idx];
        nextBuckets[idx] = e;
        this.count++;
        e = following;
      }
      prevBuckets[src] = null;
    }
    this.modCount++;
    log.debug("Resized hash table from {} to {} buckets, {} entries", prevBuckets.length, newSize, this.count);
    return SUCCESS;
  }

  /**
   * Removes every entry, keeping the current bucket count.
   *
   * @return {@link HashTableStatus#SUCCESS}, or {@link HashTableStatus#CLEAR_FAILURE} if the table
   *   is destroyed or the number of entries released disagreed with the entry count. The table is
   *   empty afterwards in both of the latter cases.
   */
  public HashTableStatus clear() {
    if (this.buckets == null) {
      log.error("Cannot clear a destroyed hash table");
      return CLEAR_FAILURE;
    }
    int expected = this.count;
    int released = this.releaseAll();
    this.count = 0;
    this.modCount++;
    if (released != expected) {
      log.error("Cleared {} entries from hash table but its count was {}", released, expected);
      return CLEAR_FAILURE;
    }
    return SUCCESS;
  }

  /**
   * Releases every entry and then the bucket array. Afterwards every operation reports
   * {@link HashTableStatus#INVALID_ARGUMENT} (or {@code false}, or {@link HashTableStatus#CLEAR_FAILURE}
   * for {@link #clear}). Destroying twice is a no-op.
   */
  public void destroy() {
    if (this.buckets == null) {
      return;
    }
    this.releaseAll();
    this.count = 0;
    this.buckets = null;
    this.modCount++;
  }

  @Override
  public void close() {
    this.destroy();
  }

  /** Visits every entry, by bucket index and then from the head of each chain. */
  public void forEach(ObjIntConsumer<? super String> action) {
    Objects.requireNonNull(action);
    if (this.buckets == null) {
      return;
    }
    int mc = this.modCount;
    for (Entry head : this.buckets) {
      for (Entry e = head; e != null; e = e.next) {
        action.accept(e.keyAsString(), e.value);
      }
    }
    if (this.modCount != mc) {
      throw new ConcurrentModificationException();
    }
  }

  /** Length of every chain, indexed by bucket. Empty once destroyed. */
  public int[] chainLengths() {
    if (this.buckets == null) {
      return new int[0];
    }
    int[] lengths = new int[this.buckets.length];
    for (int i = 0; i < this.buckets.length; i++) {
      for (Entry e = this.buckets[i]; e != null; e = e.next) {
        lengths[i]++;
      }
    }
    return lengths;
  }

  /** Logs the table layout and every entry at DEBUG. */
  public void dump() {
    if (!log.isDebugEnabled()) {
      return;
    }
    if (this.buckets == null) {
      log.debug("hash table (destroyed)");
      return;
    }
    log.debug("hash table: {} entries in {} buckets", this.count, this.buckets.length);
    for (int i = 0; i < this.buckets.length; i++) {
      for (Entry e = this.buckets[i]; e != null; e = e.next) {
        log.debug("  [{}] '{}' = {}", i, e.keyAsString(), e.value);
      }
    }
  }

  /**
   * Live {@link Map} view of this table. Missing keys read as {@code null}, and null keys or
   * values are rejected. Iteration order is the same as {@link #forEach}.
   */
  public Map<String, Integer> asMap() {
    return new MapView(this);
  }

  @Override
  public String toString() {
    if (this.buckets == null) {
      return "ChainedHashTable(destroyed)";
    }
    StringBuilder sb = new StringBuilder("{");
    this.forEach((k, v) -> {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(k).append('=').append(v);
    });
    return sb.append('}').toString();
  }

  private int indexFor(byte[] keyContent) {
    return (int) Long.remainderUnsigned(this.hasher.hashBytes(keyContent), this.buckets.length);
  }

  private Entry find(byte[] keyContent) {
    for (Entry e = this.buckets[this.indexFor(keyContent)]; e != null; e = e.next) {
      if (Arrays.equals(e.key, keyContent)) {
        return e;
      }
    }
    return null;
  }

  // used by iterators, which already hold the entry
  private boolean deleteEntry(Entry target) {
    if (this.buckets == null || target.detached) {
      return false;
    }
    int idx = this.indexFor(target.key);
    Entry prev = null;
    for (Entry e = this.buckets[idx]; e != null; prev = e, e = e.next) {
      if (e == target) {
        this.unlink(idx, prev, e);
        return true;
      }
    }
    return false;
  }

  /** INVARIANTS 1 and 2 upheld WHEN {@code prev} is the predecessor of {@code e} in chain {@code idx} */
  private void unlink(int idx, Entry prev, Entry e) {
    if (prev == null) {
      this.buckets[idx] = e.next;
    } else {
      prev.next = e.next;
    }
    this.release(e);
    this.count--;
    this.modCount++;
  }

  private int releaseAll() {
    int released = 0;
    for (int i = 0; i < this.buckets.length; i++) {
      Entry e = this.buckets[i];
      this.buckets[i] = null;
      while (e != null) {
        Entry following = e.next;
        this.release(e);
        released++;
        e = following;
      }
    }
    return released;
  }

  private void release(Entry e) {
    e.next = null;
    e.detached = true;
    this.allocator.release(e);
  }

  /* package-private */ static final class Entry {
    final byte[] key;
    int value;
    Entry next;
    boolean detached;

    Entry(byte[] key, int value, Entry next) {
      this.key = key;
      this.value = value;
      this.next = next;
    }

    String keyAsString() {
      return new String(this.key, StandardCharsets.UTF_8);
    }
  }

  /**
   * Result of {@link ChainedHashTable#get}: a status, plus the value when the key was found.
   */
  public static final class Lookup {
    static final Lookup INVALID_ARGUMENT = new Lookup(HashTableStatus.INVALID_ARGUMENT, 0);
    static final Lookup KEY_NOT_FOUND = new Lookup(HashTableStatus.KEY_NOT_FOUND, 0);

    private final HashTableStatus status;
    private final int value;

    private Lookup(HashTableStatus status, int value) {
      this.status = status;
      this.value = value;
    }

    static Lookup found(int value) {
      return new Lookup(SUCCESS, value);
    }

    public HashTableStatus status() {
      return this.status;
    }

    public boolean isFound() {
      return this.status == SUCCESS;
    }

    /** @throws HashTableException carrying {@link #status()} if the key was not found */
    public int value() {
      if (this.status != SUCCESS) {
        throw new HashTableException(this.status, "no value: " + this.status);
      }
      return this.value;
    }

    public int orElse(int other) {
      return this.status == SUCCESS ? this.value : other;
    }

    @Override
    public String toString() {
      return this.status == SUCCESS ? "Lookup[" + this.value + "]" : "Lookup[" + this.status + "]";
    }
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class MapView extends AbstractMap<String, Integer> {
    private final ChainedHashTable owner;
    protected MapView(final ChainedHashTable owner) {
      this.owner = owner;
    }

    @Override
    public int size() {
      return owner.count;
    }

    @Override
    public boolean isEmpty() {
      return owner.count == 0;
    }

    @Override
    public boolean containsKey(Object key) {
      if (!(key instanceof String)) {
        return false;
      }
      return owner.containsKey((String) key);
    }

    @Override
    public Integer get(Object key) {
      return this.getOrDefault(key, null);
    }

    @Override
    public Integer getOrDefault(Object key, Integer defaultValue) {
      if (!(key instanceof String) || owner.buckets == null) {
        return defaultValue;
      }
      // Map.Entry shadows the simple name in here
      ChainedHashTable.Entry e = owner.find(((String) key).getBytes(StandardCharsets.UTF_8));
      if (e == null) {
        return defaultValue;
      }
      return e.value;
    }

    @Override
    public Integer put(String key, Integer value) {
      Objects.requireNonNull(key);
      Objects.requireNonNull(value);
      Integer prev = this.get(key);
      HashTableStatus status = owner.put(key, value);
      if (status == REHASH_FAILURE) {
        log.warn("Map view stored key '{}' without growing the table", key);
      } else if (status != SUCCESS) {
        throw new HashTableException(status, "put failed: " + status);
      }
      return prev;
    }

    @Override
    public Integer remove(Object key) {
      if (!(key instanceof String) || owner.buckets == null) {
        return null;
      }
      ChainedHashTable.Entry e = owner.find(((String) key).getBytes(StandardCharsets.UTF_8));
      if (e == null) {
        return null;
      }
      int result = e.value;
      owner.deleteEntry(e);
      return result;
    }

    @Override
    public void clear() {
      owner.clear();
    }

    @Override
    public Set<String> keySet() {
      return new KeySet(owner);
    }

    @Override
    public Collection<Integer> values() {
      return new Values(owner);
    }

    @Override
    public Set<Map.Entry<String, Integer>> entrySet() {
      return new EntrySet(owner);
    }
  }

  protected static class KeySet extends AbstractSet<String> {
    private final ChainedHashTable owner;
    protected KeySet(final ChainedHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.count;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<String> iterator() {
      return new KeyIterator(owner);
    }
    public final boolean contains(Object o) {
      return o instanceof String && owner.containsKey((String) o);
    }
    public final boolean remove(Object key) {
      return key instanceof String && owner.delete((String) key) == SUCCESS;
    }

    public final void forEach(Consumer<? super String> action) {
      Objects.requireNonNull(action);
      owner.forEach((k, _v) -> action.accept(k));
    }
  }

  protected static class Values extends AbstractCollection<Integer> {
    private final ChainedHashTable owner;
    protected Values(final ChainedHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.count;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Integer> iterator() {
      return new ValueIterator(owner);
    }

    public final void forEach(Consumer<? super Integer> action) {
      Objects.requireNonNull(action);
      owner.forEach((_k, v) -> action.accept(v));
    }
  }

  protected static class Node implements Map.Entry<String, Integer> {
    private final Entry entry;

    protected Node(final Entry entry) {
      this.entry = entry;
    }

    // entries survive resizes, so only a removal can invalidate a node
    private Entry checkLive() {
      if (this.entry.detached) {
        throw new IllegalStateException("Entry no longer in map");
      }
      return this.entry;
    }

    @Override
    public String getKey() {
      return this.entry.keyAsString();
    }

    @Override
    public Integer getValue() {
      return this.checkLive().value;
    }

    @Override
    public Integer setValue(Integer value) {
      Objects.requireNonNull(value);
      Entry e = this.checkLive();
      Integer prev = e.value;
      e.value = value;
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.getKey(), e.getKey()) && Objects.equals(this.getValue(), e.getValue());
    }

    @Override
    public int hashCode() {
      return this.getKey().hashCode() ^ this.getValue().hashCode();
    }

    @Override
    public String toString() {
      return this.getKey() + "=" + this.getValue();
    }
  }

  protected static class EntrySet extends AbstractSet<Map.Entry<String, Integer>> {
    private final ChainedHashTable owner;
    protected EntrySet(final ChainedHashTable owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.count;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<String, Integer>> iterator() {
      return new EntryIterator(owner);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      if (!(e.getKey() instanceof String) || !(e.getValue() instanceof Integer)) {
        return false;
      }
      Lookup found = owner.get((String) e.getKey());
      return found.isFound() && found.value() == (Integer) e.getValue();
    }
    public final boolean remove(Object o) {
      if (!this.contains(o)) {
        return false;
      }
      return owner.delete((String) ((Map.Entry<?, ?>) o).getKey()) == SUCCESS;
    }
  }

  protected static abstract class HashIterator {
    protected final ChainedHashTable owner;
    private int expectedModCount;
    // bucket holding nextEntry
    private int bucket;
    private Entry nextEntry;
    private Entry current;

    protected HashIterator(final ChainedHashTable owner) {
      this.owner = owner;
      this.expectedModCount = owner.modCount;
      this.bucket = -1;
      this.current = null;
      this.nextEntry = this.findNext(null);
    }

    private Entry findNext(Entry from) {
      if (from != null && from.next != null) {
        return from.next;
      }
      Entry[] buckets = owner.buckets;
      if (buckets == null) {
        return null;
      }
      for (int b = this.bucket + 1; b < buckets.length; b++) {
        if (buckets[b] != null) {
          this.bucket = b;
          return buckets[b];
        }
      }
      this.bucket = buckets.length;
      return null;
    }

    public final boolean hasNext() {
      return this.nextEntry != null;
    }

    public final void remove() {
      if (this.current == null) {
        throw new IllegalStateException();
      }
      if (owner.modCount != this.expectedModCount) {
        throw new ConcurrentModificationException();
      }
      owner.deleteEntry(this.current);
      this.current = null;
      this.expectedModCount = owner.modCount;
    }

    protected Entry advance() {
      if (owner.modCount != this.expectedModCount) {
        throw new ConcurrentModificationException();
      }
      if (this.nextEntry == null) {
        throw new NoSuchElementException();
      }
      this.current = this.nextEntry;
      this.nextEntry = this.findNext(this.current);
      return this.current;
    }
  }

  protected static class KeyIterator extends HashIterator implements Iterator<String> {
    protected KeyIterator(final ChainedHashTable owner) {
      super(owner);
    }
    public final String next() {
      return this.advance().keyAsString();
    }
  }

  protected static class ValueIterator extends HashIterator implements Iterator<Integer> {
    protected ValueIterator(final ChainedHashTable owner) {
      super(owner);
    }
    public final Integer next() {
      return this.advance().value;
    }
  }

  protected static class EntryIterator extends HashIterator implements Iterator<Map.Entry<String, Integer>> {
    protected EntryIterator(final ChainedHashTable owner) {
      super(owner);
    }
    public final Map.Entry<String, Integer> next() {
      return new Node(this.advance());
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java
}
