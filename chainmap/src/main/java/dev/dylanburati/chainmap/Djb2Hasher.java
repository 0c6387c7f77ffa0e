package dev.dylanburati.chainmap;

/**
 * Bernstein's DJB2 string hash: {@code h = h * 33 + c} starting from {@link #SEED}, computed with
 * 64-bit wraparound. Every byte of the key is fed as an unsigned code, so the result does not
 * depend on the platform's signedness of {@code char}.
 */
public final class Djb2Hasher implements Hasher {
  public static final long SEED = 5381L;

  private static final Djb2Hasher INSTANCE = new Djb2Hasher();

  private Djb2Hasher() {}

  public static Djb2Hasher instance() {
    return INSTANCE;
  }

  @Override
  public long hashBytes(byte[] data) {
    return this.hashImpl(data, 0, data.length);
  }

  private long hashImpl(byte[] data, int position, int length) {
    long h = SEED;
    for (int offset = position; offset < position + length; offset++) {
      // h * 33 + c
      h = (h << 5) + h + (data[offset] & 0xFF);
    }
    return h;
  }
}
