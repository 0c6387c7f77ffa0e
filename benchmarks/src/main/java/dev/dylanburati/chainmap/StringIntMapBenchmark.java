package dev.dylanburati.chainmap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

@State(Scope.Benchmark)
public class StringIntMapBenchmark {
  private static final int WORDS = 10_000_000;

  @Param({"16", "65536"})
  public int initialSize;

  private String[] words;

  @Setup
  public void setup() {
    this.words = simulatedWords(WORDS);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountChainedHashTable(Blackhole bh) {
    ChainedHashTable t = ChainedHashTable.create(initialSize);
    for (String word : this.words) {
      t.put(word, t.getOrDefault(word, 0) + 1);
    }
    bh.consume(t.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountChainedMapView(Blackhole bh) {
    bh.consume(wordcount(ChainedHashTable.create(initialSize).asMap()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashMap(Blackhole bh) {
    bh.consume(wordcount(new HashMap<>(initialSize)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountObject2IntMap(Blackhole bh) {
    bh.consume(wordcount(new Object2IntOpenHashMap<>(initialSize)));
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01, capped at 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return i >= 0 ? i : -i - 1;
  }

  // generated once so the benchmarks measure the tables, not the generator
  private static String[] simulatedWords(int count) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    String[] result = new String[count];
    for (int i = 0; i < count; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      result[i] = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
    }
    return result;
  }

  private int wordcount(Map<String, Integer> m) {
    for (String word : this.words) {
      m.merge(word, 1, (v1, v2) -> v1 + v2);
    }
    return m.size();
  }
}
