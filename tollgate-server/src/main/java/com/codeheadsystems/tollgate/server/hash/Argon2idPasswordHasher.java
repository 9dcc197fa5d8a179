package com.codeheadsystems.tollgate.server.hash;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PasswordHasher} backed by BouncyCastle's Argon2id.
 * <p>
 * Digests use the PHC string format:
 * <pre>
 *   $argon2id$v=19$m=&lt;memory KiB&gt;,t=&lt;iterations&gt;,p=&lt;parallelism&gt;$&lt;salt&gt;$&lt;hash&gt;
 * </pre>
 * with salt and hash in unpadded standard base64. Verification reads the cost from the digest,
 * so raising the configured cost does not invalidate existing digests.
 */
public class Argon2idPasswordHasher implements PasswordHasher {

  public static final int DEFAULT_MEMORY_KIB = 65536;
  public static final int DEFAULT_ITERATIONS = 3;
  public static final int DEFAULT_PARALLELISM = 1;

  private static final Logger log = LoggerFactory.getLogger(Argon2idPasswordHasher.class);

  private static final String ALGORITHM = "argon2id";
  private static final int VERSION = Argon2Parameters.ARGON2_VERSION_13;
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;

  // Bounds on the configured cost.
  private static final int MAX_MEMORY_KIB = 4 * 1024 * 1024;
  private static final int MAX_ITERATIONS = 64;
  private static final int MAX_PARALLELISM = 64;
  /**
   * A stored digest may ask for at most this multiple of the configured (or default, if larger)
   * cost before verification refuses it.
   */
  static final int VERIFY_COST_FACTOR = 4;

  private static final int MIN_DECODED_LENGTH = 8;
  private static final int MAX_DECODED_LENGTH = 128;

  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final int memoryKib;
  private final int iterations;
  private final int parallelism;
  private final int maxVerifyMemoryKib;
  private final int maxVerifyIterations;
  private final SecureRandom random;

  /**
   * Creates a hasher with the default cost (64 MiB, 3 iterations, 1 lane).
   */
  public Argon2idPasswordHasher() {
    this(DEFAULT_MEMORY_KIB, DEFAULT_ITERATIONS, DEFAULT_PARALLELISM);
  }

  /**
   * Creates a hasher with the given cost.
   *
   * @param memoryKib   memory cost in KiB, at least {@code 8 * parallelism}
   * @param iterations  number of passes, at least 1
   * @param parallelism number of lanes, at least 1
   */
  public Argon2idPasswordHasher(final int memoryKib, final int iterations, final int parallelism) {
    if (parallelism < 1 || parallelism > MAX_PARALLELISM) {
      throw new IllegalArgumentException("parallelism out of range: " + parallelism);
    }
    if (iterations < 1 || iterations > MAX_ITERATIONS) {
      throw new IllegalArgumentException("iterations out of range: " + iterations);
    }
    if (memoryKib < 8 * parallelism || memoryKib > MAX_MEMORY_KIB) {
      throw new IllegalArgumentException("memoryKib out of range: " + memoryKib);
    }
    this.memoryKib = memoryKib;
    this.iterations = iterations;
    this.parallelism = parallelism;
    this.maxVerifyMemoryKib = (int) Math.min(MAX_MEMORY_KIB,
        (long) Math.max(memoryKib, DEFAULT_MEMORY_KIB) * VERIFY_COST_FACTOR);
    this.maxVerifyIterations = Math.min(MAX_ITERATIONS,
        Math.max(iterations, DEFAULT_ITERATIONS) * VERIFY_COST_FACTOR);
    this.random = new SecureRandom();
    log.info("Argon2idPasswordHasher(m={}, t={}, p={})", memoryKib, iterations, parallelism);
  }

  @Override
  public String hash(final String plaintext) {
    if (plaintext == null) {
      throw new IllegalArgumentException("plaintext must not be null");
    }
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    byte[] hash = derive(plaintext, salt, memoryKib, iterations, parallelism, HASH_LENGTH);
    return "$" + ALGORITHM + "$v=" + VERSION
        + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
        + "$" + B64.encodeToString(salt)
        + "$" + B64.encodeToString(hash);
  }

  @Override
  public boolean verify(final String plaintext, final String digest) {
    if (plaintext == null || digest == null) {
      return false;
    }
    Optional<ParsedDigest> parsed = parse(digest);
    if (parsed.isEmpty()) {
      log.debug("verify(): digest is not a supported argon2id PHC string");
      return false;
    }
    ParsedDigest p = parsed.get();
    byte[] candidate = derive(plaintext, p.salt(), p.memoryKib(), p.iterations(), p.parallelism(),
        p.hash().length);
    return Arrays.constantTimeAreEqual(candidate, p.hash());
  }

  private static byte[] derive(String plaintext, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(VERSION)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] out = new byte[length];
    gen.generateBytes(plaintext.getBytes(StandardCharsets.UTF_8), out);
    return out;
  }

  private Optional<ParsedDigest> parse(String digest) {
    String[] parts = digest.split("\\$", -1);
    if (parts.length != 6 || !parts[0].isEmpty() || !ALGORITHM.equals(parts[1])
        || !("v=" + VERSION).equals(parts[2])) {
      return Optional.empty();
    }
    int m = -1;
    int t = -1;
    int p = -1;
    for (String param : parts[3].split(",", -1)) {
      int eq = param.indexOf('=');
      if (eq < 1) {
        return Optional.empty();
      }
      int value;
      try {
        value = Integer.parseInt(param.substring(eq + 1));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
      switch (param.substring(0, eq)) {
        case "m" -> m = value;
        case "t" -> t = value;
        case "p" -> p = value;
        default -> {
          return Optional.empty();
        }
      }
    }
    if (p < 1 || p > MAX_PARALLELISM || t < 1 || m < 8 * p) {
      return Optional.empty();
    }
    if (m > maxVerifyMemoryKib || t > maxVerifyIterations) {
      log.warn("Refusing to verify digest with cost m={}, t={} above the limit m={}, t={}",
          m, t, maxVerifyMemoryKib, maxVerifyIterations);
      return Optional.empty();
    }
    byte[] salt;
    byte[] hash;
    try {
      salt = B64D.decode(parts[4]);
      hash = B64D.decode(parts[5]);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    if (!inRange(salt.length) || !inRange(hash.length)) {
      return Optional.empty();
    }
    return Optional.of(new ParsedDigest(m, t, p, salt, hash));
  }

  private static boolean inRange(int length) {
    return length >= MIN_DECODED_LENGTH && length <= MAX_DECODED_LENGTH;
  }

  private record ParsedDigest(int memoryKib, int iterations, int parallelism, byte[] salt,
                              byte[] hash) {
  }
}
