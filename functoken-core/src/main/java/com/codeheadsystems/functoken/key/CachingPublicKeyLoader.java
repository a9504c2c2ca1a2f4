package com.codeheadsystems.functoken.key;

import java.security.interfaces.RSAPublicKey;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PublicKeyLoader} that remembers successfully decoded keys, keyed by the exact PEM text.
 * <p>
 * Failed loads are not remembered, so every request with a bad key is rejected the same way
 * the delegate would reject it. Concurrent first loads of the same PEM may both reach the
 * delegate; either result is equivalent.
 */
public class CachingPublicKeyLoader implements PublicKeyLoader {

  private static final Logger log = LoggerFactory.getLogger(CachingPublicKeyLoader.class);

  private final PublicKeyLoader delegate;
  private final ConcurrentHashMap<String, RSAPublicKey> cache = new ConcurrentHashMap<>();

  /**
   * Instantiates a new caching loader.
   *
   * @param delegate the loader that does the actual decoding
   */
  public CachingPublicKeyLoader(PublicKeyLoader delegate) {
    this.delegate = delegate;
  }

  @Override
  public RSAPublicKey load(String pem) {
    if (pem == null) {
      return delegate.load(null);
    }
    RSAPublicKey cached = cache.get(pem);
    if (cached != null) {
      return cached;
    }
    RSAPublicKey key = delegate.load(pem);
    RSAPublicKey previous = cache.putIfAbsent(pem, key);
    log.debug("Cached public key ({} cached)", cache.size());
    return previous != null ? previous : key;
  }

  /**
   * Number of distinct keys currently held.
   *
   * @return the size
   */
  public int size() {
    return cache.size();
  }
}
