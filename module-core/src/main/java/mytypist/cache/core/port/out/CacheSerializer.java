package mytypist.cache.core.port.out;

import mytypist.cache.core.domain.model.EncodedValue;

/**
 * Value codec for both tiers.
 *
 * <p>{@code decode(encode(v)).equals(v)} for every value {@code encode} accepts. Equal values
 * always encode to identical bytes.
 */
public interface CacheSerializer {

  /**
   * @throws mytypist.cache.error.exception.SerializationException when the value has no supported
   *     representation
   */
  EncodedValue encode(String key, Object value);

  /**
   * @throws mytypist.cache.error.exception.DecodeException on an unknown tag or corrupt body
   */
  Object decode(EncodedValue value);

  default Object decode(byte[] wire) {
    return decode(EncodedValue.fromBytes(wire));
  }
}
