package mytypist.cache.core.domain.model;

import java.util.Arrays;
import java.util.Objects;
import mytypist.cache.error.exception.DecodeException;

/**
 * Serialized cache payload: format tag plus body.
 *
 * <p>Immutable. The body is copied on the way in and on the way out so that no two holders (L1, an
 * L2 write, a caller) ever share a mutable array.
 */
public final class EncodedValue {

  private final PayloadFormat format;
  private final byte[] body;

  private EncodedValue(PayloadFormat format, byte[] body) {
    this.format = format;
    this.body = body;
  }

  public static EncodedValue of(PayloadFormat format, byte[] body) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(body, "body");
    return new EncodedValue(format, body.clone());
  }

  /** Parses the wire form (1 format byte followed by the body). */
  public static EncodedValue fromBytes(byte[] wire) {
    if (wire == null || wire.length == 0) {
      throw new DecodeException("empty payload");
    }
    PayloadFormat format = PayloadFormat.fromTag(wire[0]);
    return new EncodedValue(format, Arrays.copyOfRange(wire, 1, wire.length));
  }

  public byte[] toBytes() {
    byte[] wire = new byte[body.length + 1];
    wire[0] = format.tag();
    System.arraycopy(body, 0, wire, 1, body.length);
    return wire;
  }

  public PayloadFormat format() {
    return format;
  }

  public byte[] body() {
    return body.clone();
  }

  public int size() {
    return body.length + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EncodedValue that)) {
      return false;
    }
    return format == that.format && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return 31 * format.hashCode() + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "EncodedValue{format=" + format + ", size=" + size() + "}";
  }
}
