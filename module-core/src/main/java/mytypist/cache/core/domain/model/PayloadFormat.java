package mytypist.cache.core.domain.model;

import mytypist.cache.error.exception.DecodeException;

/**
 * One-byte discriminant written in front of every stored payload.
 *
 * <p>The tag values are part of the wire format shared by every process using the same Redis and
 * must never be renumbered.
 */
public enum PayloadFormat {
  JSON((byte) 0x01, false),
  GZIP_JSON((byte) 0x02, true),
  JDK((byte) 0x03, false),
  GZIP_JDK((byte) 0x04, true);

  private final byte tag;
  private final boolean compressed;

  PayloadFormat(byte tag, boolean compressed) {
    this.tag = tag;
    this.compressed = compressed;
  }

  public byte tag() {
    return tag;
  }

  public boolean isCompressed() {
    return compressed;
  }

  /** Raw counterpart of this format (JSON for GZIP_JSON, JDK for GZIP_JDK). */
  public PayloadFormat uncompressed() {
    return switch (this) {
      case JSON, GZIP_JSON -> JSON;
      case JDK, GZIP_JDK -> JDK;
    };
  }

  public PayloadFormat compressed() {
    return switch (this) {
      case JSON, GZIP_JSON -> GZIP_JSON;
      case JDK, GZIP_JDK -> GZIP_JDK;
    };
  }

  public static PayloadFormat fromTag(byte tag) {
    for (PayloadFormat format : values()) {
      if (format.tag == tag) {
        return format;
      }
    }
    throw new DecodeException(String.format("unknown payload format tag 0x%02x", tag & 0xff));
  }
}
