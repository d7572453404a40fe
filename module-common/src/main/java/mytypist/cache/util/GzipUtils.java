package mytypist.cache.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class GzipUtils {

  private GzipUtils() {}

  /**
   * Gzip-compresses a byte array.
   *
   * @param raw bytes to compress
   * @return compressed bytes
   * @throws IOException on a stream failure
   */
  public static byte[] compress(byte[] raw) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(raw);
    }
    return out.toByteArray();
  }

  /**
   * Inflates a gzip payload.
   *
   * @param compressed gzip bytes
   * @return the original bytes
   * @throws IOException when the header is not gzip or the stream is truncated
   */
  public static byte[] decompress(byte[] compressed) throws IOException {
    if (!isGzipped(compressed)) {
      throw new IOException("Not in GZIP format");
    }
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return gzip.readAllBytes();
    }
  }

  public static boolean isGzipped(byte[] data) {
    return data != null
        && data.length >= 2
        && data[0] == (byte) (GZIPInputStream.GZIP_MAGIC)
        && data[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
  }
}
