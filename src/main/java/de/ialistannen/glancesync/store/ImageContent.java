package de.ialistannen.glancesync.store;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * The data of an image, received in chunks. It can be drained exactly once and is not restartable.
 */
public final class ImageContent implements Closeable {

  static final int CHUNK_SIZE = 64 * 1024;

  private final InputStream source;
  private boolean consumed;

  public ImageContent(InputStream source) {
    this.source = source;
  }

  /**
   * Writes every remaining chunk to the sink. Each chunk is only read after the previous one was written, so the
   * source is drained as fast as the sink accepts data.
   *
   * @param sink the sink to write to
   * @return the amount of bytes written
   * @throws IOException if reading or writing failed
   * @throws IllegalStateException if this content was already consumed
   */
  public long writeTo(OutputStream sink) throws IOException {
    if (consumed) {
      throw new IllegalStateException("Image content can only be consumed once");
    }
    consumed = true;

    byte[] buffer = new byte[CHUNK_SIZE];
    long written = 0;
    int read;
    while ((read = source.read(buffer)) != -1) {
      sink.write(buffer, 0, read);
      written += read;
    }
    return written;
  }

  @Override
  public void close() throws IOException {
    consumed = true;
    source.close();
  }
}
