package com.cultour.storage;

import com.google.common.io.Files;
import java.util.Locale;

/**
 * An uploaded file on its way to the blob store.
 *
 * @param filename name the client gave the file; only its extension is kept
 * @param contentType declared MIME type
 * @param content file bytes
 */
public record BlobUpload(String filename, String contentType, byte[] content) {

  public long size() {
    return content == null ? 0 : content.length;
  }

  /** Lower-case extension including the dot, e.g. {@code .png}, or empty. */
  public String extension() {
    if (filename == null) {
      return "";
    }
    String ext = Files.getFileExtension(filename);
    return ext.isEmpty() ? "" : "." + ext.toLowerCase(Locale.ROOT);
  }
}
