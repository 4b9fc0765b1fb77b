package com.cultour.config;

import com.google.common.base.MoreObjects;

/**
 * Connection settings for the MinIO bucket that holds profile images.
 *
 * @param endpoint URL of the MinIO server, e.g. {@code http://localhost:9000}
 * @param accessKey access key used to authenticate
 * @param secretKey secret key used to authenticate
 * @param bucket bucket that uploaded images are written to
 * @param publicUrl base URL under which stored objects are publicly readable; when empty the
 *     endpoint and bucket are used
 */
public record MinioConfig(
    String endpoint, String accessKey, String secretKey, String bucket, String publicUrl) {

  /** Public URL of the object stored under {@code key}. */
  public String objectUrl(String key) {
    String base =
        publicUrl == null || publicUrl.isEmpty() ? endpoint + "/" + bucket : publicUrl;
    return (base.endsWith("/") ? base : base + "/") + key;
  }

  /** Same as {@link #toString()} but without the secret key, for logging. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("endpoint", endpoint())
        .add("accessKey", accessKey())
        .add("bucket", bucket())
        .add("publicUrl", publicUrl())
        .toString();
  }
}
