package com.cultour.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Settings for the external user directory.
 *
 * @param url base URL of the auth server, without the {@code /auth/v1} suffix
 * @param serviceKey service-role key sent as {@code apikey} and bearer token
 * @param scanPageSize page size used when scanning the whole user listing
 */
public record DirectoryConfig(String url, String serviceKey, int scanPageSize) {

  public static final int DEFAULT_SCAN_PAGE_SIZE = 200;

  public DirectoryConfig {
    Preconditions.checkArgument(scanPageSize > 0, "scanPageSize must be positive");
  }

  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("url", url())
        .add("scanPageSize", scanPageSize())
        .toString();
  }
}
