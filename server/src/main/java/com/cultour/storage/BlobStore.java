package com.cultour.storage;

import com.cultour.common.status.StatusOr;

/** Object storage for uploaded images. */
public interface BlobStore {

  /**
   * Stores {@code upload} under {@code key}, replacing any existing object.
   *
   * @return the public URL of the stored object
   */
  StatusOr<String> put(String key, BlobUpload upload);
}
