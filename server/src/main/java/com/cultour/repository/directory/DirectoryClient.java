package com.cultour.repository.directory;

import java.util.UUID;

/**
 * Admin access to the external user directory. Listing is unfiltered and unsorted; callers
 * that need either apply it themselves.
 */
public interface DirectoryClient {

  DirectoryUser createUser(DirectoryUserRequest request) throws DirectoryException;

  DirectoryUser getUser(UUID id) throws DirectoryException;

  DirectoryUser updateUser(UUID id, DirectoryUserRequest request) throws DirectoryException;

  void deleteUser(UUID id) throws DirectoryException;

  /**
   * Reads one page of users.
   *
   * @param page 1-based page number
   * @param perPage page size requested from the directory
   */
  DirectoryPage listUsers(int page, int perPage) throws DirectoryException;
}
