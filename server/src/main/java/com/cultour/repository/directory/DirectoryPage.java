package com.cultour.repository.directory;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One page of the directory's user listing.
 *
 * @param users the users on this page, in directory order
 */
public record DirectoryPage(List<DirectoryUser> users) {

  public DirectoryPage {
    users = users == null ? ImmutableList.of() : ImmutableList.copyOf(users);
  }
}
