package com.cultour.query;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One page of matches plus the total number of matches ignoring the page window.
 *
 * @param <T> the read model type
 */
public record SearchResult<T>(List<T> items, long total) {

  public SearchResult {
    items = ImmutableList.copyOf(items);
  }
}
