package com.cultour.service;

/**
 * Field merging for partial updates: a field of the update payload replaces the stored value
 * only when it is set. Null and blank strings count as unset.
 */
final class Merge {

  private Merge() {}

  static String text(String update, String current) {
    return update == null || update.isBlank() ? current : update;
  }
}
