package com.cultour.service;

/** Profile workflow events that can earn a badge. */
public enum ProfileEvent {
  /** A user created their profile. */
  PROFILE_CREATED,
  /** A user uploaded an identity document. */
  IDENTITY_VERIFIED
}
