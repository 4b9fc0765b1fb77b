package com.cultour.service;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Which badge, by name, each {@link ProfileEvent} grants. Immutable once built. */
public final class BadgeRuleTable {

  public static final String DEFAULT_EXPLORER_BADGE = "Penjelajah";
  public static final String DEFAULT_VERIFIED_LOCAL_BADGE = "Warlok";

  private final ImmutableMap<ProfileEvent, String> rules;

  private BadgeRuleTable(Map<ProfileEvent, String> rules) {
    this.rules = Maps.immutableEnumMap(rules);
  }

  /** Explorer badge for a new profile, verified-local badge for a verified identity. */
  public static BadgeRuleTable standard() {
    return of(DEFAULT_EXPLORER_BADGE, DEFAULT_VERIFIED_LOCAL_BADGE);
  }

  /** A table with the given badge names; a null or empty name falls back to the default. */
  public static BadgeRuleTable of(String explorerBadge, String verifiedLocalBadge) {
    EnumMap<ProfileEvent, String> rules = new EnumMap<>(ProfileEvent.class);
    rules.put(
        ProfileEvent.PROFILE_CREATED,
        MoreObjects.firstNonNull(Strings.emptyToNull(explorerBadge), DEFAULT_EXPLORER_BADGE));
    rules.put(
        ProfileEvent.IDENTITY_VERIFIED,
        MoreObjects.firstNonNull(
            Strings.emptyToNull(verifiedLocalBadge), DEFAULT_VERIFIED_LOCAL_BADGE));
    return new BadgeRuleTable(rules);
  }

  /** A table with exactly the given rules. */
  public static BadgeRuleTable of(Map<ProfileEvent, String> rules) {
    for (Map.Entry<ProfileEvent, String> rule : rules.entrySet()) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(rule.getValue()), "badge name for %s is empty", rule.getKey());
    }
    return new BadgeRuleTable(rules);
  }

  public Optional<String> badgeFor(ProfileEvent event) {
    return Optional.ofNullable(rules.get(event));
  }

  public ImmutableMap<ProfileEvent, String> rules() {
    return rules;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("rules", rules).toString();
  }
}
