package com.cultour.model;

import com.cultour.validation.Rules;
import com.cultour.validation.Schema;

/**
 * Creation or update payload for an achievement badge.
 *
 * @param name unique badge name, also the key badge rules refer to
 * @param description what the badge is awarded for
 * @param iconUrl public URL of the badge icon
 */
public record BadgeWrite(String name, String description, String iconUrl) {

  public static final Schema<BadgeWrite> CREATE_SCHEMA =
      Schema.<BadgeWrite>builder()
          .field("name", BadgeWrite::name, Rules.required(), Rules.min(3), Rules.max(100))
          .field("description", BadgeWrite::description, Rules.max(1000))
          .field("iconUrl", BadgeWrite::iconUrl, Rules.max(2048))
          .build();

  public static final Schema<BadgeWrite> UPDATE_SCHEMA =
      Schema.<BadgeWrite>builder()
          .field("name", BadgeWrite::name, Rules.min(3), Rules.max(100))
          .field("description", BadgeWrite::description, Rules.max(1000))
          .field("iconUrl", BadgeWrite::iconUrl, Rules.max(2048))
          .build();
}
