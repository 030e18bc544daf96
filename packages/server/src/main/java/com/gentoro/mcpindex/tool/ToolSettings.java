package com.gentoro.mcpindex.tool;

import org.apache.commons.configuration2.Configuration;

/**
 * @param promotionLookahead how many top hits, the best included, are considered for promotion
 * @param minScoreRatio a candidate is promoted only if its score is at least this share of the top
 * @param maxAlternatives alternatives listed after the primary result
 * @param readmeMaxChars README length cap; 0 or less disables truncation
 */
public record ToolSettings(
    int promotionLookahead, double minScoreRatio, int maxAlternatives, int readmeMaxChars) {

  public static ToolSettings defaults() {
    return new ToolSettings(4, 0.9, 3, 20_000);
  }

  public static ToolSettings fromConfiguration(Configuration config) {
    ToolSettings d = defaults();
    return new ToolSettings(
        config.getInt("tool.promotion.lookahead", d.promotionLookahead()),
        config.getDouble("tool.promotion.min-score-ratio", d.minScoreRatio()),
        config.getInt("tool.alternatives", d.maxAlternatives()),
        config.getInt("tool.readme.max-chars", d.readmeMaxChars()));
  }
}
