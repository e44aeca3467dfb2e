package com.funnelforge.collaborator.simulated;

import com.funnelforge.collaborator.ContentGenerator;

/**
 * Template-based stand-in used when no AI generator is configured.
 */
public class SimulatedContentGenerator implements ContentGenerator {

    @Override
    public GeneratedContent generate(String streamKey, String platform, String hookType) {
        String title = switch (hookType) {
            case "numeric" -> "3 " + streamKey + " picks worth it this week";
            case "question" -> "Still overpaying for " + streamKey + "?";
            case "limited" -> "Only this week: " + streamKey + " deals";
            case "benefit" -> "Save more on " + streamKey + " with one switch";
            default -> "Latest " + streamKey + " news";
        };
        String script = title + ". Here is what changed in " + streamKey
                + " and how to pick the right option for you. Link in bio. #PR";
        // Stable pseudo-engagement in [75, 95)
        double engagement = 75 + Math.floorMod((streamKey + platform + hookType).hashCode(), 20);
        return new GeneratedContent(title, script, engagement);
    }
}
