package com.funnelforge.collaborator;

/**
 * Produces a title and script for one stream/platform/hook combination.
 */
public interface ContentGenerator {

    GeneratedContent generate(String streamKey, String platform, String hookType);

    record GeneratedContent(String title, String script, double estimatedEngagement) {}
}
