package com.funnelforge.collaborator;

/**
 * Publishes finished content to a platform.
 */
public interface Publisher {

    PublishResult publish(PublishRequest content, String platform);

    record PublishRequest(String title, String script, String videoUrl, String thumbnailUrl, String armId) {}

    record PublishResult(String contentId) {}
}
