package com.funnelforge.collaborator;

/**
 * Turns a script into a platform-shaped video.
 */
public interface VideoRenderer {

    RenderResult render(String script, String platform);

    /**
     * @param status       "completed" when the video is ready, anything else otherwise
     * @param videoUrl     location of the rendered video (nullable until completed)
     * @param thumbnailUrl location of the thumbnail (nullable)
     */
    record RenderResult(String status, String videoUrl, String thumbnailUrl) {
        public boolean isCompleted() {
            return "completed".equalsIgnoreCase(status);
        }
    }
}
