package com.funnelforge.collaborator.simulated;

import com.funnelforge.collaborator.VideoRenderer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renderer stand-in that completes immediately with placeholder URLs.
 */
public class SimulatedVideoRenderer implements VideoRenderer {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public RenderResult render(String script, String platform) {
        int n = counter.incrementAndGet();
        String aspect = "tiktok".equalsIgnoreCase(platform) ? "9x16" : "16x9";
        return new RenderResult("completed",
                "https://media.invalid/video/" + n + "-" + aspect + ".mp4",
                "https://media.invalid/thumb/" + n + ".jpg");
    }
}
