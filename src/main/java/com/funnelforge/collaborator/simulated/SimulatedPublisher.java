package com.funnelforge.collaborator.simulated;

import com.funnelforge.collaborator.Publisher;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publisher stand-in that only assigns content ids.
 */
public class SimulatedPublisher implements Publisher {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public PublishResult publish(PublishRequest content, String platform) {
        return new PublishResult(platform + "-" + counter.incrementAndGet());
    }
}
