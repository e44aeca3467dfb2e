package com.funnelforge.core.bandit;

import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Draws Beta variates as the ratio of two Gamma variates.
 *
 * <pre>
 *   X ~ Gamma(alpha), Y ~ Gamma(beta)  =>  X / (X + Y) ~ Beta(alpha, beta)
 * </pre>
 *
 * <p>Gamma variates use Marsaglia and Tsang's squeeze method with Box–Muller normals. For
 * {@code shape < 1} the draw is boosted: {@code Gamma(shape + 1) * U^(1/shape)}, which keeps
 * the method valid and the loop terminating for small shapes.
 */
@Component
public class BetaSampler {

    private final Random random;

    public BetaSampler(Random random) {
        this.random = random;
    }

    /**
     * @param alpha successes, must be positive
     * @param beta  failures, must be positive
     * @return a sample in [0, 1]
     */
    public double sample(double alpha, double beta) {
        if (alpha <= 0 || beta <= 0) {
            throw new IllegalArgumentException("Beta parameters must be positive: alpha=" + alpha + ", beta=" + beta);
        }
        double x = gamma(alpha);
        double y = gamma(beta);
        double sum = x + y;
        return sum > 0 ? x / sum : 0.5;
    }

    double gamma(double shape) {
        if (shape < 1) {
            return gamma(shape + 1) * Math.pow(nextOpenUnit(), 1 / shape);
        }

        double d = shape - 1.0 / 3;
        double c = 1 / Math.sqrt(9 * d);
        while (true) {
            double x;
            double v;
            do {
                x = normal();
                v = 1 + c * x;
            } while (v <= 0);

            v = v * v * v;
            double u = nextOpenUnit();
            if (u < 1 - 0.0331 * x * x * x * x) {
                return d * v;
            }
            if (Math.log(u) < 0.5 * x * x + d * (1 - v + Math.log(v))) {
                return d * v;
            }
        }
    }

    private double normal() {
        double u1 = nextOpenUnit();
        double u2 = random.nextDouble();
        return Math.sqrt(-2 * Math.log(u1)) * Math.cos(2 * Math.PI * u2);
    }

    // (0, 1): log(0) would yield -Infinity
    private double nextOpenUnit() {
        double u;
        do {
            u = random.nextDouble();
        } while (u == 0.0);
        return u;
    }
}
