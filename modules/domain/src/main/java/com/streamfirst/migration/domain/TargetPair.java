package com.streamfirst.migration.domain;

import java.util.Objects;

/**
 * The two named routing targets a migration moves traffic between, for example the
 * blue and green target groups behind a load balancer.
 *
 * @param oldTarget name of the environment traffic is moving away from
 * @param newTarget name of the environment traffic is moving to
 */
public record TargetPair(String oldTarget, String newTarget) {
    public TargetPair {
        Objects.requireNonNull(oldTarget, "Old target cannot be null");
        Objects.requireNonNull(newTarget, "New target cannot be null");
        if (oldTarget.equals(newTarget)) {
            throw new IllegalArgumentException("Old and new target must differ: " + oldTarget);
        }
    }

    @Override
    public String toString() {
        return oldTarget + "->" + newTarget;
    }
}
