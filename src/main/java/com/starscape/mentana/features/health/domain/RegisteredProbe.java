package com.starscape.mentana.features.health.domain;

import com.starscape.mentana.common.health.LivenessProbe;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A component the aggregator monitors.
 *
 * <p>The probe is looked up through the supplier on every check, inside the probe's own task,
 * so a component whose adapter cannot be resolved shows up as unreachable instead of breaking
 * the whole report.</p>
 */
public record RegisteredProbe(
    String name,
    boolean required,
    Supplier<? extends LivenessProbe> probe
) {

    public RegisteredProbe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(probe, "probe");
    }

    public static RegisteredProbe required(String name, LivenessProbe probe) {
        return new RegisteredProbe(name, true, () -> probe);
    }

    public static RegisteredProbe optional(String name, LivenessProbe probe) {
        return new RegisteredProbe(name, false, () -> probe);
    }
}
