package com.starscape.mentana.common.health;

/**
 * Implemented by every adapter so the health aggregator can ask it whether its backend is reachable.
 * Implementations make one cheap backend call and must not retry.
 */
public interface LivenessProbe {

    ProbeResult probe();
}
