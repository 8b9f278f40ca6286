package com.questrail.bridge.config;

import java.time.Duration;

/**
 * {@code defaults:} section; values applied to rules that omit them.
 */
public class DefaultsSection {

    private int cooldownSeconds = 0;

    public void validate() {
        if (cooldownSeconds < 0) {
            throw new IllegalStateException("defaults.cooldownSeconds must be >= 0");
        }
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(int cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }
}
