package com.pagecraft.service;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("designer.autosave")
public class AutosaveConfiguration {

    /** Quiet period after the last edit before a design is written. */
    private Duration debounce = Duration.ofSeconds(2);
    private Duration interval = Duration.ofSeconds(1);

    public Duration getDebounce() { return debounce; }
    public void setDebounce(Duration debounce) { this.debounce = debounce; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
}
