package com.pagecraft;

import com.pagecraft.service.AutosaveConfiguration;
import com.pagecraft.service.AutosaveQueue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AutosaveQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final AutosaveQueue queue = new AutosaveQueue(new AutosaveConfiguration(), clock);

    @Test
    void drainDue_waitsForQuietPeriod() {
        UUID design = UUID.randomUUID();
        queue.markDirty(design);

        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.drainDue()).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(queue.drainDue()).containsExactly(design);
        assertThat(queue.isDirty(design)).isFalse();
    }

    @Test
    void markDirty_restartsQuietPeriod() {
        UUID design = UUID.randomUUID();
        queue.markDirty(design);
        clock.advance(Duration.ofMillis(1500));
        queue.markDirty(design);
        clock.advance(Duration.ofMillis(1500));

        assertThat(queue.drainDue()).isEmpty();
        assertThat(queue.pending()).isEqualTo(1);
    }

    @Test
    void clear_dropsPendingDesign() {
        UUID design = UUID.randomUUID();
        queue.markDirty(design);
        queue.clear(design);
        clock.advance(Duration.ofSeconds(5));

        assertThat(queue.drainDue()).isEmpty();
    }
}
