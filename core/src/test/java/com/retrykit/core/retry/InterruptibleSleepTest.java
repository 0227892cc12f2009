package com.retrykit.core.retry;

import com.retrykit.core.cancel.CancellationSource;
import com.retrykit.core.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class InterruptibleSleepTest {

    @Test
    void unassociated_token_sleeps_whole_duration_in_one_call() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        boolean cancelled = new InterruptibleSleep(sleeper).sleep(Duration.ofMillis(250), CancellationToken.none());

        assertFalse(cancelled);
        assertEquals(List.of(Duration.ofMillis(250)), sleeper.sleeps);
    }

    @Test
    void associated_token_sleeps_in_ticks_with_partial_last_tick() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        boolean cancelled = new InterruptibleSleep(sleeper, Duration.ofMillis(10))
                .sleep(Duration.ofMillis(35), new CancellationSource().token());

        assertFalse(cancelled);
        assertThat(sleeper.sleeps).containsExactly(
                Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(5));
        assertThat(sleeper.total()).isEqualTo(Duration.ofMillis(35));
    }

    @Test
    void cancellation_is_observed_at_next_tick_boundary() throws Exception {
        CancellationSource src = new CancellationSource();
        // 세 번째 tick 동안 취소 요청 → 네 번째 tick은 시작되지 않아야 함
        RecordingSleeper[] ref = new RecordingSleeper[1];
        ref[0] = new RecordingSleeper(() -> { if (ref[0].sleeps.size() == 3) src.requestStop(); });

        boolean cancelled = new InterruptibleSleep(ref[0], Duration.ofMillis(10))
                .sleep(Duration.ofSeconds(60), src.token());

        assertTrue(cancelled);
        assertEquals(3, ref[0].sleeps.size());
    }

    @Test
    void already_cancelled_token_returns_without_sleeping() throws Exception {
        CancellationSource src = new CancellationSource();
        src.requestStop();
        RecordingSleeper sleeper = new RecordingSleeper();

        assertTrue(new InterruptibleSleep(sleeper).sleep(Duration.ofSeconds(1), src.token()));
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void zero_duration_does_not_sleep() throws Exception {
        RecordingSleeper sleeper = new RecordingSleeper();
        InterruptibleSleep s = new InterruptibleSleep(sleeper);

        assertFalse(s.sleep(Duration.ZERO, CancellationToken.none()));
        assertFalse(s.sleep(Duration.ZERO, new CancellationSource().token()));
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void non_positive_tick_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new InterruptibleSleep(new RecordingSleeper(), Duration.ZERO));
    }
}
