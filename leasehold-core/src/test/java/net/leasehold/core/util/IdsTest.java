package net.leasehold.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdsTest {

    @Test
    void ids_have_fixed_length_and_crockford_alphabet() {
        String id = Ids.next(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(id).hasSize(Ids.LENGTH).matches("[0-9A-HJKMNP-TV-Z]{26}");
    }

    @Test
    void ids_sort_by_creation_time() {
        String earlier = Ids.next(Instant.parse("2025-01-01T00:00:00Z"));
        String later = Ids.next(Instant.parse("2025-01-01T00:00:00.001Z"));
        assertThat(earlier.compareTo(later)).isNegative();
        assertThat(earlier.substring(0, 10).compareTo(later.substring(0, 10))).isNegative();
    }

    @Test
    void same_millisecond_ids_are_distinct() {
        Instant at = Instant.parse("2025-06-01T12:00:00Z");
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) seen.add(Ids.next(at));
        assertThat(seen).hasSize(1000);
    }

    @Test
    void rejects_pre_epoch_timestamps() {
        assertThatThrownBy(() -> Ids.next(Instant.parse("1960-01-01T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
