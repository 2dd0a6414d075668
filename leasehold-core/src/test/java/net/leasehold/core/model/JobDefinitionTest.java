package net.leasehold.core.model;

import net.leasehold.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class JobDefinitionTest {

    @Test
    void minimal_definition_is_valid() {
        assertThatCode(() -> JobDefinition.of("nightly", "snapshot", "0 0 3 * * *", "ops").validate())
                .doesNotThrowAnyException();
    }

    @Test
    void blank_required_fields_are_rejected() {
        assertThatThrownBy(() -> JobDefinition.of(" ", "snapshot", "0 0 3 * * *", "ops").validate())
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("name");
        assertThatThrownBy(() -> JobDefinition.of("n", null, "0 0 3 * * *", "ops").validate())
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("kind");
        assertThatThrownBy(() -> JobDefinition.of("n", "snapshot", "", "ops").validate())
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("schedule");
        assertThatThrownBy(() -> JobDefinition.of("n", "snapshot", "0 0 3 * * *", null).validate())
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("createdBy");
    }

    @Test
    void negative_retries_and_zero_timeout_are_rejected() {
        JobDefinition base = JobDefinition.of("n", "snapshot", "0 0 3 * * *", "ops");
        assertThatThrownBy(() -> base.withMaxRetries(-1).validate()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> base.withTimeout(Duration.ZERO).validate()).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void metadata_accumulates_and_is_immutable() {
        JobDefinition def = JobDefinition.of("n", "snapshot", "0 0 3 * * *", "ops")
                .withMetadata("owner", "platform")
                .withMetadata("runbook", "RB-12");

        assertThat(def.metadata()).containsOnly(entry("owner", "platform"), entry("runbook", "RB-12"));
        assertThat(JobDefinition.of("n", "snapshot", "0 0 3 * * *", "ops").metadata()).isEmpty();
        assertThatThrownBy(() -> def.metadata().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> def.withMetadata(" ", "v").validate()).isInstanceOf(ConfigurationException.class);
    }
}
