package com.dealbot.core.deal;

import com.dealbot.core.packager.DataFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataFileGeneratorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:30:45.123Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Payloads are framed by the marker prefix and suffix and sized exactly")
    void framesPayload() {
        DataFileGenerator generator = new DataFileGenerator(clock, List.of(4096L), new Random(3));

        DataFile file = generator.generate();
        String text = new String(file.getData(), StandardCharsets.ISO_8859_1);

        assertThat(file.getSize()).isEqualTo(4096);
        assertThat(file.getData()).hasSize(4096);
        assertThat(text).startsWith("DEALBOT_RANDOM_2026-03-01T12-30-45-123Z_");
        assertThat(text).endsWith("_2026-03-01T12-30-45-123Z_DEALBOT_RANDOM");
        assertThat(file.getName()).matches("random-2026-03-01T12-30-45-123Z-[0-9a-f]{16}\\.bin");
        String id = file.getName().substring(file.getName().lastIndexOf('-') + 1, file.getName().length() - 4);
        assertThat(text).contains("_" + id + "_START_").contains("_END_" + id + "_");
    }

    @Test
    @DisplayName("Consecutive payloads get distinct ids")
    void uniquePerCall() {
        DataFileGenerator generator = new DataFileGenerator(clock, List.of(1024L), new Random(3));

        assertThat(generator.generate().getName()).isNotEqualTo(generator.generate().getName());
    }

    @Test
    @DisplayName("Sizes too small for the markers are rejected")
    void rejectsTinySize() {
        DataFileGenerator generator = new DataFileGenerator(clock, List.of(1024L), new Random(3));

        assertThatThrownBy(() -> generator.generate(64))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("too small");
    }

    @Test
    @DisplayName("An empty size list is a configuration error")
    void requiresSizes() {
        assertThatThrownBy(() -> new DataFileGenerator(clock, List.of(), new Random(3)))
            .isInstanceOf(IllegalStateException.class);
    }
}
