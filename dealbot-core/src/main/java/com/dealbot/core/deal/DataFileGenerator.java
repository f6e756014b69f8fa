package com.dealbot.core.deal;

import com.dealbot.core.packager.DataFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Produces unique random payloads for deals. The bytes are framed by a marker prefix and suffix so a
 * retrieved payload can be recognised as a probe upload.
 */
@Component
@Slf4j
public class DataFileGenerator {

    private final Clock clock;
    private final List<Long> sizes;
    private final Random random;

    public DataFileGenerator(Clock clock,
                             @Value("${dealbot.dataset.random-sizes:10485760}") List<Long> sizes) {
        this(clock, sizes, new SecureRandom());
    }

    DataFileGenerator(Clock clock, List<Long> sizes, Random random) {
        if (sizes == null || sizes.isEmpty()) {
            throw new IllegalStateException("dealbot.dataset.random-sizes must list at least one size");
        }
        this.clock = clock;
        this.sizes = List.copyOf(sizes);
        this.random = random;
    }

    /** Random payload with a size picked from the configured list. */
    public DataFile generate() {
        return generate(sizes.get(random.nextInt(sizes.size())));
    }

    public DataFile generate(long targetSize) {
        String timestamp = clock.instant().toString().replace(':', '-').replace('.', '-');
        byte[] idBytes = new byte[8];
        random.nextBytes(idBytes);
        String uniqueId = Hex.encodeHexString(idBytes);

        byte[] prefix = ("DEALBOT_RANDOM_" + timestamp + "_" + uniqueId + "_START_").getBytes(StandardCharsets.UTF_8);
        byte[] suffix = ("_END_" + uniqueId + "_" + timestamp + "_DEALBOT_RANDOM").getBytes(StandardCharsets.UTF_8);
        long randomSize = targetSize - prefix.length - suffix.length;
        if (randomSize <= 0) {
            throw new IllegalArgumentException("Target size " + targetSize + " is too small for prefix and suffix");
        }
        if (targetSize > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Target size " + targetSize + " exceeds the in-memory payload limit");
        }

        byte[] data = new byte[(int) targetSize];
        System.arraycopy(prefix, 0, data, 0, prefix.length);
        byte[] body = new byte[(int) randomSize];
        random.nextBytes(body);
        System.arraycopy(body, 0, data, prefix.length, body.length);
        System.arraycopy(suffix, 0, data, prefix.length + body.length, suffix.length);

        String name = "random-" + timestamp + "-" + uniqueId + ".bin";
        log.info("[DEAL] Generated random dataset | name={} | size={}", name, data.length);
        return DataFile.builder()
            .name(name)
            .data(data)
            .size(data.length)
            .build();
    }
}
