package com.dealbot.client.http;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

public final class StreamUtils {

    private StreamUtils() {}

    /**
     * Writes {@code source} to {@code target}, requesting the next buffer only once the previous one
     * has been written. Completes with the byte count. Errors if the source errors, if the target
     * rejects a write (closed stream), or if the subscription is cancelled before the source drained.
     *
     * @param onChunk called with the size of every chunk before it is written, may be null
     */
    public static Mono<Long> writeWithBackpressure(Flux<DataBuffer> source, OutputStream target, LongConsumer onChunk) {
        AtomicLong written = new AtomicLong();
        Flux<DataBuffer> observed = source.doOnNext(buffer -> {
            int size = buffer.readableByteCount();
            if (onChunk != null) {
                onChunk.accept(size);
            }
            written.addAndGet(size);
        });
        return DataBufferUtils.write(observed, target)
                .doOnNext(DataBufferUtils::release)
                .then(Mono.fromCallable(written::get))
                .onErrorMap(IOException.class, e -> new IOException("Stream closed before drain: " + e.getMessage(), e));
    }

    /**
     * Closes a stream, attaching a close failure to {@code primary} when one is already propagating.
     */
    public static void closeStream(OutputStream stream, Throwable primary) throws IOException {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (IOException e) {
            if (primary != null) {
                primary.addSuppressed(e);
                return;
            }
            throw e;
        }
    }
}
