package com.dealbot.client.http;

import com.dealbot.common.cancel.CancellationSignal;
import com.dealbot.common.cancel.CancelledException;
import reactor.core.publisher.Mono;

/**
 * Ties reactive exchanges to a {@link CancellationSignal}.
 */
public final class CancellableRequests {

    private CancellableRequests() {
    }

    /**
     * Races {@code source} against the signal. When the signal wins the source subscription is
     * cancelled, which closes its connection. The listener is removed once either side terminates.
     */
    public static <T> Mono<T> race(Mono<T> source, CancellationSignal signal) {
        return Mono.firstWithSignal(source, whenCancelled(signal));
    }

    static <T> Mono<T> whenCancelled(CancellationSignal signal) {
        return Mono.create(sink -> {
            CancellationSignal.Registration registration =
                signal.onCancel(reason -> sink.error(new CancelledException(reason)));
            sink.onDispose(registration::close);
        });
    }
}
