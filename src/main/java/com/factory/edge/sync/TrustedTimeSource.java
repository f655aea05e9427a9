package com.factory.edge.sync;

import java.time.Instant;

import reactor.core.publisher.Mono;

/** Source of the time the local clock is compared against. */
public interface TrustedTimeSource {

    Mono<Instant> serverTime();
}
