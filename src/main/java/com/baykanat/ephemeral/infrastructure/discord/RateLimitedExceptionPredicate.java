package com.baykanat.ephemeral.infrastructure.discord;

import java.util.function.Predicate;

/** discordApi circuit breaker'ı için: 429 kaynaklı hatalar başarısızlık sayılmaz. */
public class RateLimitedExceptionPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable failure) {
        return DiscordRateLimit.isRateLimited(failure);
    }
}
