package com.tradingcore.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradingcore.domain.model.Signal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Admission control for signals ahead of risk validation.
 *
 * <p>Two Caffeine caches:
 * <ul>
 *   <li><b>Seen signal ids:</b> a signal id is admitted once; replays within the retention window
 *       are dropped as duplicates.</li>
 *   <li><b>Cooldown:</b> per strategy, symbol and action, a new signal within the cooldown of the
 *       last admitted one is dropped. A zero cooldown disables this check.</li>
 * </ul>
 */
@Component
public class SignalThrottle {

    private static final Logger log = LoggerFactory.getLogger(SignalThrottle.class);

    public enum Decision {
        ADMITTED,
        DUPLICATE,
        COOLDOWN
    }

    private final Cache<String, Boolean> seenSignals;
    private final Cache<String, Instant> lastAdmitted;
    private final Duration cooldown;
    private final Clock clock;

    public SignalThrottle(
            @Value("${tradingcore.router.signal-cooldown-ms:0}") long cooldownMs,
            @Value("${tradingcore.router.dedup-retention-minutes:60}") long dedupRetentionMinutes,
            Clock clock) {
        this.cooldown = Duration.ofMillis(cooldownMs);
        this.clock = clock;
        this.seenSignals = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(Duration.ofMinutes(dedupRetentionMinutes))
                .build();
        this.lastAdmitted = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(cooldown.isZero() ? Duration.ofSeconds(1) : cooldown)
                .build();
    }

    public Decision admit(Signal signal) {
        if (seenSignals.asMap().putIfAbsent(signal.getId(), Boolean.TRUE) != null) {
            log.debug("Duplicate signal {} from {} dropped", signal.getId(), signal.getStrategyId());
            return Decision.DUPLICATE;
        }
        if (cooldown.isZero()) {
            return Decision.ADMITTED;
        }

        Instant now = clock.instant();
        AtomicBoolean admitted = new AtomicBoolean(false);
        lastAdmitted.asMap().compute(cooldownKey(signal), (key, last) -> {
            if (last == null || !now.isBefore(last.plus(cooldown))) {
                admitted.set(true);
                return now;
            }
            return last;
        });
        if (!admitted.get()) {
            log.debug("Signal {} from {} within cooldown, dropped", signal.getId(), signal.getStrategyId());
            return Decision.COOLDOWN;
        }
        return Decision.ADMITTED;
    }

    private static String cooldownKey(Signal signal) {
        return signal.getStrategyId() + "|" + signal.getSymbol() + "|" + signal.getAction();
    }
}
