package com.advisorplatform.orchestrator.status;

import com.advisorplatform.common.model.SpecialistTag;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live working/ready view of the orchestrator's components, summed over all in-flight
 * requests. Purely observational: nothing reads it to make decisions.
 */
@Component
public class AgentStatusRegistry {

    public static final String INTENT  = "intent-classifier";
    public static final String ROUTER  = "router";
    public static final String CRITIC  = "critic";

    private final Clock                         clock;
    private final Map<String, AtomicInteger>    active     = new ConcurrentSkipListMap<>();
    private final Map<String, Instant>          lastActive = new ConcurrentHashMap<>();

    public AgentStatusRegistry(Clock clock) {
        this.clock = clock;
        for (String component : List.of(INTENT, ROUTER, CRITIC)) {
            active.put(component, new AtomicInteger());
        }
        for (SpecialistTag tag : SpecialistTag.values()) {
            active.put(specialist(tag), new AtomicInteger());
        }
    }

    public static String specialist(SpecialistTag tag) {
        return "specialist:" + tag.id();
    }

    public void markWorking(String component) {
        active.computeIfAbsent(component, c -> new AtomicInteger()).incrementAndGet();
        lastActive.put(component, clock.instant());
    }

    public void markReady(String component) {
        AtomicInteger counter = active.computeIfAbsent(component, c -> new AtomicInteger());
        counter.updateAndGet(n -> Math.max(0, n - 1));
        lastActive.put(component, clock.instant());
    }

    /** Marks {@code component} working for the lifetime of {@code work}, including cancellation. */
    public <T> Mono<T> track(String component, Mono<T> work) {
        return Mono.defer(() -> {
            markWorking(component);
            return work.doFinally(signal -> markReady(component));
        });
    }

    public List<AgentStatus> snapshot() {
        List<AgentStatus> out = new ArrayList<>(active.size());
        active.forEach((component, count) -> {
            int n = count.get();
            out.add(new AgentStatus(component, n > 0 ? AgentStatus.WORKING : AgentStatus.READY, n,
                lastActive.get(component)));
        });
        return out;
    }
}
