package com.advisorplatform.specialist.service;

import com.advisorplatform.common.model.SpecialistTag;
import com.advisorplatform.specialist.agent.Specialist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability-tagged index of every {@link Specialist} bean. At most one specialist per tag.
 */
@Component
public class SpecialistRegistry {

    private static final Logger log = LoggerFactory.getLogger(SpecialistRegistry.class);

    private final Map<SpecialistTag, Specialist> byTag = new EnumMap<>(SpecialistTag.class);

    public SpecialistRegistry(List<Specialist> specialists) {
        for (Specialist s : specialists) {
            Specialist previous = byTag.put(s.tag(), s);
            if (previous != null) {
                throw new IllegalStateException("Duplicate specialist for tag=" + s.tag()
                    + ": " + previous.getClass().getSimpleName() + ", " + s.getClass().getSimpleName());
            }
        }
        log.info("[SpecialistRegistry] registered tags={}", byTag.keySet());
    }

    /** Specialists for the requested tags, in tag order. Unregistered tags are skipped. */
    public List<Specialist> select(Collection<SpecialistTag> tags) {
        List<Specialist> selected = new ArrayList<>();
        for (SpecialistTag tag : SpecialistTag.values()) {
            if (!tags.contains(tag)) continue;
            Specialist s = byTag.get(tag);
            if (s == null) {
                log.warn("[SpecialistRegistry] no specialist registered for tag={}", tag);
                continue;
            }
            selected.add(s);
        }
        return selected;
    }

    public Set<SpecialistTag> registeredTags() {
        return Set.copyOf(byTag.keySet());
    }
}
