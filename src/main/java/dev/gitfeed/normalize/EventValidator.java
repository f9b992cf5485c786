package dev.gitfeed.normalize;

import dev.gitfeed.domain.enums.EventAction;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Last check before an event reaches storage. The classifier only emits supported
 * actions, so a rejection here means a programming error upstream, not bad input.
 */
@Component
public class EventValidator {

    private static final Set<EventAction> SUPPORTED = EnumSet.allOf(EventAction.class);

    public boolean isSupportedAction(EventAction action) {
        return action != null && SUPPORTED.contains(action);
    }
}
