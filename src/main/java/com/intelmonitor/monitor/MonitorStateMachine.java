package com.intelmonitor.monitor;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Allowed monitor status transitions.
 *
 * <pre>
 *   ACTIVE -> PAUSED | DELETED | ERROR
 *   PAUSED -> ACTIVE | DELETED
 *   ERROR  -> ACTIVE | DELETED        (manual reactivation)
 *   DELETED is terminal
 * </pre>
 */
@Component
public class MonitorStateMachine {

    private static final Map<MonitorStatus, Set<MonitorStatus>> TRANSITIONS = new EnumMap<>(MonitorStatus.class);

    static {
        TRANSITIONS.put(MonitorStatus.ACTIVE, EnumSet.of(MonitorStatus.PAUSED, MonitorStatus.DELETED, MonitorStatus.ERROR));
        TRANSITIONS.put(MonitorStatus.PAUSED, EnumSet.of(MonitorStatus.ACTIVE, MonitorStatus.DELETED));
        TRANSITIONS.put(MonitorStatus.ERROR, EnumSet.of(MonitorStatus.ACTIVE, MonitorStatus.DELETED));
        TRANSITIONS.put(MonitorStatus.DELETED, EnumSet.noneOf(MonitorStatus.class));
    }

    public boolean canTransition(MonitorStatus from, MonitorStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public void validateTransition(MonitorStatus from, MonitorStatus to) {
        if (!canTransition(from, to)) {
            throw new BusinessException(
                    ErrorCode.INVALID_STATE_TRANSITION,
                    "Cannot transition monitor from " + from + " to " + to,
                    Map.of("from", String.valueOf(from), "to", String.valueOf(to)));
        }
    }
}
