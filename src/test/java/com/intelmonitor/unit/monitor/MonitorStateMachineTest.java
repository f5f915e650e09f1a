package com.intelmonitor.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.intelmonitor.domain.enums.MonitorStatus;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import com.intelmonitor.monitor.MonitorStateMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MonitorStateMachineTest {

    private final MonitorStateMachine stateMachine = new MonitorStateMachine();

    @Test
    @DisplayName("ACTIVE can pause, fail or be deleted")
    void activeTransitions() {
        assertThat(stateMachine.canTransition(MonitorStatus.ACTIVE, MonitorStatus.PAUSED)).isTrue();
        assertThat(stateMachine.canTransition(MonitorStatus.ACTIVE, MonitorStatus.ERROR)).isTrue();
        assertThat(stateMachine.canTransition(MonitorStatus.ACTIVE, MonitorStatus.DELETED)).isTrue();
    }

    @Test
    @DisplayName("PAUSED and ERROR can be reactivated, but PAUSED cannot move to ERROR")
    void reactivation() {
        assertThat(stateMachine.canTransition(MonitorStatus.PAUSED, MonitorStatus.ACTIVE)).isTrue();
        assertThat(stateMachine.canTransition(MonitorStatus.ERROR, MonitorStatus.ACTIVE)).isTrue();
        assertThat(stateMachine.canTransition(MonitorStatus.PAUSED, MonitorStatus.ERROR)).isFalse();
        assertThat(stateMachine.canTransition(MonitorStatus.ERROR, MonitorStatus.PAUSED)).isFalse();
    }

    @Test
    @DisplayName("DELETED is terminal")
    void deletedIsTerminal() {
        for (MonitorStatus target : MonitorStatus.values()) {
            assertThat(stateMachine.canTransition(MonitorStatus.DELETED, target)).isFalse();
        }
    }

    @Test
    @DisplayName("validateTransition throws INVALID_STATE_TRANSITION with from/to details")
    void validateRejects() {
        assertThatThrownBy(() -> stateMachine.validateTransition(MonitorStatus.DELETED, MonitorStatus.ACTIVE))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Cannot transition monitor from DELETED to ACTIVE")
                .satisfies(e -> {
                    BusinessException be = (BusinessException) e;
                    assertThat(be.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATE_TRANSITION);
                    assertThat(be.getDetails()).containsEntry("from", "DELETED").containsEntry("to", "ACTIVE");
                });
    }

    @Test
    @DisplayName("validateTransition accepts a legal move")
    void validateAccepts() {
        assertThatCode(() -> stateMachine.validateTransition(MonitorStatus.ACTIVE, MonitorStatus.PAUSED))
                .doesNotThrowAnyException();
    }
}
