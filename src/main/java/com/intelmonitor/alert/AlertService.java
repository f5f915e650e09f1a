package com.intelmonitor.alert;

import com.intelmonitor.domain.model.Alert;
import com.intelmonitor.entity.AlertEntity;
import com.intelmonitor.event.EventPublisherHelper;
import com.intelmonitor.exception.ResourceNotFoundException;
import com.intelmonitor.mapper.AlertMapper;
import com.intelmonitor.repository.jpa.AlertJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence and user-facing operations on alerts: save, list, mark read, feedback.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertJpaRepository alertJpaRepository;
    private final AlertScorer alertScorer;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public AlertService(
            AlertJpaRepository alertJpaRepository,
            AlertScorer alertScorer,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.alertJpaRepository = alertJpaRepository;
        this.alertScorer = alertScorer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public Alert save(Alert alert) {
        AlertEntity saved = alertJpaRepository.save(alertMapper.toEntity(alert));
        return alertMapper.toDomain(saved);
    }

    public Alert getAlert(String alertId) {
        return alertJpaRepository
                .findById(alertId)
                .map(alertMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }

    /**
     * Newest first. {@code limit <= 0} returns every alert for the monitor.
     */
    public List<Alert> listAlerts(String monitorId, boolean unreadOnly, int limit) {
        Pageable page = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        List<AlertEntity> entities = unreadOnly
                ? alertJpaRepository.findByMonitorIdAndReadFalseOrderByCreatedAtDesc(monitorId, page)
                : alertJpaRepository.findByMonitorIdOrderByCreatedAtDesc(monitorId, page);
        return alertMapper.toDomainList(entities);
    }

    @Transactional
    public Alert markRead(String alertId) {
        AlertEntity entity = alertJpaRepository
                .findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        if (entity.isRead()) {
            return alertMapper.toDomain(entity);
        }
        entity.setRead(true);
        entity.setReadAt(LocalDateTime.now(clock));
        Alert alert = alertMapper.toDomain(alertJpaRepository.save(entity));
        eventPublisherHelper.publishAlertRead(this, alert);
        return alert;
    }

    @Transactional
    public Alert submitFeedback(String alertId, String feedback, String actionTaken) {
        AlertEntity entity = alertJpaRepository
                .findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
        entity.setUserFeedback(feedback);
        entity.setActionTaken(actionTaken);
        Alert alert = alertMapper.toDomain(alertJpaRepository.save(entity));

        alertScorer.incorporateFeedback(alertId, feedback);
        eventPublisherHelper.publishAlertFeedback(this, alert);
        log.info("Feedback stored for alert {} (monitor {})", alertId, alert.getMonitorId());
        return alert;
    }
}
