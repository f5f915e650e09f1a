package com.intelmonitor.domain.model;

import com.intelmonitor.domain.enums.ChangeType;
import com.intelmonitor.domain.enums.MonitoringFrequency;
import com.intelmonitor.domain.enums.NotificationChannel;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-monitor configuration: check cadence, analysis frameworks, alert threshold
 * and notification preferences.
 *
 * <p>Frameworks are stored by their wire key (see
 * {@link com.intelmonitor.domain.enums.AnalysisFramework}); unknown keys are rejected
 * by {@code MonitorSettingsValidator}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonitorSettings {

    @NotNull
    @Builder.Default
    private MonitoringFrequency frequency = MonitoringFrequency.DAILY;

    @NotEmpty
    @Builder.Default
    private List<String> frameworks = new ArrayList<>(List.of("porter", "swot"));

    /** Minimum change confidence (0-1) for a change to count toward an alert. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double alertThreshold = 0.7;

    @Builder.Default
    private List<NotificationChannel> notificationChannels =
            new ArrayList<>(List.of(NotificationChannel.EMAIL, NotificationChannel.IN_APP));

    /** Change categories the owner cares most about; boosts the alert score. */
    @Builder.Default
    private List<ChangeType> preferredChangeTypes = new ArrayList<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    private List<String> competitors = new ArrayList<>();

    @Builder.Default
    private String analysisDepth = "standard";

    public static MonitorSettings defaults() {
        return MonitorSettings.builder().build();
    }
}
