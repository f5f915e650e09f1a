package com.intelmonitor.monitor;

import com.intelmonitor.domain.enums.AnalysisFramework;
import com.intelmonitor.domain.model.MonitorSettings;
import com.intelmonitor.exception.BusinessException;
import com.intelmonitor.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks monitor settings and normalizes framework keys to their canonical lowercase form.
 */
@Component
public class MonitorSettingsValidator {

    private final Validator validator;

    public MonitorSettingsValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @return a normalized copy of the settings (defaults when null)
     * @throws BusinessException VALIDATION_ERROR listing every violation
     */
    public MonitorSettings validate(MonitorSettings settings) {
        if (settings == null) {
            return MonitorSettings.defaults();
        }

        Map<String, Object> violations = new LinkedHashMap<>();
        Set<ConstraintViolation<MonitorSettings>> constraintViolations = validator.validate(settings);
        for (ConstraintViolation<MonitorSettings> violation : constraintViolations) {
            violations.put(violation.getPropertyPath().toString(), violation.getMessage());
        }

        List<String> frameworks = new ArrayList<>();
        if (settings.getFrameworks() != null) {
            for (String key : settings.getFrameworks()) {
                Optional<AnalysisFramework> framework = AnalysisFramework.fromKey(key);
                if (framework.isPresent()) {
                    if (!frameworks.contains(framework.get().getKey())) {
                        frameworks.add(framework.get().getKey());
                    }
                } else {
                    violations.put("frameworks", "unknown framework '" + key + "'");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid monitor settings: " + violations, violations);
        }
        return settings.toBuilder().frameworks(frameworks).build();
    }
}
