package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.AlertLevel;
import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.alert.AlertEvaluator;
import com.phillippitts.feedercontrol.service.alert.AlertMetric;
import com.phillippitts.feedercontrol.service.device.SensorReadingStore;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;
import com.phillippitts.feedercontrol.service.settings.ConfigSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Feeds the current metric values to the {@link AlertEvaluator}. Metrics whose sensor has not
 * reported yet are skipped.
 */
@Component
public class AlertsMonitorJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(AlertsMonitorJob.class);

    private final SensorReadingStore readings;
    private final ConfigSource configSource;
    private final AlertEvaluator evaluator;
    private final SchedulerProperties props;

    public AlertsMonitorJob(SensorReadingStore readings, ConfigSource configSource, AlertEvaluator evaluator,
                            SchedulerProperties props) {
        this.readings = readings;
        this.configSource = configSource;
        this.evaluator = evaluator;
        this.props = props;
    }

    @Override
    public String name() {
        return "alertsMonitor";
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return props.getAlertsMonitorInterval();
    }

    @Override
    public void run() {
        Map<AlertMetric, Double> values = new EnumMap<>(AlertMetric.class);
        for (AlertMetric metric : AlertMetric.values()) {
            readings.value(metric.sensorName(), metric.valueType()).ifPresent(v -> values.put(metric, v));
        }
        if (values.isEmpty()) {
            return;
        }
        Map<String, AlertLevel> levels = evaluator.evaluateAll(values, configSource.loadAlertThresholds());
        LOG.debug("Alert levels: {}", levels);
    }
}
