package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.feeder.FeedPreset;
import com.phillippitts.feedercontrol.service.feeder.FeedSchedule;
import com.phillippitts.feedercontrol.service.feeder.FeedScheduleCache;
import com.phillippitts.feedercontrol.service.feeder.FeederActuator;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs enabled feed schedules whose {@code HH:mm} equals the current local time, each at most
 * once per day. A schedule is only marked done when the feeder accepted it, so a failed run is
 * retried on the next tick within the same minute.
 */
@Component
public class FeedScheduleJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(FeedScheduleJob.class);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final FeedScheduleCache cache;
    private final FeederActuator feeder;
    private final SchedulerProperties props;
    private final Clock clock;

    // schedule id -> date it last ran
    private final Map<String, LocalDate> executed = new ConcurrentHashMap<>();

    public FeedScheduleJob(FeedScheduleCache cache, FeederActuator feeder, SchedulerProperties props, Clock clock) {
        this.cache = cache;
        this.feeder = feeder;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "runFeedSchedule";
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return props.getFeedScheduleInterval();
    }

    @Override
    public void run() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        String currentTime = now.format(HH_MM);
        executed.values().removeIf(date -> !date.equals(today));

        for (FeedSchedule schedule : cache.schedules()) {
            if (!schedule.enabled() || !currentTime.equals(schedule.time())) {
                continue;
            }
            if (today.equals(executed.get(schedule.id()))) {
                continue;
            }
            Optional<FeedPreset> preset = cache.preset(schedule.presetId());
            if (preset.isEmpty()) {
                LOG.error("Preset {} not found for schedule {}", schedule.presetId(), schedule.id());
                continue;
            }
            FeedPreset p = preset.get();
            LOG.info("Executing schedule {} at {} with preset {} (size={}g, blower={}s)",
                    schedule.id(), schedule.time(), p.id(), p.amountGrams(), p.blowerDurationSeconds());
            if (feeder.startFeeding(p.amountGrams(), p.blowerDurationSeconds())) {
                executed.put(schedule.id(), today);
                LOG.info("Schedule {} done for {}", schedule.id(), today);
            } else {
                LOG.error("Schedule {} failed to start feeding", schedule.id());
            }
        }
    }
}
