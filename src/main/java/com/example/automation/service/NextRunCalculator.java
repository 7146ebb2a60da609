package com.example.automation.service;

import com.example.automation.model.Schedule;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * 计算调度的下一次运行时间（UTC）。纯函数，无 I/O。
 * <p>
 * 入参必须已经通过 {@link ScheduleValidator} 校验。本地时间到 UTC 的换算交给时区库：
 * 落在夏令时跳变空档中的时间向后平移空档长度，落在回拨重叠区的时间取较早的偏移。
 */
@Component
public class NextRunCalculator {

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * 计算严格晚于 reference 的下一次运行时间。
     *
     * @param schedule  调度定义
     * @param reference 参考时间
     * @return 下一次运行时间
     */
    public Instant computeNextRun(Schedule schedule, Instant reference) {
        switch (schedule.getFrequency()) {
            case HOURLY:
                return reference.atZone(ZoneOffset.UTC)
                        .truncatedTo(ChronoUnit.HOURS)
                        .plusHours(1)
                        .toInstant();
            case DAILY:
                return nextDaily(schedule, reference);
            case WEEKLY:
                return nextWeekly(schedule, reference);
            case MONTHLY:
                return nextMonthly(schedule, reference);
            default:
                throw new IllegalStateException("Unsupported frequency: " + schedule.getFrequency());
        }
    }

    private Instant nextDaily(Schedule schedule, Instant reference) {
        ZoneId zone = ZoneId.of(schedule.getTimezone());
        LocalTime time = parseTime(schedule.getTimeOfDay());
        LocalDate date = reference.atZone(zone).toLocalDate();

        Instant candidate = atLocal(date, time, zone);
        if (!candidate.isAfter(reference)) {
            candidate = atLocal(date.plusDays(1), time, zone);
        }
        return candidate;
    }

    private Instant nextWeekly(Schedule schedule, Instant reference) {
        ZoneId zone = ZoneId.of(schedule.getTimezone());
        LocalTime time = parseTime(schedule.getTimeOfDay());
        DayOfWeek target = toDayOfWeek(schedule.getDayOfWeek());
        LocalDate date = reference.atZone(zone).toLocalDate().with(TemporalAdjusters.nextOrSame(target));

        Instant candidate = atLocal(date, time, zone);
        if (!candidate.isAfter(reference)) {
            candidate = atLocal(date.plusWeeks(1), time, zone);
        }
        return candidate;
    }

    private Instant nextMonthly(Schedule schedule, Instant reference) {
        ZoneId zone = ZoneId.of(schedule.getTimezone());
        LocalTime time = parseTime(schedule.getTimeOfDay());
        int dayOfMonth = schedule.getDayOfMonth();
        LocalDate date = reference.atZone(zone).toLocalDate().withDayOfMonth(dayOfMonth);

        Instant candidate = atLocal(date, time, zone);
        if (!candidate.isAfter(reference)) {
            // day_of_month <= 28，任何月份都存在该日期
            candidate = atLocal(date.plusMonths(1).withDayOfMonth(dayOfMonth), time, zone);
        }
        return candidate;
    }

    private Instant atLocal(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    /**
     * 0=周一 ... 6=周日。
     */
    static DayOfWeek toDayOfWeek(int dayOfWeek) {
        return DayOfWeek.of(dayOfWeek + 1);
    }

    static LocalTime parseTime(String value) {
        return LocalTime.parse(value, TIME_FORMAT);
    }
}
