package com.example.automation.service;

import com.example.automation.exception.InvalidRequestException;
import com.example.automation.model.Frequency;
import com.example.automation.model.Schedule;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 调度定义的边界校验。只有通过校验的定义才会交给 {@link NextRunCalculator}。
 */
@Component
public class ScheduleValidator {

    public static final int MAX_DAY_OF_MONTH = 28;

    /**
     * 校验调度定义。
     *
     * @param schedule 调度定义
     * @throws InvalidRequestException 定义不合法
     */
    public void validate(Schedule schedule) {
        Frequency frequency = schedule.getFrequency();
        if (frequency == null) {
            throw new InvalidRequestException("frequency is required");
        }

        validateTimezone(schedule.getTimezone());

        if (frequency.requiresTimeOfDay()) {
            validateTime(schedule.getTimeOfDay());
        } else if (schedule.getTimeOfDay() != null) {
            validateTime(schedule.getTimeOfDay());
        }

        Integer dayOfWeek = schedule.getDayOfWeek();
        if (frequency == Frequency.WEEKLY) {
            if (dayOfWeek == null) {
                throw new InvalidRequestException("day_of_week is required for weekly schedules");
            }
            if (dayOfWeek < 0 || dayOfWeek > 6) {
                throw new InvalidRequestException("day_of_week must be between 0 (Monday) and 6 (Sunday)");
            }
        } else if (dayOfWeek != null) {
            throw new InvalidRequestException("day_of_week is only allowed for weekly schedules");
        }

        Integer dayOfMonth = schedule.getDayOfMonth();
        if (frequency == Frequency.MONTHLY) {
            if (dayOfMonth == null) {
                throw new InvalidRequestException("day_of_month is required for monthly schedules");
            }
            if (dayOfMonth < 1 || dayOfMonth > MAX_DAY_OF_MONTH) {
                throw new InvalidRequestException("day_of_month must be between 1 and " + MAX_DAY_OF_MONTH);
            }
        } else if (dayOfMonth != null) {
            throw new InvalidRequestException("day_of_month is only allowed for monthly schedules");
        }
    }

    private void validateTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidRequestException("timezone is required");
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidRequestException("Unknown timezone: " + timezone);
        }
    }

    private void validateTime(String time) {
        if (time == null) {
            throw new InvalidRequestException("time is required unless frequency is hourly");
        }
        try {
            NextRunCalculator.parseTime(time);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Time must be in HH:MM format");
        }
    }
}
