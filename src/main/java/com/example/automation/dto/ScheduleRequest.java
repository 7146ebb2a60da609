package com.example.automation.dto;

import com.example.automation.model.Frequency;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建或修改调度的请求体。修改时未提供的字段保持原值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    private String projectId;

    private Frequency frequency;

    private String time; // HH:mm

    private String timezone;

    private Integer dayOfWeek;

    private Integer dayOfMonth;

    private Boolean enabled;
}
