package com.example.automation.service;

import com.example.automation.model.TriggerSource;

/**
 * 启动采集任务的外部能力。手动任务与定时任务走同一入口。
 */
public interface JobTrigger {

    /**
     * 为项目启动一次任务。调用应快速返回，任务本身在进程外执行。
     *
     * @param projectId 项目 ID
     * @param source    定时触发或手动运行
     * @return 新任务 ID
     * @throws JobTriggerException 项目没有可用目标、已有任务在运行或调用失败
     */
    String triggerJob(String projectId, TriggerSource source) throws JobTriggerException;
}
