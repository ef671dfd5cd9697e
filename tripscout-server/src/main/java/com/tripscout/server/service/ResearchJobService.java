package com.tripscout.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.tripscout.pojo.dto.TravelPreferencesDTO;
import com.tripscout.pojo.entity.ResearchJob;
import com.tripscout.pojo.research.ResearchResult;
import com.tripscout.pojo.vo.ResearchJobVO;

import java.util.List;

/**
 * 调研任务存储：任务创建、状态流转、进度与结果查询。
 */
public interface ResearchJobService extends IService<ResearchJob> {

    /**
     * 创建一个 pending 状态的任务并落库。
     */
    ResearchJob createJob(String userId, TravelPreferencesDTO preferences);

    /**
     * 查询任务，不存在时抛出 JOB_NOT_FOUND。
     */
    ResearchJob getJob(String jobId);

    ResearchJobVO getStatus(String jobId);

    /**
     * 读取已完成任务的结果；未完成、无结果、结果无法解析分别对应不同错误码。
     */
    ResearchResult getResults(String jobId);

    /**
     * 按创建时间倒序列出任务，userId / status 为空时不过滤。
     */
    List<ResearchJobVO> listJobs(String userId, String status, int limit);

    void deleteJob(String jobId);

    void markInProgress(String jobId, int totalSteps);

    void recordProgress(String jobId, String step, int completedSteps);

    void markCompleted(String jobId, ResearchResult result);

    void markFailed(String jobId, String error);
}
