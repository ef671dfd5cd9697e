package com.tripscout.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripscout.pojo.entity.ResearchJob;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

/**
 * 调研任务表。状态流转全部是带条件的单行更新，终态之后不再被改写。
 */
@Mapper
public interface ResearchJobMapper extends BaseMapper<ResearchJob> {

    @Update("UPDATE research_job SET status = 'in_progress', total_steps = #{totalSteps}, started_at = #{startedAt} "
            + "WHERE id = #{id} AND status = 'pending'")
    int markInProgress(@Param("id") String id, @Param("totalSteps") int totalSteps,
                       @Param("startedAt") LocalDateTime startedAt);

    /**
     * 进度只前进不后退：completed_steps 不大于新值时才更新。
     */
    @Update("UPDATE research_job SET completed_steps = #{completedSteps}, current_step = #{step} "
            + "WHERE id = #{id} AND status = 'in_progress' AND completed_steps <= #{completedSteps}")
    int updateProgress(@Param("id") String id, @Param("step") String step,
                       @Param("completedSteps") int completedSteps);

    @Update("UPDATE research_job SET status = 'completed', current_step = 'completed', results = #{results}, "
            + "completed_at = #{completedAt} WHERE id = #{id} AND status IN ('pending', 'in_progress')")
    int markCompleted(@Param("id") String id, @Param("results") String results,
                      @Param("completedAt") LocalDateTime completedAt);

    @Update("UPDATE research_job SET status = 'failed', current_step = 'failed', errors = #{errors}, "
            + "completed_at = #{completedAt} WHERE id = #{id} AND status IN ('pending', 'in_progress')")
    int markFailed(@Param("id") String id, @Param("errors") String errors,
                   @Param("completedAt") LocalDateTime completedAt);
}
