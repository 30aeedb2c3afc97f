package com.slb.live_backend.modules.viewer.mapper;

import com.slb.live_backend.modules.viewer.domain.IdNameRow;
import com.slb.live_backend.modules.viewer.domain.InviterUpdate;
import com.slb.live_backend.modules.viewer.domain.KindCount;
import com.slb.live_backend.modules.viewer.domain.ViewerIdRow;
import com.slb.live_backend.modules.viewer.domain.ViewerKey;
import com.slb.live_backend.modules.viewer.entity.LiveViewer;
import com.slb.live_backend.modules.viewer.vo.ViewerStatisticsVo;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.Collection;
import java.util.List;

@Mapper
public interface LiveViewerMapper {

    List<LiveViewer> selectByLivingId(@Param("livingId") String livingId);

    List<LiveViewer> selectByLivingIds(@Param("livingIds") Collection<String> livingIds);

    /**
     * 批量插入，回填自增 id。
     */
    int insertBatch(@Param("records") List<LiveViewer> records);

    /**
     * 覆盖观看相关字段（观看时长、评论、连麦、进入时间、昵称、邀请人），不触碰签到与奖励字段。
     */
    int updateAttendance(LiveViewer record);

    List<ViewerIdRow> selectIdsByKeys(@Param("livingId") String livingId,
                                      @Param("keys") Collection<ViewerKey> keys);

    int updateInviterBatch(@Param("rows") List<InviterUpdate> rows);

    /**
     * 按观众 id 查询最近一次出现的昵称（跨场次）。
     */
    List<IdNameRow> selectNamesByParticipantIds(@Param("ids") Collection<String> ids);

    String selectLatestNameByParticipantId(@Param("participantId") String participantId);

    int updateRewardBatch(@Param("records") List<LiveViewer> records);

    int updateSignInfoBatch(@Param("records") List<LiveViewer> records);

    List<KindCount> countByKind(@Param("livingId") String livingId);

    ViewerStatisticsVo selectStatistics(@Param("livingId") String livingId);
}
