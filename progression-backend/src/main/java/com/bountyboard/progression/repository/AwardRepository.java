package com.bountyboard.progression.repository;

import com.bountyboard.progression.entity.Award;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface AwardRepository extends JpaRepository<Award, Long> {

    // 幂等检查
    boolean existsByIdempotencyKey(String idempotencyKey);

    /**
     * 某个猎人的全部 award，按到达顺序
     */
    List<Award> findByHunterIdOrderByAwardIdAsc(String hunterId);

    /**
     * 全量导出：按到达顺序
     */
    List<Award> findAllByOrderByAwardIdAsc();

    // 金额缺失 / 格式错误、按最低档处理的 award，供人工复核
    List<Award> findByDegradedTrueOrderByAwardIdAsc();

    @Query("SELECT COALESCE(SUM(a.xpAmount), 0L) FROM Award a WHERE a.occurredTime >= :since")
    Long sumXpSince(@Param("since") LocalDateTime since);
}
