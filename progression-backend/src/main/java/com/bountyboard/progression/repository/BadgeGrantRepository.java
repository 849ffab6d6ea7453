package com.bountyboard.progression.repository;

import com.bountyboard.progression.entity.BadgeGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BadgeGrantRepository extends JpaRepository<BadgeGrant, Long> {

    List<BadgeGrant> findByHunterIdOrderByQualifyingTimeAscBadgeKeyAsc(String hunterId);

    /**
     * 每个徽章的获得人数，返回 [badge_key, count]
     */
    @Query("SELECT g.badgeKey, COUNT(g) FROM BadgeGrant g GROUP BY g.badgeKey")
    List<Object[]> countByBadgeKey();
}
