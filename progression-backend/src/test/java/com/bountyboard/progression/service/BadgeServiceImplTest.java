package com.bountyboard.progression.service;

import com.bountyboard.progression.dto.BadgeDefinitionDTO;
import com.bountyboard.progression.repository.BadgeGrantRepository;
import com.bountyboard.progression.repository.HunterRepository;
import com.bountyboard.progression.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class BadgeServiceImplTest {

    @Mock
    private BadgeGrantRepository badgeGrantRepository;

    @Mock
    private HunterRepository hunterRepository;

    private BadgeServiceImpl badgeService;

    private List<Object[]> mockCounts;

    @BeforeEach
    void setUp() {
        badgeService = new BadgeServiceImpl(TestFixtures.defaultRegistry(), badgeGrantRepository,
                hunterRepository, TestFixtures.defaultTables(), new LedgerLock());

        // [badge_key, count]
        mockCounts = new ArrayList<>();
        mockCounts.add(new Object[]{"FIRST_BLOOD", 40L});
        mockCounts.add(new Object[]{"BUG_SLAYER", 5L});
    }

    // 测试 getBadgeList：按注册顺序列出全部徽章并带上获得人数
    @Test
    void testGetBadgeList() {
        when(hunterRepository.count()).thenReturn(80L);
        when(badgeGrantRepository.countByBadgeKey()).thenReturn(mockCounts);

        List<BadgeDefinitionDTO> result = badgeService.getBadgeList();

        assertEquals(11, result.size());
        BadgeDefinitionDTO first = result.get(0);
        assertEquals("FIRST_BLOOD", first.getBadgeKey());
        assertEquals("First Blood", first.getName());
        assertEquals("red", first.getColor());
        assertEquals("git", first.getLogo());
        assertEquals(40, first.getAchievedCount());
        assertEquals(0.5, first.getCompletionRate()); // 40/80

        BadgeDefinitionDTO streak = result.stream()
                .filter(b -> b.getBadgeKey().equals("STREAK_MASTER"))
                .findFirst()
                .orElseThrow();
        assertEquals(0, streak.getAchievedCount());
        assertEquals(0.0, streak.getCompletionRate());
        // 未配置样式的徽章使用默认样式
        assertEquals("blue", streak.getColor());

        verify(hunterRepository).count();
        verify(badgeGrantRepository).countByBadgeKey();
    }

    // 测试猎人数为 0 的情况
    @Test
    void testGetBadgeList_NoHunters() {
        when(hunterRepository.count()).thenReturn(0L);
        when(badgeGrantRepository.countByBadgeKey()).thenReturn(mockCounts);

        List<BadgeDefinitionDTO> result = badgeService.getBadgeList();

        assertEquals(40.0, result.get(0).getCompletionRate()); // 分母按 1 计
    }
}
