package com.bountyboard.progression.badge;

import com.bountyboard.progression.badge.rules.XpThresholdRule;
import com.bountyboard.progression.exception.ConfigurationException;
import com.bountyboard.progression.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class BadgeRegistryTest {

    @Test
    void testDefaultCatalogIsRegistered() {
        BadgeRegistry registry = TestFixtures.defaultRegistry();

        assertEquals(11, registry.all().size());
        assertEquals("First Blood", registry.displayName("FIRST_BLOOD"));
        // 已下线的徽章直接显示 key
        assertEquals("RETIRED_BADGE", registry.displayName("RETIRED_BADGE"));
    }

    @Test
    void testDuplicateKeyIsConfigurationError() {
        List<BadgeRule> rules = new ArrayList<>(List.of(
                new XpThresholdRule("RISING_HUNTER", "Rising Hunter", 1000),
                new XpThresholdRule("RISING_HUNTER", "Rising Again", 2000)));

        assertThatThrownBy(() -> new BadgeRegistry(rules))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("RISING_HUNTER");
    }

    @Test
    void testRuntimeRegistration() {
        BadgeRegistry registry = TestFixtures.defaultRegistry();

        registry.register(new XpThresholdRule("CENTURION", "Centurion", 100));

        assertTrue(registry.find("CENTURION").isPresent());
        assertThrows(ConfigurationException.class,
                () -> registry.register(new XpThresholdRule("CENTURION", "Centurion", 100)));
        assertThrows(ConfigurationException.class,
                () -> registry.register(new XpThresholdRule(" ", "Blank", 100)));
    }
}
