package com.bountyboard.progression.badge;

import com.bountyboard.progression.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 徽章注册表：收集所有 BadgeRule Bean，运行期也可以追加新规则。
 * 新增的规则在下一次重算（catch-up）时对已有猎人补发。
 */
@Component
public class BadgeRegistry {

    private static final Logger log = LoggerFactory.getLogger(BadgeRegistry.class);

    private final List<BadgeRule> rules = new CopyOnWriteArrayList<>();

    public BadgeRegistry(List<BadgeRule> initialRules) {
        for (BadgeRule rule : initialRules) {
            add(rule);
        }
        log.info("Badge registry initialized with {} rules.", rules.size());
    }

    /**
     * 运行期注册新徽章。key 重复或为空属于配置错误
     */
    public void register(BadgeRule rule) {
        add(rule);
        log.info("Badge rule registered at runtime: {} ({})", rule.getBadgeKey(), rule.getName());
    }

    public List<BadgeRule> all() {
        return List.copyOf(rules);
    }

    public Optional<BadgeRule> find(String badgeKey) {
        return rules.stream().filter(r -> r.getBadgeKey().equals(badgeKey)).findFirst();
    }

    /**
     * 展示名；规则已下线的历史徽章直接显示 key
     */
    public String displayName(String badgeKey) {
        return find(badgeKey).map(BadgeRule::getName).orElse(badgeKey);
    }

    private synchronized void add(BadgeRule rule) {
        String key = rule.getBadgeKey();
        if (key == null || key.isBlank() || key.length() > 50) {
            throw new ConfigurationException("Badge rule " + rule.getClass().getSimpleName() + " has an invalid key: " + key);
        }
        if (find(key).isPresent()) {
            throw new ConfigurationException("Duplicate badge key: " + key);
        }
        rules.add(rule);
    }
}
