package com.bountyboard.progression.config;

import com.bountyboard.progression.filter.RebuildStatusFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<RebuildStatusFilter> rebuildStatusFilterBean(RebuildStatusFilter rebuildStatusFilter) {
        FilterRegistrationBean<RebuildStatusFilter> registrationBean =
                new FilterRegistrationBean<>(rebuildStatusFilter);

        // 只拦截查询类接口，写入接口和账本管理接口不受影响
        registrationBean.addUrlPatterns("/api/Hunter/*", "/api/Badge/*", "/api/badges/*");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
