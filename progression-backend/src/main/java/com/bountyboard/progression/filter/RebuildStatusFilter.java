package com.bountyboard.progression.filter;

import com.bountyboard.progression.dto.CommonResponse;
import com.bountyboard.progression.util.RebuildStatusManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 重建状态过滤器：回填或全量重算进行中时，查询请求直接返回 423（资源被锁定），
 * 而不是阻塞在账本读锁上。只读请求（GET）受影响，写入请求照常排队。
 */
@Component
public class RebuildStatusFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RebuildStatusFilter.class);

    private final RebuildStatusManager statusManager;
    private final ObjectMapper objectMapper;

    public RebuildStatusFilter(RebuildStatusManager statusManager, ObjectMapper objectMapper) {
        this.statusManager = statusManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (statusManager.isRebuildInProgress() && "GET".equalsIgnoreCase(httpRequest.getMethod())) {
            log.warn("拦截请求: {} {} (账本重建正在进行)", httpRequest.getMethod(), httpRequest.getRequestURI());

            httpResponse.setStatus(423);
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<String> errorResponse = CommonResponse.error(423, "账本正在重建，请稍后再试");
            httpResponse.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        chain.doFilter(request, response);
    }
}
