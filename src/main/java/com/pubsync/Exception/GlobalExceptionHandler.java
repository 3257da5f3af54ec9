package com.pubsync.Exception;

import cn.hutool.core.exceptions.ExceptionUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;
import top.continew.starter.core.exception.BusinessException;

/**
 * 全局异常处理器
 * 将对账任务中未捕获的异常映射为进程退出码
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Slf4j
@Component
public class GlobalExceptionHandler implements ExitCodeExceptionMapper {

    /**
     * 业务异常(输入文件、配置错误等)
     */
    public static final int BUSINESS_ERROR = 2;

    /**
     * 其他未捕获的异常
     */
    public static final int SYSTEM_ERROR = 1;

    @Override
    public int getExitCode(Throwable exception) {
        Throwable business = ExceptionUtil.getCausedBy(exception, BusinessException.class);
        if (business != null) {
            log.warn("业务异常: {}", business.getMessage());
            return BUSINESS_ERROR;
        }
        log.error("系统异常: {}", exception.getMessage(), exception);
        return SYSTEM_ERROR;
    }
}
