package com.pubsync.Exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import top.continew.starter.core.exception.BusinessException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("退出码映射")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("业务异常映射为业务退出码")
    void businessException() {
        assertThat(handler.getExitCode(new BusinessException("文件不存在: a.xlsx")))
                .isEqualTo(GlobalExceptionHandler.BUSINESS_ERROR);
    }

    @Test
    @DisplayName("启动器包装的业务异常同样识别")
    void wrappedBusinessException() {
        IllegalStateException wrapped = new IllegalStateException(
                "Failed to execute CommandLineRunner", new BusinessException("工作表不存在: Last"));

        assertThat(handler.getExitCode(wrapped)).isEqualTo(GlobalExceptionHandler.BUSINESS_ERROR);
    }

    @Test
    @DisplayName("其他异常映射为系统退出码")
    void otherException() {
        assertThat(handler.getExitCode(new IllegalArgumentException("boom")))
                .isEqualTo(GlobalExceptionHandler.SYSTEM_ERROR);
    }
}
