package com.slb.live_backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("企业直播观众与奖励服务 API / Live Viewer & Reward Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                - 观众同步：从企业微信直播接口分页拉取观看明细，合并入库并补全邀请人。
                                - 奖励计算：按签到次数、观看时长、观看场次组合规则批量计算红包奖励。
                                
                                2. 统一返回结构 / Unified Response Envelope
                                所有接口统一包裹在 ApiResponse<T> 结构中：
                                - code: 0 表示成功，非 0 表示业务或系统错误。
                                - message: 成功为 "ok"，错误时为具体的错误原因。
                                - data: 业务数据载体。
                                - traceId: 请求链路追踪 ID，便于排查问题。
                                
                                3. 异常约定 / Error Handling
                                - 参数与业务校验异常统一使用 BizException 抛出，由 GlobalExceptionHandler 转换为 ApiResponse。
                                - 观众同步、奖励计算的运行期失败不会抛出异常，而是在 data 中以 success=false 与 message 返回。
                                """
                        )
                        .contact(new Contact()
                                .name("Hyperion")
                                .email("backend@slb.xyz")
                        )
                );
    }
}
