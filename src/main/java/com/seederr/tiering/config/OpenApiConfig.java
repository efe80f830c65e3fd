package com.seederr.tiering.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 文档配置
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Seederr 分层放置服务 API")
                .version("1.0.0")
                .description("""
                    按热度在 SSD 缓存盘与主存储阵列之间调度种子内容

                    ## 调度流程
                    - FETCH → SCORE → PLAN → RECONCILE → EXECUTE → PERSIST
                    - 严格前缀 Top-K 容量规划
                    - 每轮操作数上限，默认演练模式

                    ## 安全保证
                    - 主存储副本永不删除
                    - 先复制校验再改指向，改指向确认成功后才删除缓存副本
                    """)
                .license(new License()
                    .name("Apache 2.0")
                    .url("https://www.apache.org/licenses/LICENSE-2.0")));
    }
}
