package vessel.watchlist.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Vessel Watchlist API",
            version = "1.0.0",
            description =
                "선박 워치리스트 식별자 정합성 API\n\n"
                    + "## 주요 기능\n"
                    + "- MMSI/IMO 중복 및 MMSI-IMO 불일치 탐지\n"
                    + "- MMSI 기준 선박 집계\n"
                    + "- 워치리스트 통계"),
    servers = {@Server(url = "http://localhost:8080", description = "Local Development")})
public class OpenApiConfig {}
