package win.ixuni.bkt.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.bkt.server.config.GatewayProperties;

/**
 * bkt 网关启动类
 * <p>
 * R2DBC auto-configuration is excluded: the PostgreSQL store builds its own pool and only when
 * {@code bkt.store.type=postgresql}.
 */
@SpringBootApplication(
        scanBasePackages = "win.ixuni.bkt.server",
        excludeName = {
                "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
                "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
                "org.springframework.boot.autoconfigure.r2dbc.R2dbcTransactionManagerAutoConfiguration"
        }
)
@EnableConfigurationProperties(GatewayProperties.class)
public class BktServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BktServerApplication.class, args);
    }
}
