package win.ixuni.bkt.store.postgresql.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PostgreSQL 元数据存储配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostgresStoreConfig {

    /**
     * R2DBC URL, e.g. {@code r2dbc:postgresql://localhost:5432/bkt}
     */
    private String url;

    private String username;

    private String password;

    @Builder.Default
    private int poolSize = 10;

    /**
     * 启动时自动建表
     */
    @Builder.Default
    private boolean autoCreateSchema = true;
}
