package tech.yump.secretsync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.secretsync.config.SyncProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
public class LiteSecretSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiteSecretSyncApplication.class, args);
        log.info(">>> Lite Secret Sync Application Started <<<");
    }
}
