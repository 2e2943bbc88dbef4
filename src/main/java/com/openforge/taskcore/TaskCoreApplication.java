package com.openforge.taskcore;

import com.openforge.taskcore.index.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

// MilvusProperties is registered here so the index services can bind it
// even when the conditional Milvus client configuration is switched off.
// Auditing fills BaseEntity's created/updated timestamps.
@SpringBootApplication
@EnableJpaAuditing
@EnableConfigurationProperties(MilvusProperties.class)
public class TaskCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskCoreApplication.class, args);
    }
}
