package com.easycashflows;

import com.easycashflows.config.AiProperties;
import com.easycashflows.config.WebhookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({WebhookProperties.class, AiProperties.class})
public class InboundWebhookApplication {

    public static void main(String[] args) {
        SpringApplication.run(InboundWebhookApplication.class, args);
    }
}
