package com.smarttodo.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional boot-time check of the reasoning capability. Off by default so a missing
 * key never blocks startup.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "smarttodo.ai.check-connection-on-startup", havingValue = "true")
public class AiConnectionCheckConfig {

    @Bean
    public CommandLineRunner checkAiConnection(ChatModel chatModel) {
        return args -> {
            log.info("Checking AI connection...");
            try {
                String response = chatModel.call("Hello! Are you working?");
                log.info("AI connection successful, response: {}", response);
            } catch (Exception e) {
                log.warn("AI connection failed: {}", e.getMessage(), e);
            }
        };
    }
}
