package com.brandflow.config;

import com.brandflow.naming.ChatNameSuggestionGenerator;
import com.brandflow.naming.NameSuggestionGenerator;
import com.brandflow.naming.StubNameSuggestionGenerator;
import com.brandflow.workflow.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@Slf4j
public class NameGeneratorConfig {

    @Bean
    public NameSuggestionGenerator nameSuggestionGenerator(BrandFlowProperties properties,
                                                           ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                                           JsonProcessingService jsonProcessingService) {
        StubNameSuggestionGenerator stub = new StubNameSuggestionGenerator();
        BrandFlowProperties.NamingConfig naming = properties.getNaming();
        if (naming.getMode() == BrandFlowProperties.NamingMode.STUB) {
            log.info("Name suggestions use the built-in generator.");
            return stub;
        }
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if (builder == null) {
            throw new IllegalStateException("brandflow.naming.mode=chat needs a configured chat model.");
        }
        if (StringUtils.hasText(naming.getModel())) {
            builder.defaultOptions(OpenAiChatOptions.builder().model(naming.getModel()).build());
        }
        log.info("Name suggestions use the chat model{}.",
                StringUtils.hasText(naming.getModel()) ? " " + naming.getModel() : "");
        return new ChatNameSuggestionGenerator(builder.build(), jsonProcessingService, stub);
    }
}
