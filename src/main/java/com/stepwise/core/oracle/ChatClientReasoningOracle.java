package com.stepwise.core.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link ReasoningOracle} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The instruction goes in as the system prompt and the context as the user
 * message. Response text is returned as-is; parsing is the caller's job.
 */
@Service
public class ChatClientReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(ChatClientReasoningOracle.class);

    private final ChatClient chatClient;
    private final OracleProperties properties;

    public ChatClientReasoningOracle(ChatClient.Builder builder, OracleProperties properties,
                                     @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("Reasoning oracle initialized, base-url: {}, model override: {}",
                baseUrl, properties.hasModel() ? properties.getModel() : "none");
    }

    @Override
    public String decide(String instruction, String context) {
        long start = System.currentTimeMillis();
        String response;
        try {
            var options = ChatOptions.builder().temperature(properties.getTemperature());
            if (properties.hasModel()) {
                options.model(properties.getModel());
            }
            response = chatClient.prompt()
                    .system(instruction)
                    .user(context == null || context.isBlank() ? "(no additional context)" : context)
                    .options(options.build())
                    .call()
                    .content();
        } catch (Exception e) {
            throw new OracleException("Oracle call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Oracle call complete ({}s, {} chars)", String.format("%.1f", elapsed / 1000.0),
                response == null ? 0 : response.length());
        log.debug("Raw oracle response: {}", response);
        return response == null ? "" : response;
    }
}
