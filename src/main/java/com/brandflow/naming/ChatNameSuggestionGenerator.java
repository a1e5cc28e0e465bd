package com.brandflow.naming;

import com.brandflow.workflow.model.NameSuggestion;
import com.brandflow.workflow.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.brandflow.naming.NamingPrompts.INVALID_JSON_RETRY_PROMPT;
import static com.brandflow.naming.NamingPrompts.PURPOSE_NAMES;
import static com.brandflow.naming.NamingPrompts.PURPOSE_NAMES_RETRY;
import static com.brandflow.naming.NamingPrompts.SYSTEM_PROMPT;
import static com.brandflow.naming.NamingPrompts.USER_TEMPLATE;

/**
 * Asks a chat model for names. Answers that cannot be parsed get one retry; after that, or
 * when the model call itself fails, the deterministic generator fills in.
 */
@Slf4j
public class ChatNameSuggestionGenerator implements NameSuggestionGenerator {

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final NameSuggestionGenerator fallback;

    public ChatNameSuggestionGenerator(ChatClient chatClient,
                                       JsonProcessingService jsonProcessingService,
                                       NameSuggestionGenerator fallback) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.fallback = fallback;
    }

    @Override
    public List<NameSuggestion> generate(NamingRequest request) {
        Map<String, Object> params = Map.of(
                "industry", request.profile().industry().key(),
                "region", request.profile().region().key(),
                "size", request.profile().size().key(),
                "description", StringUtils.hasText(request.profile().description()) ? request.profile().description() : "none",
                "analysis", request.analysis() != null ? request.analysis().summary() : "none",
                "count", request.count(),
                "forbidden", request.forbiddenNames().isEmpty() ? "none" : String.join(", ", request.forbiddenNames()));
        try {
            NameList answer = ask(PURPOSE_NAMES, SYSTEM_PROMPT, params);
            if (answer == null) {
                answer = ask(PURPOSE_NAMES_RETRY, SYSTEM_PROMPT + INVALID_JSON_RETRY_PROMPT, params);
            }
            List<NameSuggestion> names = answer == null ? List.of() : filter(answer, request);
            if (!names.isEmpty()) {
                return names;
            }
            log.warn("Chat model returned no usable names for session {}; using generated defaults.", request.sessionId());
        } catch (RuntimeException ex) {
            log.warn("Chat model call failed for session {}: {}; using generated defaults.", request.sessionId(),
                    ex.getMessage());
        }
        return fallback.generate(request);
    }

    private NameList ask(String purpose, String systemPrompt, Map<String, Object> params) {
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(user -> user.text(USER_TEMPLATE).params(params))
                .call()
                .content();
        return jsonProcessingService.parseJsonResponse(purpose, response, NameList.class);
    }

    private static List<NameSuggestion> filter(NameList answer, NamingRequest request) {
        if (answer.names() == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>(request.forbiddenNames());
        List<NameSuggestion> result = new ArrayList<>();
        for (NameSuggestion candidate : answer.names()) {
            if (candidate == null || !StringUtils.hasText(candidate.name()) || result.size() >= request.count()) {
                continue;
            }
            String name = candidate.name().trim();
            if (seen.add(name.toLowerCase(Locale.ROOT))) {
                result.add(new NameSuggestion(name, candidate.description() == null ? "" : candidate.description().trim()));
            }
        }
        return List.copyOf(result);
    }

    record NameList(List<NameSuggestion> names) {
    }
}
