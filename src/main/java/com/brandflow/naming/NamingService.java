package com.brandflow.naming;

import com.brandflow.config.BrandFlowProperties;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.exception.VariantNotFoundException;
import com.brandflow.workflow.model.AgentExecutionRecord;
import com.brandflow.workflow.model.AgentType;
import com.brandflow.workflow.model.NameSuggestion;
import com.brandflow.workflow.model.NameSuggestionSet;
import com.brandflow.workflow.model.WorkflowSession;
import com.brandflow.workflow.model.WorkflowStep;
import com.brandflow.workflow.service.SessionStateCommitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Naming step: suggestion rounds and the final choice of a business name.
 */
@Service
@Slf4j
public class NamingService {

    static final String TOOL_GENERATE = "generate_names";
    static final String TOOL_REGENERATE = "regenerate_names";
    static final String TOOL_SELECT = "select_name";

    private final NameSuggestionGenerator generator;
    private final SessionStateCommitter committer;
    private final BrandFlowProperties properties;
    private final Clock clock;

    public NamingService(NameSuggestionGenerator generator,
                         SessionStateCommitter committer,
                         BrandFlowProperties properties,
                         Clock clock) {
        this.generator = generator;
        this.committer = committer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * First suggestion round. Asking again returns the round already stored.
     */
    public WorkflowSession generate(String sessionId) {
        WorkflowSession session = committer.loadMutable(sessionId);
        requireNamingStep(session);
        if (session.getNames() != null) {
            return session;
        }
        long startedAt = System.nanoTime();
        List<NameSuggestion> names = generator.generate(request(session, Set.of(), 0));
        requireSuggestions(names, sessionId);
        return committer.commit(sessionId, WorkflowStep.NAMING, current -> {
            if (current.getNames() != null) {
                throw new ValidationException("Names for session " + sessionId + " were generated concurrently.");
            }
            current.setNames(NameSuggestionSet.initial(names));
            return record(TOOL_GENERATE, names, 0, startedAt);
        });
    }

    /**
     * New round that never repeats a name offered earlier in this session.
     */
    public WorkflowSession regenerate(String sessionId) {
        WorkflowSession session = committer.loadMutable(sessionId);
        requireNamingStep(session);
        NameSuggestionSet existing = session.getNames();
        if (existing == null) {
            throw new ValidationException("Session " + sessionId + " has no names to regenerate yet.");
        }
        int maxRegenerations = properties.getNaming().getMaxRegenerations();
        if (existing.regenerationCount() >= maxRegenerations) {
            throw new ValidationException("Names can be regenerated at most " + maxRegenerations + " times.");
        }
        Set<String> forbidden = new LinkedHashSet<>(existing.forbiddenNames());
        existing.suggestions().forEach(name -> forbidden.add(name.name().toLowerCase(Locale.ROOT)));

        long startedAt = System.nanoTime();
        int round = existing.regenerationCount() + 1;
        List<NameSuggestion> fresh = generator.generate(request(session, forbidden, round)).stream()
                .filter(name -> !forbidden.contains(name.name().toLowerCase(Locale.ROOT)))
                .toList();
        requireSuggestions(fresh, sessionId);
        return committer.commit(sessionId, WorkflowStep.NAMING, current -> {
            NameSuggestionSet names = current.getNames();
            if (names == null || names.regenerationCount() != existing.regenerationCount()) {
                throw new ValidationException("Names for session " + sessionId + " changed concurrently.");
            }
            current.setNames(names.regenerated(fresh));
            return record(TOOL_REGENERATE, fresh, round, startedAt);
        });
    }

    public WorkflowSession select(String sessionId, String name) {
        if (!StringUtils.hasText(name)) {
            throw new ValidationException("name is required.");
        }
        String chosen = name.trim();
        return committer.commit(sessionId, WorkflowStep.SIGNAGE, session -> {
            NameSuggestionSet names = session.getNames();
            if (names == null || names.find(chosen).isEmpty()) {
                throw new VariantNotFoundException("Name '" + chosen + "' is not among the suggestions of session "
                        + sessionId + ".");
            }
            if (session.getCurrentStep() == WorkflowStep.SIGNAGE.number() && session.getSignage() != null
                    && !chosen.equals(names.selectedName())) {
                throw new ValidationException("Signage was already generated for '" + names.selectedName() + "'.");
            }
            session.setNames(names.withSelection(chosen));
            log.info("Session {} selected name '{}'", sessionId, chosen);
            return AgentExecutionRecord.success(AgentType.NAMING, TOOL_SELECT, 0L, Map.of("name", chosen), clock.instant());
        });
    }

    private NamingRequest request(WorkflowSession session, Set<String> forbidden, int round) {
        return new NamingRequest(session.getSessionId(), session.getBusinessProfile(), session.getAnalysis(),
                forbidden, properties.getNaming().getMaxSuggestions(), round);
    }

    private void requireNamingStep(WorkflowSession session) {
        if (session.getCurrentStep() != WorkflowStep.NAMING.number()) {
            throw new ValidationException("Session " + session.getSessionId() + " is at step " + session.getCurrentStep()
                    + "; names are generated at step " + WorkflowStep.NAMING.number() + ".");
        }
    }

    private static void requireSuggestions(List<NameSuggestion> names, String sessionId) {
        if (names.isEmpty()) {
            throw new ValidationException("No new names could be generated for session " + sessionId + ".");
        }
    }

    private AgentExecutionRecord record(String tool, List<NameSuggestion> names, int round, long startedAt) {
        return AgentExecutionRecord.success(AgentType.NAMING, tool,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt),
                Map.of("count", String.valueOf(names.size()), "round", String.valueOf(round)),
                clock.instant());
    }
}
