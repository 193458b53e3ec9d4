package com.itguru.session;

import com.itguru.api.dto.EnhancedContext;
import com.itguru.api.dto.IntentExplanation;
import com.itguru.api.dto.SessionView;
import com.itguru.api.dto.SourceResult;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-user-session state. The pipeline writes the side-channel fields once per
 * request; the presentation layer reads them through {@link #view()}.
 *
 * <p>The scheduler handle is created by the registry and reused for every request
 * of the session; it is never disposed here.</p>
 */
public class SessionContext {

    private static final int MAX_ERRORS = 20;

    private final String id;
    private final Instant createdAt;
    private final Scheduler scheduler;

    private volatile String selectedModel;
    private volatile IntentExplanation lastIntent;
    private volatile List<SourceResult> lastSources = List.of();
    private volatile String lastSourcesMarkdown = "";
    private volatile List<String> followups = List.of();
    private final List<String> errors = new ArrayList<>();

    public SessionContext(String id, Scheduler scheduler) {
        this.id = id;
        this.scheduler = scheduler;
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /** Null means the configured default model. */
    public String selectedModel() {
        return selectedModel;
    }

    public void selectModel(String model) {
        this.selectedModel = model;
    }

    public void recordRouting(EnhancedContext context, String sourcesMarkdown) {
        this.lastIntent = IntentExplanation.of(context);
        this.lastSources = context.results();
        this.lastSourcesMarkdown = sourcesMarkdown == null ? "" : sourcesMarkdown;
    }

    public void recordFollowups(List<String> suggestions) {
        this.followups = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public void recordError(String message) {
        synchronized (errors) {
            errors.add(message);
            if (errors.size() > MAX_ERRORS) errors.remove(0);
        }
    }

    public IntentExplanation lastIntent() {
        return lastIntent;
    }

    public List<SourceResult> lastSources() {
        return lastSources;
    }

    public String lastSourcesMarkdown() {
        return lastSourcesMarkdown;
    }

    public List<String> followups() {
        return followups;
    }

    public List<String> errors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public SessionView view() {
        return new SessionView(id, selectedModel, lastIntent, lastSources, lastSourcesMarkdown, followups, errors());
    }
}
