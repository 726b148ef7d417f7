package com.whereq.memori.handler;

import com.whereq.memori.model.JobKind;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for selecting the handler of a job type
 */
@Slf4j
@Component
public class HandlerRegistry {

    @Autowired
    private List<JobHandler> handlers;

    private final Map<JobKind, JobHandler> byKind = new EnumMap<>(JobKind.class);

    public HandlerRegistry() {
    }

    public HandlerRegistry(List<JobHandler> handlers) {
        this.handlers = handlers;
        initialize();
    }

    @PostConstruct
    public void initialize() {
        byKind.clear();
        for (JobHandler handler : handlers) {
            JobHandler previous = byKind.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.kind() + ": "
                    + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered handlers for {}", byKind.keySet());
    }

    /**
     * Find the handler for a raw {@code job_type}
     *
     * @param jobType job type as carried by the broker entry
     * @return handler, empty for unknown types or kinds without a handler
     */
    public Optional<JobHandler> find(String jobType) {
        return JobKind.fromWireName(jobType).map(byKind::get);
    }

    public Optional<JobHandler> find(JobKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }
}
