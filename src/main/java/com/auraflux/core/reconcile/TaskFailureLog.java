package com.auraflux.core.reconcile;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the most recent task failures of each session, newest last.
 */
@Component
public class TaskFailureLog {

    private final int capacity;
    private final ConcurrentHashMap<String, Deque<TaskFailure>> failures = new ConcurrentHashMap<>();

    public TaskFailureLog(@Value("${auraflux.dispatcher.failure-log-size:50}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void record(String sessionId, TaskFailure failure) {
        failures.compute(sessionId, (k, deque) -> {
            var entries = deque != null ? deque : new ArrayDeque<TaskFailure>();
            if (entries.size() >= capacity) {
                entries.pollFirst();
            }
            entries.addLast(failure);
            return entries;
        });
    }

    public List<TaskFailure> forSession(String sessionId) {
        var result = new ArrayList<TaskFailure>();
        failures.computeIfPresent(sessionId, (k, deque) -> {
            result.addAll(deque);
            return deque;
        });
        return result;
    }
}
