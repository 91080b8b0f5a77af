package com.rtcc.orchestrator.engine.persistence;

import com.rtcc.orchestrator.core.model.ExecutionEvent;
import com.rtcc.orchestrator.core.repository.ExecutionEventRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of ExecutionEventRepository.
 */
public class InMemoryExecutionEventRepository implements ExecutionEventRepository {

    private final Map<String, List<ExecutionEvent>> events = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequenceCounters = new ConcurrentHashMap<>();

    @Override
    public void append(ExecutionEvent event) {
        events.computeIfAbsent(event.executionId(), k -> new CopyOnWriteArrayList<>()).add(event);
    }

    @Override
    public List<ExecutionEvent> findByExecutionId(String executionId) {
        List<ExecutionEvent> result = new ArrayList<>(events.getOrDefault(executionId, List.of()));
        result.sort(Comparator.comparingLong(ExecutionEvent::sequenceNumber));
        return result;
    }

    @Override
    public long getNextSequenceNumber(String executionId) {
        return sequenceCounters
            .computeIfAbsent(executionId, k -> new AtomicLong(0))
            .incrementAndGet();
    }

    @Override
    public void deleteByExecutionId(String executionId) {
        events.remove(executionId);
        sequenceCounters.remove(executionId);
    }

    public int executionCount() {
        return events.size();
    }
}
