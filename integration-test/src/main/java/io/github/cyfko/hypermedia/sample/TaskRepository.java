package io.github.cyfko.hypermedia.sample;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory task store, seeded with a few tasks.
 */
@Repository
public class TaskRepository {

    private final Map<Long, Task> tasks = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public TaskRepository() {
        reset();
    }

    /**
     * Restores the seed data.
     */
    public void reset() {
        tasks.clear();
        sequence.set(0);
        create(new TaskInput("Write docs", "Describe the API", Priority.HIGH, false));
        create(new TaskInput("Review pull request", null, Priority.MEDIUM, false));
        create(new TaskInput("Release 1.0", null, Priority.LOW, true));
    }

    public List<Task> findAll() {
        return new ArrayList<>(tasks.values());
    }

    public List<Task> search(String text) {
        if (text == null || text.isBlank()) {
            return findAll();
        }
        String needle = text.toLowerCase(Locale.ROOT);
        return tasks.values().stream()
                .filter(t -> t.title().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    public Optional<Task> findById(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Task create(TaskInput input) {
        long id = sequence.incrementAndGet();
        Task task = new Task(id, input.title(), input.notes(),
                input.priority() == null ? Priority.MEDIUM : input.priority(),
                Boolean.TRUE.equals(input.done()));
        tasks.put(id, task);
        return task;
    }

    public Optional<Task> update(long id, TaskInput input) {
        return findById(id).map(current -> {
            Task updated = new Task(id,
                    input.title() == null ? current.title() : input.title(),
                    input.notes() == null ? current.notes() : input.notes(),
                    input.priority() == null ? current.priority() : input.priority(),
                    input.done() == null ? current.done() : input.done());
            tasks.put(id, updated);
            return updated;
        });
    }
}
