package com.ryuqq.dmo.adapter.inmemory;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.ActivityPatch;
import com.ryuqq.dmo.core.model.CompletionRecord;
import com.ryuqq.dmo.core.model.EntityType;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;
import com.ryuqq.dmo.core.spi.StorageBackend;
import com.ryuqq.dmo.core.util.DateRanges;
import com.ryuqq.dmo.core.util.DateTimes;
import com.ryuqq.dmo.core.util.NameOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Volatile implementation of {@link StorageBackend} for tests and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>routines:</strong> HashMap&lt;Long, Routine&gt; - O(1) lookup by id</li>
 *   <li><strong>routineIdsByName:</strong> HashMap&lt;String, Long&gt; - name uniqueness index, the
 *       in-memory counterpart of {@code UNIQUE(name)}</li>
 *   <li><strong>activities:</strong> HashMap&lt;Long, Activity&gt; - O(1) lookup by id</li>
 *   <li><strong>completions:</strong> HashMap&lt;Long, TreeMap&lt;LocalDate, CompletionRecord&gt;&gt; -
 *       per-routine ledger sorted by date, O(log N) range reads</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No concurrency control: single-caller use only</li>
 *   <li>Data lost on {@link #close()} and on process exit</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StorageBackend backend = new InMemoryStorageBackend();
 * backend.init();
 *
 * Routine routine = backend.createRoutine(NewRoutine.of("Morning Routine"));
 * backend.setCompletion(routine.id(), LocalDate.of(2026, 2, 1), true, null);
 * </pre>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public class InMemoryStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageBackend.class);

    private static final Comparator<Activity> ACTIVITY_ORDER = Comparator
        .comparingInt(Activity::order)
        .thenComparing(Activity::createdAt)
        .thenComparingLong(Activity::id);

    private final Clock clock;

    private final Map<Long, Routine> routines = new HashMap<>();
    private final Map<String, Long> routineIdsByName = new HashMap<>();
    private final Map<Long, Activity> activities = new HashMap<>();
    private final Map<Long, NavigableMap<LocalDate, CompletionRecord>> completions = new HashMap<>();

    private long nextRoutineId = 1;
    private long nextActivityId = 1;
    private long nextCompletionId = 1;
    private boolean initialized;

    /**
     * Creates a backend stamping records with the system UTC clock.
     */
    public InMemoryStorageBackend() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a backend stamping records with the given clock.
     *
     * @param clock timestamp source
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryStorageBackend(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    /**
     * {@inheritDoc}
     *
     * <p>Only marks the backend usable; existing data is kept.</p>
     */
    @Override
    public void init() {
        if (!initialized) {
            initialized = true;
            log.info("In-memory storage initialized");
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Discards all data. Id counters keep running so ids are never reused.</p>
     */
    @Override
    public void close() {
        routines.clear();
        routineIdsByName.clear();
        activities.clear();
        completions.clear();
        if (initialized) {
            initialized = false;
            log.info("In-memory storage closed");
        }
    }

    // ============================================================
    // Routines
    // ============================================================

    @Override
    public Routine createRoutine(NewRoutine routine) {
        if (routine == null) {
            throw new IllegalArgumentException("routine cannot be null");
        }
        ensureInitialized("create_routine");

        if (routineIdsByName.containsKey(routine.name())) {
            throw DmoException.duplicateName(EntityType.ROUTINE, routine.name());
        }

        Instant now = DateTimes.now(clock);
        Routine created = new Routine(
            nextRoutineId++, routine.name(), routine.description(), true, routine.timezone(), now, now);
        routines.put(created.id(), created);
        routineIdsByName.put(created.name(), created.id());
        return created;
    }

    @Override
    public Routine getRoutine(long routineId) {
        ensureInitialized("get_routine");
        return requireRoutine(routineId);
    }

    @Override
    public List<Routine> listRoutines(boolean includeInactive) {
        ensureInitialized("list_routines");
        return routines.values().stream()
            .filter(r -> includeInactive || r.active())
            .sorted(Comparator.comparing(Routine::name, NameOrder.CODE_POINT))
            .collect(Collectors.toList());
    }

    @Override
    public Routine updateRoutine(long routineId, RoutinePatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        ensureInitialized("update_routine");

        Routine current = requireRoutine(routineId);
        if (patch.isEmpty()) {
            return current;
        }

        if (patch.name() != null) {
            Long holder = routineIdsByName.get(patch.name());
            if (holder != null && holder != routineId) {
                throw DmoException.duplicateName(EntityType.ROUTINE, patch.name());
            }
        }

        Routine updated = patch.applyTo(current, DateTimes.advance(current.updatedAt(), DateTimes.now(clock)));
        routineIdsByName.remove(current.name());
        routineIdsByName.put(updated.name(), routineId);
        routines.put(routineId, updated);
        return updated;
    }

    @Override
    public void deleteRoutine(long routineId) {
        ensureInitialized("delete_routine");
        Routine removed = requireRoutine(routineId);

        routines.remove(routineId);
        routineIdsByName.remove(removed.name());
        activities.values().removeIf(a -> a.routineId() == routineId);
        completions.remove(routineId);
    }

    // ============================================================
    // Activities
    // ============================================================

    @Override
    public Activity createActivity(NewActivity activity) {
        if (activity == null) {
            throw new IllegalArgumentException("activity cannot be null");
        }
        ensureInitialized("create_activity");
        requireRoutine(activity.routineId());

        Instant now = DateTimes.now(clock);
        Activity created = new Activity(
            nextActivityId++, activity.routineId(), activity.name(), activity.order(), now, now);
        activities.put(created.id(), created);
        return created;
    }

    @Override
    public Activity getActivity(long activityId) {
        ensureInitialized("get_activity");
        return requireActivity(activityId);
    }

    @Override
    public List<Activity> listActivities(long routineId) {
        ensureInitialized("list_activities");
        requireRoutine(routineId);
        return activities.values().stream()
            .filter(a -> a.routineId() == routineId)
            .sorted(ACTIVITY_ORDER)
            .collect(Collectors.toList());
    }

    @Override
    public Activity updateActivity(long activityId, ActivityPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        ensureInitialized("update_activity");

        Activity current = requireActivity(activityId);
        if (patch.isEmpty()) {
            return current;
        }

        Activity updated = patch.applyTo(current, DateTimes.advance(current.updatedAt(), DateTimes.now(clock)));
        activities.put(activityId, updated);
        return updated;
    }

    @Override
    public void deleteActivity(long activityId) {
        ensureInitialized("delete_activity");
        requireActivity(activityId);
        activities.remove(activityId);
    }

    // ============================================================
    // Completions
    // ============================================================

    @Override
    public CompletionRecord setCompletion(long routineId, LocalDate date, boolean completed, String note) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        CompletionRecord.validateNote(note);
        ensureInitialized("set_completion");
        requireRoutine(routineId);

        NavigableMap<LocalDate, CompletionRecord> ledger =
            completions.computeIfAbsent(routineId, id -> new TreeMap<>());
        Instant now = DateTimes.now(clock);

        CompletionRecord existing = ledger.get(date);
        CompletionRecord written = existing == null
            ? new CompletionRecord(nextCompletionId++, routineId, date, completed, note, now, now)
            : new CompletionRecord(existing.id(), routineId, date, completed, note,
                existing.createdAt(), DateTimes.advance(existing.updatedAt(), now));
        ledger.put(date, written);
        return written;
    }

    @Override
    public Optional<CompletionRecord> getCompletion(long routineId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        ensureInitialized("get_completion");
        requireRoutine(routineId);

        NavigableMap<LocalDate, CompletionRecord> ledger = completions.get(routineId);
        return ledger == null ? Optional.empty() : Optional.ofNullable(ledger.get(date));
    }

    @Override
    public List<CompletionRecord> listCompletions(long routineId, LocalDate start, LocalDate end) {
        DateRanges.requireOrdered(start, end);
        ensureInitialized("list_completions");
        requireRoutine(routineId);
        return new ArrayList<>(range(routineId, start, end).values());
    }

    @Override
    public int countCompleted(long routineId, LocalDate start, LocalDate end) {
        DateRanges.requireOrdered(start, end);
        ensureInitialized("count_completed");
        requireRoutine(routineId);
        return (int) range(routineId, start, end).values().stream()
            .filter(CompletionRecord::completed)
            .count();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private NavigableMap<LocalDate, CompletionRecord> range(long routineId, LocalDate start, LocalDate end) {
        NavigableMap<LocalDate, CompletionRecord> ledger = completions.get(routineId);
        if (ledger == null) {
            return new TreeMap<>();
        }
        return ledger.subMap(start, true, end, true);
    }

    private Routine requireRoutine(long routineId) {
        Routine routine = routines.get(routineId);
        if (routine == null) {
            throw DmoException.routineNotFound(routineId);
        }
        return routine;
    }

    private Activity requireActivity(long activityId) {
        Activity activity = activities.get(activityId);
        if (activity == null) {
            throw DmoException.activityNotFound(activityId);
        }
        return activity;
    }

    private void ensureInitialized(String operation) {
        if (!initialized) {
            throw DmoException.storage(operation, "Storage not initialized. Call init() first.", null);
        }
    }
}
