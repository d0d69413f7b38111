package com.ryuqq.dmo.testkit.contract;

import com.ryuqq.dmo.core.error.DmoException;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;
import com.ryuqq.dmo.core.spi.StorageBackend;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Fixed fourteen-operation script used to compare backends.
 *
 * <p>Every operation's return value is collected in order; a rejected write contributes
 * its {@link com.ryuqq.dmo.core.error.ErrorCode}. Rejected writes come before later
 * creates so that any id they consume shows up in the transcript. Two backends started
 * on empty storage with equal {@link TestClock}s must produce equal transcripts.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class ParityScript {

    /** Routine the script records completions for. */
    public static final String MORNING = "Morning Routine";

    /** Routine the script deactivates. */
    public static final String EVENING = "Evening Walk";

    /** Routine created right after the rejected duplicate. */
    public static final String READING = "Night Reading";

    /** Id no script routine ever receives. */
    public static final long MISSING_ROUTINE_ID = 9_999L;

    public static final LocalDate FIRST_DAY = LocalDate.of(2026, 2, 1);
    public static final LocalDate LAST_DAY = LocalDate.of(2026, 2, 28);

    private static final Duration STEP = Duration.ofMinutes(1);

    private ParityScript() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Runs the script against an initialised, empty backend.
     *
     * @param backend backend under test
     * @param clock clock the backend was created with
     * @return the result of each operation, in order
     */
    public static List<Object> run(StorageBackend backend, TestClock clock) {
        List<Object> transcript = new ArrayList<>();

        Routine morning = backend.createRoutine(new NewRoutine(MORNING, "Start the day", "Asia/Seoul"));
        transcript.add(morning);
        clock.advance(STEP);

        Routine evening = backend.createRoutine(NewRoutine.of(EVENING));
        transcript.add(evening);
        clock.advance(STEP);

        transcript.add(rejection(() -> backend.createRoutine(NewRoutine.of(MORNING))));
        clock.advance(STEP);

        transcript.add(backend.createRoutine(NewRoutine.of(READING)));
        clock.advance(STEP);

        transcript.add(rejection(() -> backend.createActivity(NewActivity.of(MISSING_ROUTINE_ID, "Stretch"))));
        clock.advance(STEP);

        transcript.add(backend.createActivity(new NewActivity(morning.id(), "Exercise", 1)));
        clock.advance(STEP);

        transcript.add(backend.createActivity(new NewActivity(morning.id(), "Meditate", 0)));
        clock.advance(STEP);

        transcript.add(rejection(() -> backend.setCompletion(MISSING_ROUTINE_ID, FIRST_DAY, true, null)));
        clock.advance(STEP);

        transcript.add(backend.setCompletion(morning.id(), FIRST_DAY, true, "felt good"));
        clock.advance(STEP);

        transcript.add(backend.setCompletion(morning.id(), FIRST_DAY.plusDays(1), false, null));
        clock.advance(STEP);

        transcript.add(backend.setCompletion(morning.id(), FIRST_DAY, true, "felt great"));
        clock.advance(STEP);

        transcript.add(backend.updateRoutine(evening.id(), RoutinePatch.empty().withActive(false)));
        clock.advance(STEP);

        transcript.add(backend.listRoutines(true));
        transcript.add(backend.listCompletions(morning.id(), FIRST_DAY, LAST_DAY));

        return transcript;
    }

    private static Object rejection(Supplier<?> write) {
        try {
            return write.get();
        } catch (DmoException e) {
            return e.getCode();
        }
    }
}
