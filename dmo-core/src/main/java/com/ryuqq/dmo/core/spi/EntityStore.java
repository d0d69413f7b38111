package com.ryuqq.dmo.core.spi;

import com.ryuqq.dmo.core.model.Activity;
import com.ryuqq.dmo.core.model.ActivityPatch;
import com.ryuqq.dmo.core.model.NewActivity;
import com.ryuqq.dmo.core.model.NewRoutine;
import com.ryuqq.dmo.core.model.Routine;
import com.ryuqq.dmo.core.model.RoutinePatch;

import java.util.List;

/**
 * Entity Store SPI: CRUD for routines and their activities.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Routine name uniqueness (case-sensitive, exact match after trim)</li>
 *   <li>Referential integrity: every activity references a live routine</li>
 *   <li>Cascade deletion of activities and completion records with their routine</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Uniqueness must be enforced by the write itself (e.g. a UNIQUE constraint),
 *       never by a separate "does it exist" query followed by an insert</li>
 *   <li>Engine-native exceptions must be translated to
 *       {@link com.ryuqq.dmo.core.error.DmoException} before leaving the store</li>
 * </ul>
 *
 * <p>All methods throw {@link com.ryuqq.dmo.core.error.DmoException} with code
 * STORAGE_FAILURE if the store is not initialized or the engine fails.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public interface EntityStore {

    /**
     * Creates a new, active routine.
     *
     * <pre>
     * INSERT INTO routines (name, description, active, timezone, created_at, updated_at)
     * VALUES (?, ?, TRUE, ?, now, now);
     * -- UNIQUE(name) violation → DUPLICATE_NAME
     * </pre>
     *
     * @param routine creation input (already trimmed and validated)
     * @return the created routine with generated id and timestamps
     * @throws IllegalArgumentException if routine is null
     * @throws com.ryuqq.dmo.core.error.DmoException DUPLICATE_NAME if the name is taken
     */
    Routine createRoutine(NewRoutine routine);

    /**
     * Retrieves a routine by id.
     *
     * @param routineId the routine id
     * @return the routine
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if absent
     */
    Routine getRoutine(long routineId);

    /**
     * Lists routines ordered by name ascending (code point order).
     *
     * @param includeInactive whether inactive routines are returned too
     * @return routines, possibly empty
     */
    List<Routine> listRoutines(boolean includeInactive);

    /**
     * Merge-patches a routine. Fields left null in the patch keep their value.
     *
     * <p>An empty patch returns the routine unchanged, without touching updatedAt.</p>
     *
     * @param routineId the routine id
     * @param patch fields to change
     * @return the updated routine
     * @throws IllegalArgumentException if patch is null
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if absent,
     *         DUPLICATE_NAME if renamed onto another routine's name
     */
    Routine updateRoutine(long routineId, RoutinePatch patch);

    /**
     * Hard-deletes a routine together with all of its activities and completion records.
     *
     * @param routineId the routine id
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if absent
     */
    void deleteRoutine(long routineId);

    /**
     * Creates an activity inside a routine.
     *
     * @param activity creation input
     * @return the created activity
     * @throws IllegalArgumentException if activity is null
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if the routine is absent
     */
    Activity createActivity(NewActivity activity);

    /**
     * Retrieves an activity by id.
     *
     * @param activityId the activity id
     * @return the activity
     * @throws com.ryuqq.dmo.core.error.DmoException ACTIVITY_NOT_FOUND if absent
     */
    Activity getActivity(long activityId);

    /**
     * Lists the activities of a routine.
     *
     * <pre>
     * SELECT * FROM activities WHERE routine_id = ?
     * ORDER BY "order" ASC, created_at ASC, id ASC;
     * </pre>
     *
     * @param routineId the routine id
     * @return activities, possibly empty
     * @throws com.ryuqq.dmo.core.error.DmoException ROUTINE_NOT_FOUND if the routine is absent
     */
    List<Activity> listActivities(long routineId);

    /**
     * Merge-patches an activity.
     *
     * @param activityId the activity id
     * @param patch fields to change
     * @return the updated activity
     * @throws IllegalArgumentException if patch is null
     * @throws com.ryuqq.dmo.core.error.DmoException ACTIVITY_NOT_FOUND if absent
     */
    Activity updateActivity(long activityId, ActivityPatch patch);

    /**
     * Deletes an activity. Completion records are not affected.
     *
     * @param activityId the activity id
     * @throws com.ryuqq.dmo.core.error.DmoException ACTIVITY_NOT_FOUND if absent
     */
    void deleteActivity(long activityId);
}
