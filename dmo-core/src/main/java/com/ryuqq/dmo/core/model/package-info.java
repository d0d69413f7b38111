/**
 * Core domain model package containing read models and write inputs.
 *
 * <h2>Read Models</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dmo.core.model.Routine} - Tracked daily routine (DMO)</li>
 *   <li>{@link com.ryuqq.dmo.core.model.Activity} - Ordered checklist step of a routine</li>
 *   <li>{@link com.ryuqq.dmo.core.model.CompletionRecord} - One boolean judgment per (routine, date)</li>
 * </ul>
 *
 * <h2>Write Inputs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dmo.core.model.NewRoutine} / {@link com.ryuqq.dmo.core.model.RoutinePatch}</li>
 *   <li>{@link com.ryuqq.dmo.core.model.NewActivity} / {@link com.ryuqq.dmo.core.model.ActivityPatch}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are records</li>
 *   <li><strong>Validation:</strong> Inputs trim and validate in their compact constructors,
 *       so every backend receives already-normalized values</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author DMO Team
 */
package com.ryuqq.dmo.core.model;
