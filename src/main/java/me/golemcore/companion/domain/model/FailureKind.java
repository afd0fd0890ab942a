package me.golemcore.companion.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Failure taxonomy of the companion runtime.
 *
 * <ul>
 * <li>{@link #INPUT_REJECTED} policy violation at the safety gate, answered
 * with a fixed safety reply</li>
 * <li>{@link #GENERATION_FAILURE} response generator error, answered with the
 * fallback reply</li>
 * <li>{@link #ETHICAL_VIOLATION} soft; one regeneration, then correction</li>
 * <li>{@link #SAFETY_VIOLATION} hard; always replaced at the final gate</li>
 * <li>{@link #PERSISTENCE_FAILURE} logged, never blocks delivery</li>
 * <li>{@link #SCHEDULER_JOB_FAILURE} isolated to one periodic job</li>
 * <li>{@link #FATAL_STARTUP_FAILURE} a collaborator could not be built</li>
 * </ul>
 */
public enum FailureKind {
    INPUT_REJECTED,
    GENERATION_FAILURE,
    ETHICAL_VIOLATION,
    SAFETY_VIOLATION,
    PERSISTENCE_FAILURE,
    SCHEDULER_JOB_FAILURE,
    FATAL_STARTUP_FAILURE
}
