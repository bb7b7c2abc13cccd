package io.github.goodees.decider.core;

/*-
 * #%L
 * decider
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Failure of a single step of handling a command, event or action result.
 * <p>The exception names the step that failed through its {@link Fault} and carries the value that step was
 * processing, so the caller can retry it or move it to a dead letter store:</p>
 * <ul>
 *     <li>{@link Fault#FETCH}: the command, event or query whose history or state could not be read</li>
 *     <li>{@link Fault#DECISION}: the command, event or action result for which decide, evolve or react threw. Within
 *     an orchestration cascade this is the follow-up command that failed, not the original one</li>
 *     <li>{@link Fault#SAVE}: the event, list of events or state that could not be stored</li>
 *     <li>{@link Fault#PUBLISH}: the action that was rejected downstream</li>
 *     <li>{@link Fault#STREAM}: no input, the source of inputs failed</li>
 * </ul>
 * <p>Outputs that were already stored or published before the failure are available through {@link #getCommitted()}.
 * They are never retried by the handler.</p>
 */
public class HandlingException extends Exception {
    private final Fault fault;
    private final transient Object input;
    private final transient List<?> committed;

    public enum Fault {
        FETCH, DECISION, SAVE, PUBLISH, STREAM
    }

    protected HandlingException(Fault fault, Object input, List<?> committed, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.input = input;
        this.committed = committed == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(committed));
    }

    public Fault getFault() {
        return fault;
    }

    public Object getInput() {
        return input;
    }

    public List<?> getCommitted() {
        return committed;
    }

    public static HandlingException fetchFailed(Object input, Throwable cause) {
        return new HandlingException(Fault.FETCH, input, null, "Fetch for " + input + " failed. "
                + cause.getMessage(), cause);
    }

    public static HandlingException decisionFailed(Object input, Throwable cause) {
        return new HandlingException(Fault.DECISION, input, null, "Processing of " + input + " failed. "
                + cause.getMessage(), cause);
    }

    public static HandlingException saveFailed(Object artifact, List<?> committed, Throwable cause) {
        return new HandlingException(Fault.SAVE, artifact, committed, "Save of " + artifact + " failed. "
                + cause.getMessage(), cause);
    }

    public static HandlingException publishFailed(Object action, List<?> committed, Throwable cause) {
        return new HandlingException(Fault.PUBLISH, action, committed, "Publish of " + action + " failed. "
                + cause.getMessage(), cause);
    }

    public static HandlingException streamFailed(Throwable cause) {
        return new HandlingException(Fault.STREAM, null, null, "Input stream failed. " + cause.getMessage(), cause);
    }
}
