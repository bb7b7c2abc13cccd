package io.github.goodees.decider.core.store;

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

/**
 * Exception generated when reading or storing events or state fails.
 */
public class RepositoryException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected RepositoryException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static RepositoryException optimisticLock(String key, Object expectedVersion, Object actualVersion) {
        return new RepositoryException(Fault.OPTIMISTIC_LOCK, "Stream " + key + " expected at version "
                + expectedVersion + " is at version " + actualVersion, null);
    }

    public static RepositoryException optimisticLock(String key, Object expectedVersion) {
        return new RepositoryException(Fault.OPTIMISTIC_LOCK, "Stream " + key + " is no longer at version "
                + expectedVersion, null);
    }

    public static RepositoryException duplicate(String key, Object eventVersion, Object stateVersion) {
        return new RepositoryException(Fault.OPTIMISTIC_LOCK, "Event version " + eventVersion + " of " + key
                + " does not follow state version " + stateVersion, null);
    }

    public static RepositoryException fetchFailed(String key, Throwable cause) {
        return new RepositoryException(Fault.TX_ERROR,
            "Fetch of " + key + " failed. " + cause.getMessage(), cause);
    }

    public static RepositoryException storeFailed(String key, Throwable cause) {
        return new RepositoryException(Fault.TX_ERROR,
            "Store of " + key + " failed. " + cause.getMessage(), cause);
    }

    public static RepositoryException multipleStreams(String expected, String violating) {
        return new RepositoryException(Fault.PROGRAMMATIC_ERROR, "Stored events span multiple streams: " + expected
                + " and " + violating, null);
    }

    public static RepositoryException unsupported(Object artifact, Throwable cause) {
        return new RepositoryException(Fault.PROGRAMMATIC_ERROR, "Unsupported artifact: " + artifact, cause);
    }
}
