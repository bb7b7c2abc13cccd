package io.github.goodees.decider.core.store.inmemory;

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

import io.github.goodees.decider.core.Pair;
import io.github.goodees.decider.core.store.RepositoryException;
import io.github.goodees.decider.core.store.StateLockingRepository;
import io.github.goodees.decider.core.store.ViewStateLockingRepository;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * State repository kept in memory, incrementing the version of a key on every save.
 *
 * @param <C> type of commands or events the state is looked up by
 * @param <S> state type
 */
public class InMemoryStateLockingRepository<C, S>
        implements StateLockingRepository<C, S, Long>, ViewStateLockingRepository<C, S, Long> {
    private final Map<String, Pair<S, Long>> storage = new HashMap<>();
    private final Function<? super C, String> commandKey;
    private final Function<? super S, String> stateKey;

    public InMemoryStateLockingRepository(Function<? super C, String> commandKey, Function<? super S, String> stateKey) {
        this.commandKey = Objects.requireNonNull(commandKey, "Command key function must be specified");
        this.stateKey = Objects.requireNonNull(stateKey, "State key function must be specified");
    }

    @Override
    public Pair<S, Long> fetchState(C command) throws RepositoryException {
        Pair<S, Long> stored;
        synchronized (storage) {
            stored = storage.get(commandKey.apply(command));
        }
        return stored == null ? Pair.<S, Long>of(null, null) : stored;
    }

    @Override
    public Pair<S, Long> save(S state, Long currentVersion) throws RepositoryException {
        String key = stateKey.apply(state);
        Pair<S, Long> saved = Pair.of(state, currentVersion == null ? 1 : currentVersion + 1);
        synchronized (storage) {
            Pair<S, Long> actual = storage.get(key);
            Long actualVersion = actual == null ? null : actual.getSecond();
            if (!Objects.equals(actualVersion, currentVersion)) {
                throw RepositoryException.optimisticLock(key, currentVersion, actualVersion);
            }
            storage.put(key, saved);
        }
        return saved;
    }

    @Override
    public Pair<S, Long> fetchState(C command, Map<String, Object> metadata) throws RepositoryException {
        return fetchState(command);
    }

    @Override
    public Pair<Pair<S, Long>, Map<String, Object>> save(S state, Long currentVersion, Map<String, Object> metadata)
            throws RepositoryException {
        return Pair.of(save(state, currentVersion), metadata);
    }
}
