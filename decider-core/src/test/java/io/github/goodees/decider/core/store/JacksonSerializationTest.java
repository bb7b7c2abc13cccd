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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.Test;

import java.io.UncheckedIOException;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class JacksonSerializationTest {
    private final JacksonSerialization<Deposit> serialization = new JacksonSerialization<>(Deposit.class);

    public static class Deposit {
        private final String account;
        private final LocalDate valueDate;

        @JsonCreator
        public Deposit(@JsonProperty("account") String account, @JsonProperty("valueDate") LocalDate valueDate) {
            this.account = account;
            this.valueDate = valueDate;
        }

        public String getAccount() {
            return account;
        }

        public LocalDate getValueDate() {
            return valueDate;
        }
    }

    @Test
    public void dates_are_written_as_iso_strings() {
        String payload = serialization.serialize(new Deposit("A-1", LocalDate.of(2017, 6, 1)));
        assertThat(payload, containsString("\"valueDate\":\"2017-06-01\""));
        Deposit read = serialization.deserialize(1, payload, "Deposit");
        assertThat(read.getAccount(), equalTo("A-1"));
        assertThat(read.getValueDate(), equalTo(LocalDate.of(2017, 6, 1)));
    }

    @Test
    public void type_is_simple_class_name() {
        assertThat(serialization.typeOf(new Deposit("A-1", null)), equalTo("Deposit"));
        assertThat(serialization.payloadVersion(new Deposit("A-1", null)), is(1));
    }

    @Test
    public void other_payload_version_is_not_supported() {
        assertThat(serialization.deserialize(2, "{\"account\":\"A-1\"}", "Deposit"), nullValue());
    }

    @Test(expected = UncheckedIOException.class)
    public void malformed_payload_fails() {
        serialization.deserialize(1, "{\"account\":", "Deposit");
    }
}
