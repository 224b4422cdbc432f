package io.github.goodees.esbus.aggregate;

/*-
 * #%L
 * esbus
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

import org.immutables.value.Value;

import java.util.Set;

/**
 * Who issues a command. Identity, display name, the tenant the command belongs to and the roles aggregates may use
 * for authorization. The bus rejects actors with empty id, name or tenant.
 */
@Value.Immutable
public interface Actor {
    String id();

    String name();

    String tenant();

    Set<String> roles();

    static Actor of(String id, String name, String tenant, String... roles) {
        return builder().id(id).name(name).tenant(tenant).addRoles(roles).build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableActor.Builder {

    }
}
