package io.github.goodees.esa.core;

/*-
 * #%L
 * esa
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
 * Immutable fact about the business domain that became true.
 *
 * <p>Every aggregate type defines its own set of events. An event carries its payload as plain accessors and has no
 * identity of its own: it is identified by the aggregate stream it was appended to and its position in it. That
 * metadata travels alongside the event in a {@link StoredEvent} when the event is published.</p>
 *
 * <p>The serialization format is not prescribed, but events may define annotations to support specific serialization
 * kinds, e. g. Jackson annotations. Support for events based on <a href="http://immutables.github.io">Immutables</a>
 * lives in the {@code esa} module.</p>
 */
public interface Event {
    /**
     * The type of event. For every aggregate type this must uniquely identify the kind of event, as it is the key
     * handlers are dispatched on and the discriminator stores persist.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }
}
