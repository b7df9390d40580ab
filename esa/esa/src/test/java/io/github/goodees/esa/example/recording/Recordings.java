package io.github.goodees.esa.example.recording;

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

import io.github.goodees.esa.core.command.CommandRouter;
import io.github.goodees.esa.core.command.CrudAggregate;
import io.github.goodees.esa.core.pipeline.EventStorePipeline;

/**
 * Registration of the recording aggregate.
 */
public final class Recordings {
    private Recordings() {
    }

    public static CrudAggregate<Recording> register(EventStorePipeline store, CommandRouter router) {
        return CrudAggregate.of(Recording.TYPE)
                .validator(new RecordingValidator())
                .create(CreateRecording.class, CreateRecording::toRecording, RecordingCreatedEvent::of)
                .update(UpdateRecording.class, (current, command) -> command.overwrite(current),
                    RecordingUpdatedEvent::of)
                .registerOn(store, router);
    }
}
