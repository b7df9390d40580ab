package io.github.goodees.esa.example.release;

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
import io.github.goodees.esa.core.pipeline.EventPublisher;
import io.github.goodees.esa.core.pipeline.EventStorePipeline;
import io.github.goodees.esa.core.projection.Projection;
import io.github.goodees.esa.core.projection.SubscriberProjection;
import io.github.goodees.esa.example.recording.Recording;
import io.github.goodees.esa.example.recording.RecordingUpdatedEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration of the release aggregate and its projection.
 */
public final class Releases {
    private Releases() {
    }

    public static CrudAggregate<Release> register(EventStorePipeline store, CommandRouter router,
            Projection<Recording> recordings) {
        return CrudAggregate.of(Release.TYPE)
                .validator(new ReleaseValidator(id -> recordings.find(id).isPresent()))
                .create(CreateRelease.class, CreateRelease::toRelease, ReleaseCreatedEvent::of)
                .update(UpdateRelease.class, (current, command) -> command.toRelease(), ReleaseUpdatedEvent::of)
                .registerOn(store, router);
    }

    /**
     * Projection of releases, kept current with changes of their recordings.
     * @param publisher publisher of the store
     * @param recordings source of recording data for new tracks
     * @return subscribed projection
     */
    public static SubscriberProjection<ReleaseView> projection(EventPublisher publisher,
            Projection<Recording> recordings) {
        return SubscriberProjection.<ReleaseView>builder("releases")
                .on(ReleaseCreatedEvent.class, (id, e, views) -> views.put(id, view(id, e, recordings)))
                .on(ReleaseUpdatedEvent.class, (id, e, views) -> views.update(id, v -> view(id, e, recordings)))
                .on(RecordingUpdatedEvent.class, (id, e, views) -> {
                    ReleaseView.Track track = track("recording update", id, recordings);
                    views.refresh(v -> v.contains(id), v -> v.withTrack(track));
                })
                .subscribeTo(publisher);
    }

    private static ReleaseView view(String releaseId, ReleaseEvent event, Projection<Recording> recordings) {
        List<ReleaseView.Track> tracks = new ArrayList<>();
        for (String recordingId : event.getRecordingIds()) {
            tracks.add(track("release " + releaseId, recordingId, recordings));
        }
        return new ReleaseView(releaseId, event.getTitle(), tracks);
    }

    private static ReleaseView.Track track(String referrer, String recordingId, Projection<Recording> recordings) {
        Recording recording = recordings.find(recordingId)
                .orElseThrow(() -> new IllegalStateException("Unknown recording " + recordingId + " in " + referrer));
        return new ReleaseView.Track(recordingId, recording.getTitle(), recording.getDuration());
    }
}
