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

import io.github.goodees.esa.core.aggregate.AggregateType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State of a release, an ordered compilation of recordings.
 */
public final class Release {
    public static final AggregateType<Release> TYPE = AggregateType.<Release>builder("release")
            .createdBy(ReleaseCreatedEvent.class, Release::from)
            .on(ReleaseUpdatedEvent.class, (current, event) -> from(event))
            .build();

    private final String title;
    private final List<String> recordingIds;

    public Release(String title, List<String> recordingIds) {
        this.title = title;
        this.recordingIds = Collections.unmodifiableList(new ArrayList<>(recordingIds));
    }

    static Release from(ReleaseEvent event) {
        return new Release(event.getTitle(), event.getRecordingIds());
    }

    public String getTitle() {
        return title;
    }

    public List<String> getRecordingIds() {
        return recordingIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Release)) {
            return false;
        }
        Release release = (Release) o;
        return Objects.equals(title, release.title) && recordingIds.equals(release.recordingIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, recordingIds);
    }

    @Override
    public String toString() {
        return "Release{" + "title=" + title + ", recordingIds=" + recordingIds + '}';
    }
}
