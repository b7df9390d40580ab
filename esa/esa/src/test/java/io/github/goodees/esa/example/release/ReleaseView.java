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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read model of a release with recording data denormalized into its tracks.
 */
public final class ReleaseView {
    private final String releaseId;
    private final String title;
    private final List<Track> tracks;

    public ReleaseView(String releaseId, String title, List<Track> tracks) {
        this.releaseId = releaseId;
        this.title = title;
        this.tracks = Collections.unmodifiableList(new ArrayList<>(tracks));
    }

    public String getReleaseId() {
        return releaseId;
    }

    public String getTitle() {
        return title;
    }

    public List<Track> getTracks() {
        return tracks;
    }

    public int getTotalDuration() {
        int total = 0;
        for (Track track : tracks) {
            total += track.getDuration();
        }
        return total;
    }

    public boolean contains(String recordingId) {
        for (Track track : tracks) {
            if (track.getRecordingId().equals(recordingId)) {
                return true;
            }
        }
        return false;
    }

    ReleaseView withTrack(Track changed) {
        List<Track> result = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            result.add(track.getRecordingId().equals(changed.getRecordingId()) ? changed : track);
        }
        return new ReleaseView(releaseId, title, result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReleaseView)) {
            return false;
        }
        ReleaseView that = (ReleaseView) o;
        return releaseId.equals(that.releaseId) && Objects.equals(title, that.title) && tracks.equals(that.tracks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(releaseId, title, tracks);
    }

    @Override
    public String toString() {
        return "ReleaseView{" + releaseId + ", title=" + title + ", tracks=" + tracks + '}';
    }

    public static final class Track {
        private final String recordingId;
        private final String title;
        private final int duration;

        public Track(String recordingId, String title, int duration) {
            this.recordingId = recordingId;
            this.title = title;
            this.duration = duration;
        }

        public String getRecordingId() {
            return recordingId;
        }

        public String getTitle() {
            return title;
        }

        public int getDuration() {
            return duration;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Track)) {
                return false;
            }
            Track track = (Track) o;
            return duration == track.duration && recordingId.equals(track.recordingId)
                    && Objects.equals(title, track.title);
        }

        @Override
        public int hashCode() {
            return Objects.hash(recordingId, title, duration);
        }

        @Override
        public String toString() {
            return recordingId + ":" + title + "(" + duration + "s)";
        }
    }
}
