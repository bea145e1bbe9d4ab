/*
 * Copyright 2024-2025, The Eligian Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package eligian.script.ir;

import java.util.List;

/**
 * @param uri the media source, or null for providers without one
 * @param type the engine timeline type ({@code mediaplayer}, {@code animation}, ...)
 */
public record TimelineConfiguration(
    String id,
    String uri,
    String type,
    double duration,
    boolean loop,
    String selector,
    List<TimelineActionConfiguration> timelineActions
) {

    public TimelineConfiguration {
        timelineActions = List.copyOf(timelineActions);
    }
}
