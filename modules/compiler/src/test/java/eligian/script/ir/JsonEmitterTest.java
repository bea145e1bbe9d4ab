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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import eligian.script.ast.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonEmitterTest {

    private static EngineConfiguration configuration(List<String> cssFiles) {
        return configuration(cssFiles, null);
    }

    private static EngineConfiguration configuration(List<String> cssFiles, ActionConfiguration extraAction) {
        var data = new JsonObject();
        data.addProperty("selector", "#title");
        data.addProperty("label", "<b>bold</b>");
        var select = new OperationConfiguration("op-1", "selectElement", data, List.of(), SourceLocation.NONE);
        var action = new ActionConfiguration("action-1", "show", List.of(select), List.of());
        var actions = extraAction != null ? List.of(action, extraAction) : List.of(action);
        var timelineAction = new TimelineActionConfiguration("ta-1", "timeline-action-0-2", 0, 2, List.of(select), List.of());
        var timeline = new TimelineConfiguration("tl-1", null, "animation", 2, false, "#stage", List.of(timelineAction));
        return new EngineConfiguration(
            "config-1",
            new EngineInfo("Eligius"),
            "body",
            "en-US",
            "default",
            cssFiles,
            List.of(new LanguageLabel("en", "English")),
            List.of(),
            actions,
            List.of(timeline));
    }

    @Test
    void shouldEmitEngineConfiguration() {
        // Given
        var emitter = new JsonEmitter(false);

        // When
        var json = emitter.emit(configuration(List.of("./main.css")));
        var root = JsonParser.parseString(json).getAsJsonObject();

        // Then
        assertEquals("config-1", root.get("id").getAsString());
        assertEquals("Eligius", root.getAsJsonObject("engine").get("systemName").getAsString());
        assertEquals("./main.css", root.getAsJsonArray("cssFiles").get(0).getAsString());
        assertEquals("en", root.getAsJsonArray("availableLanguages").get(0).getAsJsonObject().get("code").getAsString());
        assertTrue(root.getAsJsonArray("labels").isEmpty());
        assertTrue(root.getAsJsonArray("eventActions").isEmpty());

        var operation = root.getAsJsonArray("actions").get(0).getAsJsonObject()
            .getAsJsonArray("startOperations").get(0).getAsJsonObject();
        assertEquals("selectElement", operation.get("systemName").getAsString());
        assertEquals("#title", operation.getAsJsonObject("operationData").get("selector").getAsString());
    }

    @Test
    void shouldEmitTimelines() {
        var root = JsonEmitter.toJson(configuration(List.of()));

        var timeline = root.getAsJsonArray("timelines").get(0).getAsJsonObject();
        assertTrue(timeline.get("uri").isJsonNull());
        assertEquals("2", timeline.get("duration").toString());
        var duration = timeline.getAsJsonArray("timelineActions").get(0).getAsJsonObject().getAsJsonObject("duration");
        assertEquals("0", duration.get("start").toString());
        assertEquals("2", duration.get("end").toString());
    }

    @Test
    void shouldOmitEmptyCssFiles() {
        var root = JsonEmitter.toJson(configuration(List.of()));

        assertFalse(root.has("cssFiles"));
    }

    @Test
    void shouldNotEscapeHtml() {
        var json = new JsonEmitter(false).emit(configuration(List.of()));

        assertTrue(json.contains("<b>bold</b>"));
        assertTrue(json.contains("\"uri\":null"));
    }

    @Test
    void shouldPrettyPrint() {
        var json = new JsonEmitter(true).emit(configuration(List.of()));

        assertTrue(json.contains("\n  \"engine\": {"));
    }

    @Test
    void shouldWriteNonFiniteNumbersAsNull() {
        // Given
        var data = new JsonObject();
        data.add("milliseconds", JsonValues.asJson(Double.NaN));
        data.add("duration", JsonValues.asJsonNumber(Double.POSITIVE_INFINITY));
        var wait = new OperationConfiguration("op-2", "wait", data, List.of(), SourceLocation.NONE);
        var action = new ActionConfiguration("action-2", "pause", List.of(wait), List.of());
        var config = configuration(List.of(), action);

        // When
        var json = new JsonEmitter(false).emit(config);

        // Then
        assertFalse(json.contains("NaN"));
        assertFalse(json.contains("Infinity"));
        assertTrue(json.contains("\"milliseconds\":null"));
        assertTrue(json.contains("\"duration\":null"));
    }

}
