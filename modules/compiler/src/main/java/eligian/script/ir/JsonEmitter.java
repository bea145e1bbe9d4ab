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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Render an engine configuration as JSON.
 */
public class JsonEmitter {

    private final Gson gson;

    public JsonEmitter(boolean prettyPrint) {
        var builder = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls();
        if( prettyPrint )
            builder.setPrettyPrinting();
        this.gson = builder.create();
    }

    public String emit(EngineConfiguration config) {
        return gson.toJson(toJson(config));
    }

    public static JsonObject toJson(EngineConfiguration config) {
        var result = new JsonObject();
        result.addProperty("id", config.id());

        var engine = new JsonObject();
        engine.addProperty("systemName", config.engine().systemName());
        result.add("engine", engine);

        result.addProperty("containerSelector", config.containerSelector());
        result.addProperty("language", config.language());
        result.addProperty("layoutTemplate", config.layoutTemplate());

        if( !config.cssFiles().isEmpty() ) {
            var cssFiles = new JsonArray();
            for( var path : config.cssFiles() )
                cssFiles.add(path);
            result.add("cssFiles", cssFiles);
        }

        var languages = new JsonArray();
        for( var label : config.availableLanguages() ) {
            var obj = new JsonObject();
            obj.addProperty("code", label.code());
            obj.addProperty("label", label.label());
            languages.add(obj);
        }
        result.add("availableLanguages", languages);
        result.add("labels", new JsonArray());

        result.add("initActions", toJsonActions(config.initActions()));
        result.add("actions", toJsonActions(config.actions()));
        result.add("eventActions", new JsonArray());

        var timelines = new JsonArray();
        for( var timeline : config.timelines() )
            timelines.add(toJson(timeline));
        result.add("timelines", timelines);
        return result;
    }

    private static JsonArray toJsonActions(List<ActionConfiguration> actions) {
        var result = new JsonArray();
        for( var action : actions ) {
            var obj = new JsonObject();
            obj.addProperty("id", action.id());
            obj.addProperty("name", action.name());
            obj.add("startOperations", toJsonOperations(action.startOperations()));
            obj.add("endOperations", toJsonOperations(action.endOperations()));
            result.add(obj);
        }
        return result;
    }

    private static JsonObject toJson(TimelineConfiguration timeline) {
        var result = new JsonObject();
        result.addProperty("id", timeline.id());
        result.add("uri", timeline.uri() != null ? new JsonPrimitive(timeline.uri()) : JsonNull.INSTANCE);
        result.addProperty("type", timeline.type());
        result.add("duration", JsonValues.asJsonNumber(timeline.duration()));
        result.addProperty("loop", timeline.loop());
        result.addProperty("selector", timeline.selector());

        var timelineActions = new JsonArray();
        for( var action : timeline.timelineActions() ) {
            var obj = new JsonObject();
            obj.addProperty("id", action.id());
            obj.addProperty("name", action.name());
            var duration = new JsonObject();
            duration.add("start", JsonValues.asJsonNumber(action.start()));
            duration.add("end", JsonValues.asJsonNumber(action.end()));
            obj.add("duration", duration);
            obj.add("startOperations", toJsonOperations(action.startOperations()));
            obj.add("endOperations", toJsonOperations(action.endOperations()));
            timelineActions.add(obj);
        }
        result.add("timelineActions", timelineActions);
        return result;
    }

    private static JsonArray toJsonOperations(List<OperationConfiguration> operations) {
        var result = new JsonArray();
        for( var operation : operations ) {
            var obj = new JsonObject();
            obj.addProperty("id", operation.id());
            obj.addProperty("systemName", operation.systemName());
            obj.add("operationData", operation.operationData().deepCopy());
            result.add(obj);
        }
        return result;
    }

}
