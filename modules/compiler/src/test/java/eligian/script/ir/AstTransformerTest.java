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
import java.util.concurrent.atomic.AtomicInteger;

import eligian.script.ast.DefaultImport;
import eligian.script.ast.EventAction;
import eligian.script.ast.Program;
import eligian.script.ast.SourceLocation;
import eligian.script.ast.Statement;
import eligian.script.ast.Timeline;
import eligian.script.ast.TimelineEvent;
import eligian.script.constants.ConstantFolder;
import eligian.script.dsl.OperationRegistry;
import org.junit.jupiter.api.Test;

import static eligian.script.ast.ASTHelpers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lowering programs to the engine configuration.
 */
class AstTransformerTest {

    private AstTransformer transformer;

    private EngineConfiguration transform(Program program) {
        var counter = new AtomicInteger();
        transformer = new AstTransformer(OperationRegistry.getDefault(), ConstantFolder.buildConstantMap(program));
        transformer.setIdSupplier(() -> "id-" + counter.incrementAndGet());
        return transformer.transform(program);
    }

    private static List<String> systemNames(List<OperationConfiguration> operations) {
        return operations.stream()
            .map(OperationConfiguration::systemName)
            .toList();
    }

    private static Timeline timeline(String provider, String source, TimelineEvent... events) {
        return new Timeline("main", "#stage", provider, source, List.of(events), SourceLocation.NONE);
    }

    @Test
    void shouldUseDefaultsForEmptyProgram() {
        var config = transform(program());

        assertEquals("Eligius", config.engine().systemName());
        assertEquals("body", config.containerSelector());
        assertEquals("en-US", config.language());
        assertEquals("default", config.layoutTemplate());
        assertTrue(config.cssFiles().isEmpty());
        assertTrue(config.initActions().isEmpty());
        assertTrue(transformer.getErrors().isEmpty());
    }

    @Test
    void shouldTakeLayoutAndStylesFromImports() {
        var config = transform(program(
            defaultImport(DefaultImport.Kind.LAYOUT, "./layout.html"),
            defaultImport(DefaultImport.Kind.STYLES, "./main.css")));

        assertEquals("./layout.html", config.layoutTemplate());
        assertEquals(List.of("./main.css"), config.cssFiles());
    }

    @Test
    void shouldMapArgumentsToOperationData() {
        // Given
        var program = program(action("fadeIn", List.of(param("selector"), param("duration")),
            call("selectElement", paramRef("selector")),
            call("animate", obj("opacity", num(1)), paramRef("duration"))));

        // When
        var config = transform(program);

        // Then
        var action = config.actions().get(0);
        assertEquals("fadeIn", action.name());
        assertEquals(List.of("selectElement", "animate"), systemNames(action.startOperations()));
        var select = action.startOperations().get(0);
        assertEquals("$operationdata.selector", select.operationData().get("selector").getAsString());
        assertEquals(List.of("propertyName"), select.erasedParameters());
        var animate = action.startOperations().get(1).operationData();
        assertEquals("$operationdata.duration", animate.get("animationDuration").getAsString());
        assertEquals(1, animate.getAsJsonObject("animationProperties").get("opacity").getAsInt());
    }

    @Test
    void shouldLowerIfElseToWhenBlocks() {
        var program = program(action("toggle", List.of(param("visible")),
            ifStmt(binX(paramRef("visible"), "==", bool(true)),
                List.of(call("log", str("shown"))),
                List.of(call("log", str("hidden"))))));

        var operations = transform(program).actions().get(0).startOperations();

        assertEquals(List.of("when", "log", "otherwise", "log", "endWhen"), systemNames(operations));
        assertEquals("$operationdata.visible == true", operations.get(0).operationData().get("expression").getAsString());
    }

    @Test
    void shouldOmitOtherwiseWithoutElse() {
        var program = program(action("maybe", List.of(),
            ifStmt(bool(true), List.of(call("log", str("x"))), List.of())));

        var operations = transform(program).actions().get(0).startOperations();

        assertEquals(List.of("when", "log", "endWhen"), systemNames(operations));
    }

    @Test
    void shouldLowerForLoop() {
        var program = program(action("highlightAll", List.of(param("items")),
            forStmt("item", paramRef("items"),
                call("selectElement", varRef("item")),
                call("addClass", str("highlight")),
                new Statement.BreakStatement(SourceLocation.NONE))));

        var operations = transform(program).actions().get(0).startOperations();

        assertEquals(List.of("forEach", "selectElement", "addClass", "breakForEach", "endForEach"), systemNames(operations));
        assertEquals("$operationdata.items", operations.get(0).operationData().get("collection").getAsString());
        assertEquals("$context.currentItem", operations.get(1).operationData().get("selector").getAsString());
    }

    @Test
    void shouldInlineFoldedConstants() {
        var program = program(
            constant("duration", binX(num(250), "*", num(2))),
            action("pause", List.of(), call("wait", varRef("duration"))));

        var data = transform(program).actions().get(0).startOperations().get(0).operationData();

        assertEquals(500, data.get("milliseconds").getAsInt());
        assertEquals("500", data.get("milliseconds").toString());
    }

    @Test
    void shouldInitializeUnfoldableConstantsAsGlobalData() {
        // Given
        var program = program(
            constant("settings", obj("speed", num(2))),
            action("useSettings", List.of(), call("log", varRef("settings"))));

        // When
        var config = transform(program);

        // Then
        assertEquals(1, config.initActions().size());
        var init = config.initActions().get(0);
        assertEquals("init-globaldata", init.name());
        var setData = init.startOperations().get(0);
        assertEquals("setData", setData.systemName());
        var speed = setData.operationData().getAsJsonObject("properties").getAsJsonObject("globaldata.settings").get("speed");
        assertEquals(2, speed.getAsInt());
        var log = config.actions().get(0).startOperations().get(0);
        assertEquals("$globaldata.settings", log.operationData().get("logValue").getAsString());
    }

    @Test
    void shouldExpandAddController() {
        var program = program(action("attach", List.of(),
            call("selectElement", str("#box")),
            call("addController", str("LabelController"))));

        var operations = transform(program).actions().get(0).startOperations();

        assertEquals(List.of("selectElement", "getControllerInstance", "addControllerToElement"), systemNames(operations));
        assertEquals("LabelController", operations.get(1).operationData().get("systemName").getAsString());
    }

    @Test
    void shouldInvokeCustomActionFromAction() {
        var program = program(
            action("fadeIn", List.of(param("selector")), call("selectElement", paramRef("selector"))),
            action("intro", List.of(), call("fadeIn", str("#title"))));

        var operations = transform(program).actions().get(1).startOperations();

        assertEquals(List.of("requestAction", "startAction"), systemNames(operations));
        assertEquals("fadeIn", operations.get(0).operationData().get("systemName").getAsString());
        var data = operations.get(1).operationData().getAsJsonObject("actionOperationData");
        assertEquals("#title", data.get("selector").getAsString());
    }

    @Test
    void shouldLowerTimelineEvents() {
        // Given
        var named = new EventAction.NamedActionInvocation("fadeIn", List.of(str("#title")), SourceLocation.NONE);
        var inline = new EventAction.InlineEndableAction(
            List.of(call("selectElement", str("#credits"))),
            List.of(call("selectElement", str("#credits")), call("removeElement")),
            SourceLocation.NONE);
        var program = program(
            action("fadeIn", List.of(param("selector")), call("selectElement", paramRef("selector"))),
            timeline("video", "./intro.mp4",
                new TimelineEvent(0, 5, named, SourceLocation.NONE),
                new TimelineEvent(5, 12.5, inline, SourceLocation.NONE)));

        // When
        var timeline = transform(program).timelines().get(0);

        // Then
        assertEquals("mediaplayer", timeline.type());
        assertEquals("./intro.mp4", timeline.uri());
        assertEquals("#stage", timeline.selector());
        assertEquals(12.5, timeline.duration());
        var first = timeline.timelineActions().get(0);
        assertEquals("timeline-action-0-5", first.name());
        assertEquals(List.of("requestAction", "startAction"), systemNames(first.startOperations()));
        assertEquals(List.of("requestAction", "endAction"), systemNames(first.endOperations()));
        var second = timeline.timelineActions().get(1);
        assertEquals("timeline-action-5-12.5", second.name());
        assertEquals(List.of("selectElement", "removeElement"), systemNames(second.endOperations()));
    }

    @Test
    void shouldMapRafTimelineToAnimation() {
        var timeline = transform(program(timeline("raf", null))).timelines().get(0);

        assertEquals("animation", timeline.type());
        assertNull(timeline.uri());
        assertEquals(0, timeline.duration());
    }

    @Test
    void shouldReportMissingRequiredArgument() {
        transform(program(action("broken", List.of(), call("wait"))));

        assertEquals(1, transformer.getErrors().size());
        assertEquals(ParameterMapper.MAPPING_ERROR, transformer.getErrors().get(0).code());
    }

    @Test
    void shouldNotResolveVariableReferenceToParameter() {
        var program = program(action("a", List.of(param("delay")),
            call("wait", varRef("delay"))));

        var data = transform(program).actions().get(0).startOperations().get(0).operationData();

        assertEquals("$globaldata.delay", data.get("milliseconds").getAsString());
    }

}
