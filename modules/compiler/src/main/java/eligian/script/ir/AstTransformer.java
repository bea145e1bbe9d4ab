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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import eligian.script.ast.ASTNodeStringUtils;
import eligian.script.ast.ActionDefinition;
import eligian.script.ast.DefaultImport;
import eligian.script.ast.EventAction;
import eligian.script.ast.Expression;
import eligian.script.ast.Expression.*;
import eligian.script.ast.Parameter;
import eligian.script.ast.Program;
import eligian.script.ast.SourceLocation;
import eligian.script.ast.Statement;
import eligian.script.ast.Statement.*;
import eligian.script.ast.Timeline;
import eligian.script.ast.TimelineEvent;
import eligian.script.constants.ConstantMap;
import eligian.script.constants.EvaluationResult;
import eligian.script.constants.ExpressionEvaluator;
import eligian.script.dsl.OperationRegistry;

/**
 * Lower a validated program to the engine configuration.
 *
 * Control flow is lowered to the engine's block operations,
 * folded constants are inlined and references are rewritten
 * to the engine's property chain syntax.
 */
public class AstTransformer {

    private static final Map<String,String> TIMELINE_TYPES = Map.of(
        "video", "mediaplayer",
        "audio", "mediaplayer",
        "raf", "animation"
    );

    private final OperationRegistry registry;

    private final ConstantMap constants;

    private final Defaults defaults;

    private Supplier<String> idSupplier = () -> UUID.randomUUID().toString();

    private final List<TransformError> errors = new ArrayList<>();

    private Map<String,List<String>> actionParameters = Collections.emptyMap();

    private Deque<String> loopVariables = new ArrayDeque<>();

    /**
     * Configuration values that the program does not declare.
     */
    public record Defaults(String engineSystemName, String containerSelector, String language, String layoutTemplate) {

        public static Defaults defaults() {
            return new Defaults("Eligius", "body", "en-US", "default");
        }
    }

    public AstTransformer(OperationRegistry registry, ConstantMap constants, Defaults defaults) {
        this.registry = registry;
        this.constants = constants;
        this.defaults = defaults;
    }

    public AstTransformer(OperationRegistry registry, ConstantMap constants) {
        this(registry, constants, Defaults.defaults());
    }

    public void setIdSupplier(Supplier<String> idSupplier) {
        this.idSupplier = idSupplier;
    }

    public List<TransformError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public EngineConfiguration transform(Program program) {
        actionParameters = new HashMap<>();
        for( var action : program.getActions() ) {
            var names = action.parameters().stream()
                .map(Parameter::name)
                .toList();
            actionParameters.put(action.name(), names);
        }

        var layoutTemplate = defaults.layoutTemplate();
        var cssFiles = new ArrayList<String>();
        for( var node : program.getDefaultImports() ) {
            if( node.kind() == DefaultImport.Kind.LAYOUT )
                layoutTemplate = node.path();
            else if( node.kind() == DefaultImport.Kind.STYLES )
                cssFiles.add(node.path());
        }

        var initActions = new ArrayList<ActionConfiguration>();
        var globalInit = transformUnfoldableConstants(program);
        if( globalInit != null )
            initActions.add(globalInit);

        var actions = new ArrayList<ActionConfiguration>();
        for( var action : program.getActions() )
            actions.add(transformAction(action));

        var timelines = new ArrayList<TimelineConfiguration>();
        for( var timeline : program.getTimelines() )
            timelines.add(transformTimeline(timeline));

        return new EngineConfiguration(
            idSupplier.get(),
            new EngineInfo(defaults.engineSystemName()),
            defaults.containerSelector(),
            defaults.language(),
            layoutTemplate,
            cssFiles,
            List.of(new LanguageLabel("en", "English")),
            initActions,
            actions,
            timelines
        );
    }

    /**
     * Constants that cannot be folded are stored in the global data
     * when the presentation starts, and read from there at runtime.
     */
    private ActionConfiguration transformUnfoldableConstants(Program program) {
        var properties = new JsonObject();
        for( var decl : program.getConstants() ) {
            if( constants.has(decl.name()) )
                continue;
            properties.add("globaldata." + decl.name(), transformExpression(decl.value()));
        }
        if( properties.size() == 0 )
            return null;

        var operationData = new JsonObject();
        operationData.add("properties", properties);
        var setData = new OperationConfiguration(idSupplier.get(), "setData", operationData, erasedParameters("setData", operationData), SourceLocation.NONE);
        return new ActionConfiguration(idSupplier.get(), "init-globaldata", List.of(setData), Collections.emptyList());
    }

    private ActionConfiguration transformAction(ActionDefinition action) {
        var bodies = action.getBodies();
        var startOperations = transformStatements(bodies.get(0));
        var endOperations = bodies.size() > 1
            ? transformStatements(bodies.get(1))
            : Collections.<OperationConfiguration>emptyList();

        return new ActionConfiguration(idSupplier.get(), action.name(), startOperations, endOperations);
    }

    private TimelineConfiguration transformTimeline(Timeline timeline) {
        var timelineActions = new ArrayList<TimelineActionConfiguration>();
        double duration = 0;
        for( var event : timeline.events() ) {
            timelineActions.add(transformTimelineEvent(event));
            duration = Math.max(duration, event.end());
        }

        var type = TIMELINE_TYPES.getOrDefault(timeline.provider(), timeline.provider());
        var selector = timeline.containerSelector() != null ? timeline.containerSelector() : "";
        return new TimelineConfiguration(idSupplier.get(), timeline.source(), type, duration, false, selector, timelineActions);
    }

    private TimelineActionConfiguration transformTimelineEvent(TimelineEvent event) {
        var startOperations = new ArrayList<OperationConfiguration>();
        var endOperations = new ArrayList<OperationConfiguration>();

        if( event.action() instanceof EventAction.NamedActionInvocation nai ) {
            var args = transformActionArguments(nai.actionName(), nai.args());
            startOperations.addAll(invokeAction(nai.actionName(), "startAction", args, nai.location()));
            endOperations.addAll(invokeAction(nai.actionName(), "endAction", args, nai.location()));
        }
        else if( event.action() instanceof EventAction.InlineEndableAction iea ) {
            startOperations.addAll(transformStatements(iea.startOperations()));
            endOperations.addAll(transformStatements(iea.endOperations()));
        }

        var name = "timeline-action-" + ASTNodeStringUtils.formatNumber(event.start()) + "-" + ASTNodeStringUtils.formatNumber(event.end());
        return new TimelineActionConfiguration(idSupplier.get(), name, event.start(), event.end(), startOperations, endOperations);
    }

    private List<OperationConfiguration> transformStatements(List<Statement> statements) {
        var result = new ArrayList<OperationConfiguration>();
        for( var statement : statements )
            transformStatement(statement, result);
        return result;
    }

    private void transformStatement(Statement node, List<OperationConfiguration> result) {
        if( node instanceof OperationCall oc ) {
            transformOperationCall(oc, result);
        }
        else if( node instanceof IfStatement is ) {
            var data = new JsonObject();
            data.addProperty("expression", toConditionString(is.condition()));
            result.add(operation("when", data, is.location()));
            for( var statement : is.thenOperations() )
                transformStatement(statement, result);
            if( is.hasElse() ) {
                result.add(operation("otherwise", new JsonObject(), is.location()));
                for( var statement : is.elseOperations() )
                    transformStatement(statement, result);
            }
            result.add(operation("endWhen", new JsonObject(), is.location()));
        }
        else if( node instanceof ForStatement fs ) {
            var data = new JsonObject();
            data.add("collection", transformExpression(fs.collection()));
            result.add(operation("forEach", data, fs.location()));
            loopVariables.push(fs.itemName());
            for( var statement : fs.body() )
                transformStatement(statement, result);
            loopVariables.pop();
            result.add(operation("endForEach", new JsonObject(), fs.location()));
        }
        else if( node instanceof BreakStatement bs ) {
            result.add(operation("breakForEach", new JsonObject(), bs.location()));
        }
        else if( node instanceof ContinueStatement cs ) {
            result.add(operation("continueForEach", new JsonObject(), cs.location()));
        }
    }

    private void transformOperationCall(OperationCall node, List<OperationConfiguration> result) {
        var name = node.operationName();

        // calls to custom actions
        if( actionParameters.containsKey(name) && !registry.hasOperation(name) ) {
            var args = transformActionArguments(name, node.args());
            result.addAll(invokeAction(name, "startAction", args, node.location()));
            return;
        }

        // addController(name) is sugar for getControllerInstance + addControllerToElement
        if( "addController".equals(name) ) {
            var data = new JsonObject();
            data.add("systemName", node.args().isEmpty() ? JsonNull.INSTANCE : transformExpression(node.args().get(0)));
            result.add(operation("getControllerInstance", data, node.location()));
            result.add(operation("addControllerToElement", new JsonObject(), node.location()));
            return;
        }

        var signature = registry.getOperationSignature(name);
        if( signature == null ) {
            errors.add(new TransformError("UNKNOWN_OPERATION", "Unknown operation: \"" + name + "\"", null, node.location()));
            return;
        }

        var args = new ArrayList<JsonElement>();
        for( var arg : node.args() )
            args.add(transformExpression(arg));

        var mapping = ParameterMapper.mapParameters(signature, args);
        if( !mapping.isSuccess() ) {
            for( var error : mapping.errors() )
                errors.add(new TransformError(error.code(), error.message(), error.hint(), node.location()));
            return;
        }

        result.add(operation(name, mapping.operationData(), node.location()));
    }

    private List<OperationConfiguration> invokeAction(String actionName, String operation, JsonObject args, SourceLocation location) {
        var request = new JsonObject();
        request.addProperty("systemName", actionName);
        var data = new JsonObject();
        if( args.size() > 0 )
            data.add("actionOperationData", args);
        return List.of(
            operation("requestAction", request, location),
            operation(operation, data, location)
        );
    }

    private JsonObject transformActionArguments(String actionName, List<Expression> args) {
        var result = new JsonObject();
        if( args.isEmpty() )
            return result;
        var parameters = findActionParameters(actionName);
        for( int i = 0; i < args.size() && i < parameters.size(); i++ )
            result.add(parameters.get(i), transformExpression(args.get(i)));
        return result;
    }

    private List<String> findActionParameters(String actionName) {
        return actionParameters.getOrDefault(actionName, Collections.emptyList());
    }

    private OperationConfiguration operation(String systemName, JsonObject operationData, SourceLocation location) {
        return new OperationConfiguration(idSupplier.get(), systemName, operationData, erasedParameters(systemName, operationData), location);
    }

    private List<String> erasedParameters(String systemName, JsonObject operationData) {
        var signature = registry.getOperationSignature(systemName);
        if( signature == null )
            return Collections.emptyList();
        return signature.getErasedParameterNames().stream()
            .filter(operationData::has)
            .toList();
    }

    /**
     * Convert an expression to the JSON value passed to the engine.
     *
     * @param node
     */
    public JsonElement transformExpression(Expression node) {
        if( node instanceof StringLiteral sl )
            return new JsonPrimitive(sl.value());

        if( node instanceof NumberLiteral nl )
            return JsonValues.asJsonNumber(nl.value());

        if( node instanceof BooleanLiteral bl )
            return new JsonPrimitive(bl.value());

        if( node instanceof NullLiteral )
            return JsonNull.INSTANCE;

        if( node instanceof ObjectLiteral ol ) {
            var result = new JsonObject();
            for( var entry : ol.properties().entrySet() )
                result.add(entry.getKey(), transformExpression(entry.getValue()));
            return result;
        }

        if( node instanceof ArrayLiteral al ) {
            var result = new JsonArray();
            for( var element : al.elements() )
                result.add(transformExpression(element));
            return result;
        }

        if( node instanceof ParameterReference pr )
            return new JsonPrimitive("$operationdata." + pr.name());

        if( node instanceof VariableReference vr )
            return transformVariableReference(vr.name());

        if( node instanceof PropertyChainReference pcr )
            return new JsonPrimitive(toPropertyChain(pcr));

        // fold operators over constants, otherwise pass an expression string
        var result = ExpressionEvaluator.evaluate(node, constants.asMap());
        if( result instanceof EvaluationResult.Success s )
            return JsonValues.asJson(s.value());
        return new JsonPrimitive(toConditionString(node));
    }

    private JsonElement transformVariableReference(String name) {
        if( loopVariables.contains(name) )
            return new JsonPrimitive("$context.currentItem");
        var constant = constants.get(name);
        if( constant != null )
            return JsonValues.asJson(constant.value());
        return new JsonPrimitive("$globaldata." + name);
    }

    private static String toPropertyChain(PropertyChainReference node) {
        return "$" + node.scope() + "." + String.join(".", node.properties());
    }

    /**
     * Render an expression in the engine's expression syntax, as
     * used by the {@code when} operation.
     *
     * @param node
     */
    public String toConditionString(Expression node) {
        if( node instanceof BinaryExpression be )
            return toConditionString(be.left()) + " " + be.operator() + " " + toConditionString(be.right());
        if( node instanceof UnaryExpression ue )
            return ue.operator() + toConditionString(ue.operand());
        if( node instanceof StringLiteral sl )
            return "'" + sl.value().replace("'", "\\'") + "'";

        var value = transformExpression(node);
        if( value.isJsonPrimitive() && value.getAsJsonPrimitive().isString() ) {
            var text = value.getAsString();
            return text.startsWith("$") ? text : "'" + text.replace("'", "\\'") + "'";
        }
        return value.toString();
    }

}
