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
package eligian.script.control;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import eligian.script.ast.ActionDefinition;
import eligian.script.ast.EventAction;
import eligian.script.ast.Program;
import eligian.script.ast.ScriptVisitorSupport;
import eligian.script.ast.SourceLocation;
import eligian.script.ast.Statement;
import eligian.script.ast.TimelineEvent;
import eligian.script.dsl.OperationRegistry;
import eligian.script.util.StringSimilarity;

import static eligian.script.ast.ASTHelpers.*;
import static eligian.script.control.CompilerDiagnostic.Phase;

/**
 * Check that every operation call refers to a known operation
 * or action with the right number of arguments, and that block
 * operations are balanced.
 */
public class OperationCheckingVisitor extends ScriptVisitorSupport {

    public static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";

    public static final String DUPLICATE_ACTION = "DUPLICATE_ACTION";

    private final OperationRegistry registry;

    private final OperationValidator validator;

    private final DiagnosticCollector collector;

    private Map<String,ActionDefinition> actions = new HashMap<>();

    private int loopDepth;

    public OperationCheckingVisitor(OperationRegistry registry, DiagnosticCollector collector) {
        this.registry = registry;
        this.validator = new OperationValidator(registry);
        this.collector = collector;
    }

    @Override
    public void visit(Program program) {
        for( var action : program.getActions() ) {
            if( actions.containsKey(action.name()) ) {
                addError(DUPLICATE_ACTION, "Duplicate action '" + action.name() + "'", "Action names must be unique", action.location());
                continue;
            }
            if( registry.hasOperation(action.name()) ) {
                addWarning("ACTION_SHADOWS_OPERATION", "Action '" + action.name() + "' has the same name as a built-in operation", "Calls to '" + action.name() + "' will invoke the built-in operation", action.location());
            }
            actions.put(action.name(), action);
        }
        super.visit(program);
    }

    @Override
    public void visitAction(ActionDefinition node) {
        for( var body : node.getBodies() )
            checkControlFlowPairing(body, node.location());
        super.visitAction(node);
    }

    @Override
    public void visitTimelineEvent(TimelineEvent node) {
        if( node.action() instanceof EventAction.InlineEndableAction iea ) {
            checkControlFlowPairing(iea.startOperations(), iea.location());
            checkControlFlowPairing(iea.endOperations(), iea.location());
        }
        super.visitTimelineEvent(node);
    }

    @Override
    public void visitNamedActionInvocation(EventAction.NamedActionInvocation node) {
        var action = actions.get(node.actionName());
        if( action == null ) {
            var suggestions = StringSimilarity.findSimilar(node.actionName(), actions.keySet());
            var hint = suggestions.isEmpty() ? null : "Did you mean: " + String.join(", ", suggestions) + "?";
            addError(UNKNOWN_ACTION, "Unknown action: \"" + node.actionName() + "\"", hint, node.location());
        }
        else {
            checkActionArguments(action, node.args().size(), node.location());
        }
        super.visitNamedActionInvocation(node);
    }

    @Override
    public void visitOperationCall(Statement.OperationCall node) {
        var name = node.operationName();
        var action = actions.get(name);
        if( action != null && !registry.hasOperation(name) ) {
            checkActionArguments(action, node.args().size(), node.location());
        }
        else {
            var error = validator.validateOperationExists(name);
            if( error == null )
                error = validator.validateParameterCount(registry.getOperationSignature(name), node.args().size());
            if( error != null )
                addError(error, node.location());
        }
        super.visitOperationCall(node);
    }

    @Override
    public void visitForStatement(Statement.ForStatement node) {
        loopDepth++;
        super.visitForStatement(node);
        loopDepth--;
    }

    @Override
    public void visitBreakStatement(Statement.BreakStatement node) {
        if( loopDepth == 0 )
            addError(OperationValidationError.CONTROL_FLOW, "'break' can only be used inside a loop", "Move 'break' inside a 'for' loop", node.location());
    }

    @Override
    public void visitContinueStatement(Statement.ContinueStatement node) {
        if( loopDepth == 0 )
            addError(OperationValidationError.CONTROL_FLOW, "'continue' can only be used inside a loop", "Move 'continue' inside a 'for' loop", node.location());
    }

    private void checkActionArguments(ActionDefinition action, int argumentCount, SourceLocation location) {
        var expected = action.parameters().size();
        if( argumentCount == expected )
            return;
        var message = String.format("Action \"%s\" expects %d parameter(s), but got %d", action.name(), expected, argumentCount);
        var params = action.parameters().stream().map((p) -> p.name()).toList();
        addError(OperationValidationError.PARAMETER_COUNT, message, "Expected: " + action.name() + "(" + String.join(", ", params) + ")", location);
    }

    private void checkControlFlowPairing(List<Statement> statements, SourceLocation location) {
        var names = getOperationCalls(statements).stream()
            .map(Statement.OperationCall::operationName)
            .toList();
        for( var error : OperationValidator.validateControlFlowPairing(names) )
            addError(error, location);
    }

    private void addError(OperationValidationError error, SourceLocation location) {
        addError(error.code(), error.message(), error.hint(), location);
    }

    private void addError(String code, String message, String hint, SourceLocation location) {
        collector.addError(Phase.OPERATIONS, code, message, hint, location);
    }

    private void addWarning(String code, String message, String hint, SourceLocation location) {
        collector.addWarning(Phase.OPERATIONS, code, message, hint, location);
    }

}
