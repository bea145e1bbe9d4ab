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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import eligian.script.ast.ActionDefinition;
import eligian.script.ast.EventAction;
import eligian.script.ast.Expression;
import eligian.script.ast.Program;
import eligian.script.ast.ScriptVisitorSupport;
import eligian.script.ast.Statement;
import eligian.script.constants.ConstantMap;
import eligian.script.dsl.OperationRegistry;
import eligian.script.dsl.ParameterKind;
import eligian.script.types.EligianType;
import eligian.script.types.InferenceResult;
import eligian.script.types.TypeCompatibility;
import eligian.script.types.TypeEnvironment;
import eligian.script.types.TypeError;
import eligian.script.types.TypeInference;

import static eligian.script.control.CompilerDiagnostic.Phase;

/**
 * Resolve the parameter types of every action and check the
 * arguments of every operation call against them.
 */
public class TypeCheckingVisitor extends ScriptVisitorSupport {

    private final OperationRegistry registry;

    private final TypeInference inference;

    private final ConstantMap constants;

    private final DiagnosticCollector collector;

    private Map<String,ActionDefinition> actions = new HashMap<>();

    private Map<String,InferenceResult> actionTypes = new HashMap<>();

    private TypeEnvironment environment = new TypeEnvironment();

    private Set<String> loopItems = new HashSet<>();

    public TypeCheckingVisitor(OperationRegistry registry, ConstantMap constants, DiagnosticCollector collector) {
        this.registry = registry;
        this.inference = new TypeInference(registry);
        this.constants = constants;
        this.collector = collector;
    }

    public Map<String,InferenceResult> getActionTypes() {
        return actionTypes;
    }

    @Override
    public void visit(Program program) {
        for( var action : program.getActions() ) {
            if( actionTypes.containsKey(action.name()) )
                continue;
            var result = inference.inferParameterTypes(action);
            for( var error : result.errors() )
                addError(error);
            actions.put(action.name(), action);
            actionTypes.put(action.name(), result);
        }
        super.visit(program);
    }

    @Override
    public void visitAction(ActionDefinition node) {
        var result = actionTypes.get(node.name());
        environment = new TypeEnvironment();
        if( result != null ) {
            for( var entry : result.types().entrySet() )
                environment.addVariable(entry.getKey(), entry.getValue());
        }
        super.visitAction(node);
        environment = new TypeEnvironment();
    }

    @Override
    public void visitNamedActionInvocation(EventAction.NamedActionInvocation node) {
        checkActionArguments(node.actionName(), node.args());
        super.visitNamedActionInvocation(node);
    }

    @Override
    public void visitForStatement(Statement.ForStatement node) {
        var saved = loopItems;
        loopItems = new HashSet<>(saved);
        loopItems.add(node.itemName());
        super.visitForStatement(node);
        loopItems = saved;
    }

    @Override
    public void visitOperationCall(Statement.OperationCall node) {
        var signature = registry.getOperationSignature(node.operationName());
        if( signature == null ) {
            checkActionArguments(node.operationName(), node.args());
        }
        else {
            var count = Math.min(node.args().size(), signature.parameters().size());
            for( int i = 0; i < count; i++ ) {
                var arg = node.args().get(i);
                var param = signature.parameters().get(i);
                var actual = getType(arg);
                var error = TypeCompatibility.validateTypeCompatibility(actual, TypeInference.getAcceptedTypes(param), arg.location());
                if( error != null ) {
                    addError(error);
                    continue;
                }
                if( param.type() instanceof ParameterKind.ConstantValues cv && arg instanceof Expression.StringLiteral sl && !cv.values().contains(sl.value()) ) {
                    addError(new TypeError(
                        TypeError.TYPE_MISMATCH,
                        "Invalid value '" + sl.value() + "' for parameter '" + param.name() + "'",
                        "Expected one of: " + String.join(", ", cv.values()),
                        arg.location()));
                }
            }
        }
        super.visitOperationCall(node);
    }

    private void checkActionArguments(String actionName, List<Expression> args) {
        var action = actions.get(actionName);
        var result = actionTypes.get(actionName);
        if( action == null || result == null )
            return;
        var count = Math.min(args.size(), action.parameters().size());
        for( int i = 0; i < count; i++ ) {
            var arg = args.get(i);
            var expected = result.getType(action.parameters().get(i).name());
            var error = TypeCompatibility.validateTypeCompatibility(getType(arg), expected, arg.location());
            if( error != null )
                addError(error);
        }
    }

    /**
     * Get the static type of an argument: literals have their own
     * type, parameters have their resolved type, variables are loop
     * items or folded constants.
     *
     * @param node
     */
    private EligianType getType(Expression node) {
        if( node instanceof Expression.ParameterReference pr ) {
            return environment.hasVariable(pr.name())
                ? environment.getVariableType(pr.name())
                : EligianType.UNKNOWN;
        }
        if( node instanceof Expression.VariableReference vr ) {
            if( loopItems.contains(vr.name()) )
                return EligianType.UNKNOWN;
            var constant = constants.get(vr.name());
            return constant != null ? constant.type() : EligianType.UNKNOWN;
        }
        return TypeInference.inferLiteralType(node);
    }

    private void addError(TypeError error) {
        collector.addError(Phase.TYPE_CHECKING, error.code(), error.message(), error.hint(), error.location());
    }

}
