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
package eligian.script.dataflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import eligian.script.ast.ActionDefinition;
import eligian.script.ast.Expression;
import eligian.script.ast.Parameter;
import eligian.script.ast.Statement;
import eligian.script.dsl.OperationRegistry;

/**
 * Check that every operation in a sequence finds its dependencies
 * on the operation data.
 *
 * Each sequence starts from a fresh tracker seeded with the
 * action's parameter names. If/else branches and loop bodies
 * run on clones that are merged at the join.
 */
public class DataFlowChecker {

    private final OperationRegistry registry;

    private List<MissingDependency> errors;

    public DataFlowChecker(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * Check each operation sequence of an action. The start and
     * end sequences of an endable action are checked separately.
     *
     * @param action
     */
    public List<MissingDependency> checkAction(ActionDefinition action) {
        var parameters = action.parameters().stream()
            .map(Parameter::name)
            .toList();
        var result = new ArrayList<MissingDependency>();
        for( var body : action.getBodies() )
            result.addAll(checkSequence(body, parameters));
        return result;
    }

    public List<MissingDependency> checkSequence(List<Statement> statements, Collection<String> initialProperties) {
        errors = new ArrayList<>();
        visit(statements, new OperationDataTracker(registry, initialProperties));
        var result = errors;
        errors = null;
        return result;
    }

    /**
     * Run a sequence on a tracker.
     *
     * @param statements
     * @param tracker
     * @return the tracker state after the sequence
     */
    private OperationDataTracker visit(List<Statement> statements, OperationDataTracker tracker) {
        for( var statement : statements )
            tracker = visit(statement, tracker);
        return tracker;
    }

    private OperationDataTracker visit(Statement node, OperationDataTracker tracker) {
        if( node instanceof Statement.OperationCall oc ) {
            visitOperationCall(oc, tracker);
            return tracker;
        }

        if( node instanceof Statement.IfStatement is ) {
            var thenState = visit(is.thenOperations(), tracker.clone());
            var elseState = visit(is.elseOperations(), tracker.clone());
            thenState.merge(elseState);
            return thenState;
        }

        if( node instanceof Statement.ForStatement fs ) {
            // the body may run zero times
            var bodyState = visit(fs.body(), tracker.clone());
            var result = tracker.clone();
            result.merge(bodyState);
            return result;
        }

        return tracker;
    }

    private void visitOperationCall(Statement.OperationCall node, OperationDataTracker tracker) {
        var name = node.operationName();
        for( var dependency : tracker.processOperation(name) ) {
            var removedBy = tracker.findErasurePoint(dependency);
            errors.add(new MissingDependency(name, dependency, removedBy, node.location()));
        }

        if( "removePropertiesFromOperationData".equals(name) ) {
            for( var property : getStringList(node, 0) )
                tracker.removeProperty(name, property);
        }
        else if( "clearOperationData".equals(name) ) {
            if( node.args().isEmpty() ) {
                tracker.clear(name);
            }
            else {
                for( var property : getStringList(node, 0) )
                    tracker.removeProperty(name, property);
            }
        }
        else if( "setOperationData".equals(name) ) {
            if( !node.args().isEmpty() && node.args().get(0) instanceof Expression.ObjectLiteral ol ) {
                for( var property : ol.properties().keySet() )
                    tracker.addProperty(name, property);
            }
        }
    }

    private static List<String> getStringList(Statement.OperationCall node, int index) {
        if( node.args().size() <= index )
            return Collections.emptyList();
        if( !(node.args().get(index) instanceof Expression.ArrayLiteral al) )
            return Collections.emptyList();
        var result = new ArrayList<String>();
        for( var element : al.elements() ) {
            if( element instanceof Expression.StringLiteral sl )
                result.add(sl.value());
        }
        return result;
    }

}
