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
package eligian.script.ast;

import java.util.List;

public interface ScriptVisitor {

    default void visit(Program program) {
        for( var element : program.elements() ) {
            if( element instanceof ImportStatement is )
                visitImport(is);
            else if( element instanceof ConstDeclaration cd )
                visitConstant(cd);
            else if( element instanceof ActionDefinition ad )
                visitAction(ad);
            else if( element instanceof Timeline tl )
                visitTimeline(tl);
        }
    }

    default void visitImport(ImportStatement node) {}

    default void visitConstant(ConstDeclaration node) {
        visit(node.value());
    }

    default void visitAction(ActionDefinition node) {
        for( var body : node.getBodies() )
            visit(body);
    }

    default void visitTimeline(Timeline node) {
        for( var event : node.events() )
            visitTimelineEvent(event);
    }

    default void visitTimelineEvent(TimelineEvent node) {
        if( node.action() instanceof EventAction.NamedActionInvocation nai ) {
            visitNamedActionInvocation(nai);
        }
        else if( node.action() instanceof EventAction.InlineEndableAction iea ) {
            visit(iea.startOperations());
            visit(iea.endOperations());
        }
    }

    default void visitNamedActionInvocation(EventAction.NamedActionInvocation node) {
        for( var arg : node.args() )
            visit(arg);
    }

    default void visit(List<Statement> statements) {
        for( var statement : statements )
            visit(statement);
    }

    void visit(Statement node);
    void visit(Expression node);

}
