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

import eligian.script.ast.Expression.*;
import eligian.script.ast.Statement.*;

/**
 * Visitor that walks every statement and expression of a
 * program. Subclasses override the callbacks they care about
 * and call {@code super} to keep walking.
 */
public abstract class ScriptVisitorSupport implements ScriptVisitor {

    @Override
    public void visit(Statement node) {
        if( node instanceof OperationCall oc )
            visitOperationCall(oc);
        else if( node instanceof IfStatement is )
            visitIfStatement(is);
        else if( node instanceof ForStatement fs )
            visitForStatement(fs);
        else if( node instanceof BreakStatement bs )
            visitBreakStatement(bs);
        else if( node instanceof ContinueStatement cs )
            visitContinueStatement(cs);
    }

    public void visitOperationCall(OperationCall node) {
        for( var arg : node.args() )
            visit(arg);
    }

    public void visitIfStatement(IfStatement node) {
        visit(node.condition());
        visit(node.thenOperations());
        visit(node.elseOperations());
    }

    public void visitForStatement(ForStatement node) {
        visit(node.collection());
        visit(node.body());
    }

    public void visitBreakStatement(BreakStatement node) {}

    public void visitContinueStatement(ContinueStatement node) {}

    @Override
    public void visit(Expression node) {
        if( node instanceof ObjectLiteral ol ) {
            for( var value : ol.properties().values() )
                visit(value);
        }
        else if( node instanceof ArrayLiteral al ) {
            for( var element : al.elements() )
                visit(element);
        }
        else if( node instanceof BinaryExpression be ) {
            visit(be.left());
            visit(be.right());
        }
        else if( node instanceof UnaryExpression ue ) {
            visit(ue.operand());
        }
        else if( node instanceof ParameterReference pr ) {
            visitParameterReference(pr);
        }
        else if( node instanceof VariableReference vr ) {
            visitVariableReference(vr);
        }
    }

    public void visitParameterReference(ParameterReference node) {}

    public void visitVariableReference(VariableReference node) {}

}
