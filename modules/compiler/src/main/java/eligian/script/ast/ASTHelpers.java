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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eligian.script.ast.Expression.*;
import eligian.script.ast.Statement.*;

/**
 * Factory and query helpers for AST nodes.
 *
 * Nodes created here have no source location.
 */
public class ASTHelpers {

    private static final SourceLocation NONE = SourceLocation.NONE;

    public static Program program(ProgramElement... elements) {
        return new Program(Arrays.asList(elements));
    }

    public static DefaultImport defaultImport(DefaultImport.Kind kind, String path) {
        return new DefaultImport(kind, path, NONE);
    }

    public static NamedImport namedImport(String name, String path, String assetType) {
        return new NamedImport(name, path, assetType, NONE);
    }

    public static ConstDeclaration constant(String name, Expression value) {
        return new ConstDeclaration(name, value, NONE);
    }

    public static Parameter param(String name) {
        return new Parameter(name, null, NONE);
    }

    public static Parameter param(String name, String typeAnnotation) {
        return new Parameter(name, typeAnnotation, NONE);
    }

    public static RegularActionDefinition action(String name, List<Parameter> parameters, Statement... operations) {
        return new RegularActionDefinition(name, parameters, Arrays.asList(operations), NONE);
    }

    public static EndableActionDefinition endableAction(String name, List<Parameter> parameters, List<Statement> startOperations, List<Statement> endOperations) {
        return new EndableActionDefinition(name, parameters, startOperations, endOperations, NONE);
    }

    public static OperationCall call(String name, Expression... args) {
        return new OperationCall(name, Arrays.asList(args), NONE);
    }

    public static IfStatement ifStmt(Expression condition, List<Statement> thenOperations, List<Statement> elseOperations) {
        return new IfStatement(condition, thenOperations, elseOperations, NONE);
    }

    public static ForStatement forStmt(String itemName, Expression collection, Statement... body) {
        return new ForStatement(itemName, collection, Arrays.asList(body), NONE);
    }

    public static StringLiteral str(String value) {
        return new StringLiteral(value, NONE);
    }

    public static NumberLiteral num(double value) {
        return new NumberLiteral(value, NONE);
    }

    public static BooleanLiteral bool(boolean value) {
        return new BooleanLiteral(value, NONE);
    }

    public static ObjectLiteral obj(Map<String,Expression> properties) {
        return new ObjectLiteral(properties, NONE);
    }

    public static ObjectLiteral obj(String key, Expression value) {
        var properties = new LinkedHashMap<String,Expression>();
        properties.put(key, value);
        return new ObjectLiteral(properties, NONE);
    }

    public static ArrayLiteral array(Expression... elements) {
        return new ArrayLiteral(Arrays.asList(elements), NONE);
    }

    public static ParameterReference paramRef(String name) {
        return new ParameterReference(name, NONE);
    }

    public static VariableReference varRef(String name) {
        return new VariableReference(name, NONE);
    }

    public static PropertyChainReference propertyChain(String scope, String... properties) {
        return new PropertyChainReference(scope, Arrays.asList(properties), NONE);
    }

    public static BinaryExpression binX(Expression left, String operator, Expression right) {
        return new BinaryExpression(operator, left, right, NONE);
    }

    public static UnaryExpression unaryX(String operator, Expression operand) {
        return new UnaryExpression(operator, operand, NONE);
    }

    public static boolean isLiteral(Expression node) {
        return node instanceof StringLiteral
            || node instanceof NumberLiteral
            || node instanceof BooleanLiteral
            || node instanceof NullLiteral
            || node instanceof ObjectLiteral
            || node instanceof ArrayLiteral;
    }

    /**
     * Get all operation calls in a sequence, including calls
     * nested in if/else branches and loop bodies, in source order.
     *
     * @param statements
     */
    public static List<OperationCall> getOperationCalls(List<Statement> statements) {
        var result = new ArrayList<OperationCall>();
        collectOperationCalls(statements, result);
        return result;
    }

    private static void collectOperationCalls(List<Statement> statements, List<OperationCall> result) {
        for( var statement : statements ) {
            if( statement instanceof OperationCall oc ) {
                result.add(oc);
            }
            else if( statement instanceof IfStatement is ) {
                collectOperationCalls(is.thenOperations(), result);
                collectOperationCalls(is.elseOperations(), result);
            }
            else if( statement instanceof ForStatement fs ) {
                collectOperationCalls(fs.body(), result);
            }
        }
    }

}
