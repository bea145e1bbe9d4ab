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
package eligian.script.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import eligian.script.ast.ActionDefinition;
import eligian.script.ast.Expression;
import eligian.script.ast.Parameter;
import eligian.script.dsl.OperationParameter;
import eligian.script.dsl.OperationRegistry;
import eligian.script.dsl.ParameterKind;
import eligian.script.dsl.ParameterType;

import static eligian.script.ast.ASTHelpers.*;

/**
 * Infer the types of action parameters from the way they are
 * passed to operations.
 *
 * Explicit type annotations take precedence over inferred types.
 */
public class TypeInference {

    private final OperationRegistry registry;

    private final Map<String,List<EligianType>> operationTypeCache = new HashMap<>();

    public TypeInference(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * Get the type of a literal expression. Non-literal
     * expressions are {@code unknown}.
     *
     * @param node
     */
    public static EligianType inferLiteralType(Expression node) {
        if( node instanceof Expression.StringLiteral )
            return EligianType.STRING;
        if( node instanceof Expression.NumberLiteral )
            return EligianType.NUMBER;
        if( node instanceof Expression.BooleanLiteral )
            return EligianType.BOOLEAN;
        if( node instanceof Expression.ObjectLiteral )
            return EligianType.OBJECT;
        if( node instanceof Expression.ArrayLiteral )
            return EligianType.ARRAY;
        return EligianType.UNKNOWN;
    }

    public static EligianType mapParameterTypeToEligianType(ParameterType type) {
        switch( type ) {
            case STRING:
            case SELECTOR:
            case CLASS_NAME:
            case HTML_ELEMENT_NAME:
            case HTML_CONTENT:
            case EVENT_TOPIC:
            case EVENT_NAME:
            case SYSTEM_NAME:
            case ACTION_NAME:
            case CONTROLLER_NAME:
            case URL:
            case LABEL_ID:
            case IMAGE_PATH:
            case QUADRANT_POSITION:
            case EXPRESSION:
            case MATH_FUNCTION:
                return EligianType.STRING;
            case NUMBER:
            case DIMENSIONS:
            case DIMENSIONS_MODIFIER:
                return EligianType.NUMBER;
            case BOOLEAN:
                return EligianType.BOOLEAN;
            case OBJECT:
            case JQUERY:
            case CSS_PROPERTIES:
            case ANIMATION_PROPERTIES:
                return EligianType.OBJECT;
            case ARRAY:
                return EligianType.ARRAY;
            default:
                return EligianType.UNKNOWN;
        }
    }

    /**
     * Get every type accepted by an operation parameter.
     * Constant-valued parameters accept strings.
     *
     * @param param
     */
    public static Set<EligianType> getAcceptedTypes(OperationParameter param) {
        if( param.type() instanceof ParameterKind.SemanticTypes st ) {
            var result = new LinkedHashSet<EligianType>();
            for( var type : st.types() )
                result.add(mapParameterTypeToEligianType(type));
            return result;
        }
        return EnumSet.of(EligianType.STRING);
    }

    /**
     * Get the primary type of each parameter of an operation, in
     * positional order. Multi-type parameters use their first type.
     *
     * @param operationName
     * @return the parameter types, or an empty list if the operation is unknown
     */
    public List<EligianType> getOperationParameterTypes(String operationName) {
        var cached = operationTypeCache.get(operationName);
        if( cached != null )
            return cached;

        var signature = registry.getOperationSignature(operationName);
        if( signature == null )
            return Collections.emptyList();

        var result = signature.parameters().stream()
            .map((param) -> getAcceptedTypes(param).iterator().next())
            .toList();
        operationTypeCache.put(operationName, result);
        return result;
    }

    /**
     * Collect a constraint for every place where an unannotated
     * parameter is passed directly to an operation.
     *
     * @param action
     */
    public Map<String,List<TypeConstraint>> collectParameterConstraints(ActionDefinition action) {
        var result = new LinkedHashMap<String,List<TypeConstraint>>();
        for( var param : action.parameters() ) {
            if( !param.hasTypeAnnotation() )
                result.put(param.name(), new ArrayList<>());
        }

        for( var body : action.getBodies() ) {
            for( var call : getOperationCalls(body) ) {
                var signature = registry.getOperationSignature(call.operationName());
                if( signature == null )
                    continue;
                var types = getOperationParameterTypes(call.operationName());
                var count = Math.min(call.args().size(), signature.parameters().size());
                for( int i = 0; i < count; i++ ) {
                    var name = getReferencedName(call.args().get(i));
                    if( name == null || !result.containsKey(name) )
                        continue;
                    var param = signature.parameters().get(i);
                    var source = call.operationName() + "(arg " + (i + 1) + ": " + param.name() + ")";
                    result.get(name).add(new TypeConstraint(name, types.get(i), source, call.args().get(i).location()));
                }
            }
        }
        return result;
    }

    private static String getReferencedName(Expression node) {
        if( node instanceof Expression.ParameterReference pr )
            return pr.name();
        return null;
    }

    /**
     * Unify the constraints on a parameter.
     *
     * No constraints (or only {@code unknown} constraints) resolve
     * to {@code unknown}. Constraints that agree resolve to their
     * common type. Otherwise the result is a conflict.
     *
     * @param constraints
     */
    public static Unification unifyConstraints(List<TypeConstraint> constraints) {
        var known = constraints.stream()
            .filter((c) -> c.expectedType() != EligianType.UNKNOWN)
            .toList();
        if( known.isEmpty() )
            return new Unification.Resolved(EligianType.UNKNOWN);

        var first = known.get(0).expectedType();
        if( known.stream().allMatch((c) -> c.expectedType() == first) )
            return new Unification.Resolved(first);

        var types = known.stream()
            .map((c) -> c.expectedType().displayName())
            .collect(Collectors.joining(" vs "));
        var sources = known.stream()
            .map(TypeConstraint::source)
            .collect(Collectors.joining(", "));
        var error = new TypeError(
            TypeError.TYPE_CONFLICT,
            "Parameter '" + known.get(0).parameter() + "' has conflicting type requirements: " + types,
            "Used as different types in: " + sources,
            known.get(0).location());
        return new Unification.Conflict(error);
    }

    /**
     * Resolve the type of every parameter of an action.
     *
     * @param action
     */
    public InferenceResult inferParameterTypes(ActionDefinition action) {
        var constraints = collectParameterConstraints(action);
        var types = new LinkedHashMap<String,EligianType>();
        var errors = new ArrayList<TypeError>();

        for( var param : action.parameters() ) {
            if( param.hasTypeAnnotation() ) {
                types.put(param.name(), resolveAnnotation(param, errors));
                continue;
            }
            var unification = unifyConstraints(constraints.get(param.name()));
            if( unification instanceof Unification.Resolved r ) {
                types.put(param.name(), r.type());
            }
            else if( unification instanceof Unification.Conflict c ) {
                types.put(param.name(), EligianType.UNKNOWN);
                errors.add(c.error());
            }
        }
        return new InferenceResult(types, errors);
    }

    private static EligianType resolveAnnotation(Parameter param, List<TypeError> errors) {
        var type = EligianType.fromName(param.typeAnnotation());
        if( type != null )
            return type;
        errors.add(new TypeError(
            TypeError.INVALID_TYPE_ANNOTATION,
            "Unknown type '" + param.typeAnnotation() + "'",
            "Valid types: string, number, boolean, object, array, unknown",
            param.location()));
        return EligianType.UNKNOWN;
    }

}
