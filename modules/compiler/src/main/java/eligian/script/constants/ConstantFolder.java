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
package eligian.script.constants;

import java.util.LinkedHashMap;
import java.util.Set;

import eligian.script.ast.Program;
import eligian.script.types.EligianType;

/**
 * Fold the global constants of a program.
 *
 * Constants are evaluated in declaration order and may refer to
 * constants declared before them. Constants that cannot be
 * evaluated are kept as runtime variables.
 */
public class ConstantFolder {

    public static ConstantMap buildConstantMap(Program program) {
        var folded = new LinkedHashMap<String,ConstantValue>();
        var unfoldable = new LinkedHashMap<String,EvaluationError>();

        for( var decl : program.getConstants() ) {
            var result = ExpressionEvaluator.evaluate(decl.value(), folded, Set.of(decl.name()));
            if( result instanceof EvaluationResult.Success s ) {
                folded.put(decl.name(), new ConstantValue(decl.name(), s.value(), typeOf(s.value()), decl.location()));
            }
            else if( result instanceof EvaluationResult.Failure f ) {
                unfoldable.put(decl.name(), f.error());
            }
        }

        return new ConstantMap(folded, unfoldable);
    }

    private static EligianType typeOf(Object value) {
        if( value instanceof String )
            return EligianType.STRING;
        if( value instanceof Double )
            return EligianType.NUMBER;
        if( value instanceof Boolean )
            return EligianType.BOOLEAN;
        return EligianType.UNKNOWN;
    }

}
