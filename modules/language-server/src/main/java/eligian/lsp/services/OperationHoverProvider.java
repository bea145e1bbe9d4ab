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
package eligian.lsp.services;

import java.util.stream.Collectors;

import eligian.lsp.util.LanguageServerUtils;
import eligian.script.dsl.OperationParameter;
import eligian.script.dsl.OperationRegistry;
import eligian.script.dsl.OperationSignature;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;

/**
 * Describe the operation under the cursor.
 */
public class OperationHoverProvider {

    private final OperationRegistry registry;

    public OperationHoverProvider(OperationRegistry registry) {
        this.registry = registry;
    }

    public Hover hover(String text, Position position) {
        var name = LanguageServerUtils.getIdentifierAt(text, position);
        if( name == null )
            return null;
        return hover(name);
    }

    /**
     * Get the hover hint for an operation.
     *
     * @param operationName
     * @return the hint, or null if the name is not an operation
     */
    public Hover hover(String operationName) {
        var signature = registry.getOperationSignature(operationName);
        if( signature == null )
            return null;
        return new Hover(new MarkupContent(MarkupKind.MARKDOWN, getDocumentation(signature)));
    }

    public static String getDocumentation(OperationSignature signature) {
        var builder = new StringBuilder();
        builder.append("```eligian\n");
        builder.append(signature.toCallString());
        builder.append("\n```");

        if( signature.description() != null ) {
            builder.append("\n\n---\n\n");
            builder.append(signature.description());
        }

        if( !signature.parameters().isEmpty() ) {
            builder.append("\n\n**Parameters**\n");
            for( var param : signature.parameters() ) {
                builder.append("\n- ");
                builder.append(describe(param));
            }
        }

        if( !signature.dependencies().isEmpty() ) {
            builder.append("\n\n**Requires:** ");
            builder.append(signature.dependencies().stream()
                .map((dep) -> "`" + dep.name() + "`")
                .collect(Collectors.joining(", ")));
        }

        if( !signature.outputs().isEmpty() ) {
            builder.append("\n\n**Provides:** ");
            builder.append(signature.outputs().stream()
                .map((output) -> "`" + output.name() + "`")
                .collect(Collectors.joining(", ")));
        }

        return builder.toString();
    }

    private static String describe(OperationParameter param) {
        var builder = new StringBuilder();
        builder.append('`').append(param.name()).append("`: ");
        builder.append(param.type().describe());
        builder.append(param.required() ? " (required" : " (optional");
        if( param.erased() )
            builder.append(", erased");
        builder.append(')');
        if( param.description() != null && !param.description().isEmpty() )
            builder.append(" -- ").append(param.description());
        return builder.toString();
    }

}
