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

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import eligian.script.ast.DefaultImport;
import eligian.script.ast.ImportStatement;
import eligian.script.ast.NamedImport;
import eligian.script.ast.Program;
import eligian.script.ast.ScriptVisitorSupport;
import eligian.script.ast.SourceLocation;
import eligian.script.dsl.OperationRegistry;
import eligian.script.imports.AssetTypeValidator;
import eligian.script.imports.DefaultImportValidator;
import eligian.script.imports.ImportNameValidator;
import eligian.script.imports.ImportPathValidator;
import eligian.script.imports.ImportValidationError;
import eligian.script.imports.ValidationConstants;

import static eligian.script.control.CompilerDiagnostic.Phase;

/**
 * Validate the import statements of a program.
 */
public class ImportCheckingVisitor extends ScriptVisitorSupport {

    private final Set<String> operationNames;

    private final DiagnosticCollector collector;

    private Map<DefaultImport,ImportValidationError.DuplicateDefaultImportError> duplicateDefaults = Collections.emptyMap();

    private Set<String> importNames = new HashSet<>();

    public ImportCheckingVisitor(OperationRegistry registry, DiagnosticCollector collector) {
        this.operationNames = new HashSet<>(registry.getAllOperationNames());
        this.collector = collector;
    }

    @Override
    public void visit(Program program) {
        duplicateDefaults = DefaultImportValidator.validateDefaultImports(program.getDefaultImports());
        super.visit(program);
    }

    @Override
    public void visitImport(ImportStatement node) {
        var pathError = ImportPathValidator.validateImportPath(node.path());
        if( pathError != null )
            addError(pathError, node.location());

        if( node instanceof DefaultImport di ) {
            var error = duplicateDefaults.get(di);
            if( error != null )
                addError(error, di.location());
        }
        else if( node instanceof NamedImport ni ) {
            var nameError = ImportNameValidator.validateImportName(ni.name(), importNames, ValidationConstants.RESERVED_KEYWORDS, operationNames);
            if( nameError != null )
                addError(nameError, ni.location());
            importNames.add(ni.name());

            var typeError = AssetTypeValidator.validateAssetType(ni);
            if( typeError != null )
                addError(typeError, ni.location());
        }
    }

    private void addError(ImportValidationError error, SourceLocation location) {
        collector.addError(Phase.IMPORTS, error.code().name(), error.message(), error.hint(), location);
    }

}
