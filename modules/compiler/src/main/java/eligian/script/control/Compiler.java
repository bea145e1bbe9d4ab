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

import java.util.UUID;
import java.util.function.Supplier;

import eligian.script.ast.Program;
import eligian.script.constants.ConstantFolder;
import eligian.script.constants.ConstantMap;
import eligian.script.dsl.OperationRegistry;
import eligian.script.ir.AstTransformer;
import eligian.script.ir.JsonEmitter;

import static eligian.script.control.CompilerDiagnostic.Phase;

/**
 * Compile a parsed program to an engine configuration.
 *
 * Every check runs to completion and all diagnostics are
 * reported together. The program is only transformed when
 * no errors were found.
 */
public class Compiler {

    private final OperationRegistry registry;

    private final CompilerOptions options;

    private Supplier<String> idSupplier = () -> UUID.randomUUID().toString();

    public Compiler(OperationRegistry registry, CompilerOptions options) {
        this.registry = registry;
        this.options = options;
    }

    public Compiler() {
        this(OperationRegistry.getDefault(), CompilerOptions.defaults());
    }

    public void setIdSupplier(Supplier<String> idSupplier) {
        this.idSupplier = idSupplier;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Run every check on a program.
     *
     * @param program
     */
    public CompilationResult check(Program program) {
        var collector = new DiagnosticCollector();
        var constants = check(program, collector);
        return new CompilationResult(null, null, collector.getDiagnostics(), constants);
    }

    private ConstantMap check(Program program, DiagnosticCollector collector) {
        var constants = ConstantFolder.buildConstantMap(program);

        new ImportCheckingVisitor(registry, collector).visit(program);
        new OperationCheckingVisitor(registry, collector).visit(program);
        if( options.typeChecking() )
            new TypeCheckingVisitor(registry, constants, collector).visit(program);
        if( options.dataFlowChecking() )
            new DataFlowCheckingVisitor(registry, collector).visit(program);

        return constants;
    }

    /**
     * Check a program and, if it has no errors, transform it and
     * emit the engine configuration.
     *
     * @param program
     */
    public CompilationResult compile(Program program) {
        var collector = new DiagnosticCollector();
        var constants = check(program, collector);
        if( collector.hasErrors() )
            return new CompilationResult(null, null, collector.getDiagnostics(), constants);

        var defaults = new AstTransformer.Defaults(options.engineSystemName(), options.containerSelector(), options.language(), options.layoutTemplate());
        var transformer = new AstTransformer(registry, constants, defaults);
        transformer.setIdSupplier(idSupplier);
        var configuration = transformer.transform(program);
        for( var error : transformer.getErrors() )
            collector.addError(Phase.TRANSFORM, error.code(), error.message(), error.hint(), error.location());
        if( collector.hasErrors() )
            return new CompilationResult(null, null, collector.getDiagnostics(), constants);

        var json = new JsonEmitter(options.prettyPrint()).emit(configuration);
        return new CompilationResult(configuration, json, collector.getDiagnostics(), constants);
    }

}
