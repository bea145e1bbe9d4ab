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
import java.util.List;

import eligian.script.ast.ActionDefinition;
import eligian.script.ast.EventAction;
import eligian.script.ast.ScriptVisitorSupport;
import eligian.script.ast.Statement;
import eligian.script.ast.TimelineEvent;
import eligian.script.dataflow.DataFlowChecker;
import eligian.script.dataflow.MissingDependency;
import eligian.script.dsl.OperationRegistry;

import static eligian.script.control.CompilerDiagnostic.Phase;

/**
 * Report operations whose dependencies are not on the operation
 * data when they run.
 */
public class DataFlowCheckingVisitor extends ScriptVisitorSupport {

    private final DataFlowChecker checker;

    private final OperationValidator validator;

    private final DiagnosticCollector collector;

    public DataFlowCheckingVisitor(OperationRegistry registry, DiagnosticCollector collector) {
        this.checker = new DataFlowChecker(registry);
        this.validator = new OperationValidator(registry);
        this.collector = collector;
    }

    @Override
    public void visitAction(ActionDefinition node) {
        report(checker.checkAction(node));
    }

    @Override
    public void visitTimelineEvent(TimelineEvent node) {
        if( node.action() instanceof EventAction.InlineEndableAction iea ) {
            report(checker.checkSequence(iea.startOperations(), Collections.emptyList()));
            report(checker.checkSequence(iea.endOperations(), Collections.emptyList()));
        }
    }

    @Override
    public void visit(Statement node) {
        // sequences are checked as a whole
    }

    private void report(List<MissingDependency> errors) {
        for( var missing : errors ) {
            var error = validator.missingDependency(missing.operation(), missing.dependency());
            var hint = missing.removedBy() != null
                ? "'" + missing.dependency() + "' was removed by " + missing.removedBy()
                : error.hint();
            collector.addError(Phase.DATA_FLOW, error.code(), error.message(), hint, missing.location());
        }
    }

}
